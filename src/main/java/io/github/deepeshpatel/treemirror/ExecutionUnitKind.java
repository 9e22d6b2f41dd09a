package io.github.deepeshpatel.treemirror;

import java.util.concurrent.ExecutorService;

/**
 * Selects how an {@link ExecutionUnit} is backed. Chosen once, when the pipeline is built.
 */
public enum ExecutionUnitKind {
    /** A dedicated platform thread. */
    THREAD {
        @Override
        public ExecutionUnit create(String name, Runnable body, ExecutorService pool) {
            return new ThreadExecutionUnit(name, body);
        }
    },
    /** A task on the run's shared pool. */
    POOLED_TASK {
        @Override
        public ExecutionUnit create(String name, Runnable body, ExecutorService pool) {
            return new PooledTaskExecutionUnit(name, body, pool);
        }
    };

    public abstract ExecutionUnit create(String name, Runnable body, ExecutorService pool);
}
