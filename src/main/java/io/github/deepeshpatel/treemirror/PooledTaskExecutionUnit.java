package io.github.deepeshpatel.treemirror;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Execution unit backed by a task on a shared {@link ExecutorService}.
 * <p>
 * The pool must be able to run every long-lived unit submitted to it at the same time; a fixed pool
 * smaller than the number of such units starves the ones queued behind them.
 */
public final class PooledTaskExecutionUnit extends AbstractExecutionUnit {
    private final ExecutorService pool;
    private volatile Future<?> future;

    public PooledTaskExecutionUnit(String name, Runnable body, ExecutorService pool) {
        super(name, body);
        this.pool = pool;
    }

    @Override
    protected void launch(Runnable guardedBody) {
        future = pool.submit(guardedBody);
    }

    @Override
    public void join() throws InterruptedException {
        Future<?> f = future;
        if (f == null) {
            return;
        }
        try {
            f.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unguarded failure in " + name(), e.getCause());
        }
    }

    @Override
    public boolean join(Duration timeout) throws InterruptedException {
        Future<?> f = future;
        if (f == null) {
            return true;
        }
        try {
            f.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unguarded failure in " + name(), e.getCause());
        } catch (TimeoutException e) {
            return false;
        }
        return true;
    }

    @Override
    public boolean isAlive() {
        Future<?> f = future;
        return f != null && !f.isDone();
    }
}
