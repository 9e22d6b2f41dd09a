package io.github.deepeshpatel.treemirror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Common bookkeeping of the execution unit variants: single start and capture of an unexpected failure.
 * A failure ends the unit like a normal return, so joining never rethrows it.
 */
abstract class AbstractExecutionUnit implements ExecutionUnit {
    private static final Logger logger = LoggerFactory.getLogger(AbstractExecutionUnit.class);

    private final String name;
    private final Runnable body;
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile Throwable failure;

    AbstractExecutionUnit(String name, Runnable body) {
        this.name = name;
        this.body = body;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public final void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Execution unit already started: " + name);
        }
        launch(this::runGuarded);
    }

    protected abstract void launch(Runnable guardedBody);

    boolean isStarted() {
        return started.get();
    }

    /**
     * The throwable that escaped the unit's body, if any.
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    private void runGuarded() {
        try {
            body.run();
        } catch (RuntimeException | Error e) {
            failure = e;
            logger.error("Execution unit {} failed", name, e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + '}';
    }
}
