package io.github.deepeshpatel.treemirror;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared cancellation signal of one mirror run.
 * <p>
 * The first {@link #cancel(Throwable)} wins: it records the cause, releases every thread waiting in
 * {@link #await(Duration)} and interrupts the host thread that owns the pipeline, so that the host
 * leaves whatever blocking call it is in and runs the shutdown protocol. Channel waits poll
 * {@link #isCancelled()} between short slices.
 */
public final class CancellationSignal {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private Thread owner;
    private Throwable cause;

    /**
     * Makes {@code thread} the host thread interrupted on cancellation.
     */
    public synchronized void bindOwner(Thread thread) {
        this.owner = thread;
    }

    /**
     * Cancels the run.
     *
     * @param cause the reason, re-thrown by the host after teardown
     * @return true if this call cancelled the run, false if it was already cancelled
     */
    public boolean cancel(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        Thread toInterrupt;
        synchronized (this) {
            if (this.cause != null) {
                return false;
            }
            this.cause = cause;
            toInterrupt = owner;
            cancelled.countDown();
        }
        if (toInterrupt != null && toInterrupt != Thread.currentThread()) {
            toInterrupt.interrupt();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public synchronized Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Waits up to the given time for cancellation.
     *
     * @return true if the run was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Stops interrupting the owner thread. Called once the host no longer waits on the pipeline.
     */
    synchronized void disarm() {
        owner = null;
    }
}
