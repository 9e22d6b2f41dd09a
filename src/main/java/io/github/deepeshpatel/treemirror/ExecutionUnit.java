package io.github.deepeshpatel.treemirror;

import java.time.Duration;

/**
 * A concurrently running piece of the pipeline, independent of what backs it.
 *
 * @see ExecutionUnitKind
 */
public interface ExecutionUnit {

    String name();

    /**
     * Starts the unit. A unit can be started once.
     */
    void start();

    /**
     * Waits until the unit has finished. Returns immediately for a unit that was never started.
     */
    void join() throws InterruptedException;

    /**
     * Waits up to the given time for the unit to finish.
     *
     * @return true if the unit is no longer running
     */
    boolean join(Duration timeout) throws InterruptedException;

    boolean isAlive();
}
