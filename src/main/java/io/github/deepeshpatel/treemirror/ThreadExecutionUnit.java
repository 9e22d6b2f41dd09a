package io.github.deepeshpatel.treemirror;

import java.time.Duration;

/**
 * Execution unit backed by a dedicated platform thread.
 */
public final class ThreadExecutionUnit extends AbstractExecutionUnit {
    private volatile Thread thread;

    public ThreadExecutionUnit(String name, Runnable body) {
        super(name, body);
    }

    @Override
    protected void launch(Runnable guardedBody) {
        Thread t = new Thread(guardedBody, name());
        thread = t;
        t.start();
    }

    @Override
    public void join() throws InterruptedException {
        Thread t = thread;
        if (t != null) {
            t.join();
        }
    }

    @Override
    public boolean join(Duration timeout) throws InterruptedException {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    @Override
    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }
}
