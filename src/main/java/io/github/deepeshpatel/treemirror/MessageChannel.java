package io.github.deepeshpatel.treemirror;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A named multi-producer/multi-consumer channel on top of a {@link BlockingQueue}.
 * <p>
 * Besides the plain blocking operations, {@link #send(Object, CancellationSignal)} and
 * {@link #receive(CancellationSignal)} wait in short slices and give up once the run is cancelled,
 * so no producer or consumer can stay blocked on a channel that nobody services any more.
 *
 * @param <T> the message type
 */
public final class MessageChannel<T> {
    static final long WAIT_SLICE_MILLIS = 50;

    private final String name;
    private final int capacity;
    private final BlockingQueue<T> queue;

    private MessageChannel(String name, int capacity) {
        this.name = name;
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    public static <T> MessageChannel<T> unbounded(String name) {
        return new MessageChannel<>(name, Integer.MAX_VALUE);
    }

    public static <T> MessageChannel<T> bounded(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        return new MessageChannel<>(name, capacity);
    }

    /**
     * Blocking put. Never blocks on an unbounded channel.
     */
    public void publish(T message) throws InterruptedException {
        queue.put(message);
    }

    /**
     * Non-blocking put.
     *
     * @return false if the channel is full
     */
    public boolean offer(T message) {
        return queue.offer(message);
    }

    /**
     * Puts the message, waiting for space until the signal is cancelled.
     *
     * @return true if the message was enqueued, false if the run was cancelled while the channel was full
     */
    public boolean send(T message, CancellationSignal signal) throws InterruptedException {
        while (!queue.offer(message, WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
            if (signal.isCancelled()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Takes the next message, waiting until one arrives or the run is cancelled.
     * Messages already in the channel are still handed out after cancellation.
     *
     * @throws CancellationException if the run is cancelled and the channel is empty
     */
    public T receive(CancellationSignal signal) throws InterruptedException {
        while (true) {
            T message = queue.poll(WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS);
            if (message != null) {
                return message;
            }
            if (signal.isCancelled()) {
                throw new CancellationException("Channel " + name + " cancelled while empty");
            }
        }
    }

    public T take() throws InterruptedException {
        return queue.take();
    }

    public Optional<T> poll() {
        return Optional.ofNullable(queue.poll());
    }

    /**
     * Removes pending messages without blocking.
     *
     * @param maxAttempts upper bound on the number of poll attempts
     * @return the number of messages removed
     */
    public int drain(int maxAttempts) {
        int drained = 0;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (queue.poll() == null) {
                break;
            }
            drained++;
        }
        return drained;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "MessageChannel{" + name + ", size=" + queue.size() + '}';
    }
}
