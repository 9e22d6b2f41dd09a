package io.github.deepeshpatel.treemirror;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-producer/single-consumer handoff: written exactly once, read exactly once.
 *
 * @param <T> the value type
 */
public final class OneShot<T> {
    private final CompletableFuture<T> value = new CompletableFuture<>();
    private final AtomicBoolean consumed = new AtomicBoolean();

    /**
     * @throws IllegalStateException if a value was already delivered
     */
    public void deliver(T item) {
        if (!value.complete(item)) {
            throw new IllegalStateException("Value already delivered");
        }
    }

    /**
     * Blocks until the value is delivered and consumes it.
     *
     * @throws IllegalStateException if the value was already consumed
     */
    public T await() throws InterruptedException {
        if (consumed.get()) {
            throw new IllegalStateException("Value already consumed");
        }
        T item;
        try {
            item = value.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("One-shot channel completed exceptionally", e.getCause());
        }
        markConsumed();
        return item;
    }

    /**
     * Consumes the value if it was delivered and nobody has read it yet.
     */
    public Optional<T> poll() {
        if (!value.isDone() || !consumed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        return Optional.ofNullable(value.getNow(null));
    }

    public boolean isDelivered() {
        return value.isDone();
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    private void markConsumed() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Value already consumed");
        }
    }
}
