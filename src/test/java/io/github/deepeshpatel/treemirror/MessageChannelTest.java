package io.github.deepeshpatel.treemirror;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MessageChannelTest {

    @Test
    @DisplayName("Receive hands out messages in FIFO order")
    void testFifo() throws Exception {
        MessageChannel<String> channel = MessageChannel.unbounded("test");
        CancellationSignal signal = new CancellationSignal();
        channel.publish("a");
        channel.publish("b");

        assertEquals("a", channel.receive(signal));
        assertEquals("b", channel.receive(signal));
        assertTrue(channel.isEmpty());
    }

    @Test
    @DisplayName("Receive still returns pending messages after cancellation")
    void testReceiveAfterCancellationDrainsFirst() throws Exception {
        MessageChannel<String> channel = MessageChannel.unbounded("test");
        CancellationSignal signal = new CancellationSignal();
        channel.publish("pending");
        signal.cancel(new InterruptedException());

        assertEquals("pending", channel.receive(signal));
        assertThrows(CancellationException.class, () -> channel.receive(signal));
    }

    @Test
    @DisplayName("Blocked receive is released by cancellation")
    void testBlockedReceiveReleased() throws Exception {
        MessageChannel<String> channel = MessageChannel.unbounded("test");
        CancellationSignal signal = new CancellationSignal();
        AtomicReference<Throwable> outcome = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                channel.receive(signal);
            } catch (Throwable t) {
                outcome.set(t);
            } finally {
                done.countDown();
            }
        });
        consumer.start();
        Thread.sleep(100);
        signal.cancel(new InterruptedException());

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, outcome.get());
    }

    @Test
    @DisplayName("Send to a full channel gives up after cancellation")
    void testSendGivesUpWhenFullAndCancelled() throws Exception {
        MessageChannel<String> channel = MessageChannel.bounded("test", 1);
        CancellationSignal signal = new CancellationSignal();
        assertTrue(channel.send("first", signal));

        signal.cancel(new InterruptedException());

        assertFalse(channel.send("second", signal));
        assertEquals(1, channel.size());
    }

    @Test
    @DisplayName("Offer does not block on a full channel")
    void testOfferOnFullChannel() {
        MessageChannel<String> channel = MessageChannel.bounded("test", 2);

        assertTrue(channel.offer("a"));
        assertTrue(channel.offer("b"));
        assertFalse(channel.offer("c"));
        assertEquals(2, channel.capacity());
    }

    @Test
    @DisplayName("Drain is bounded by the number of attempts")
    void testDrainBounded() {
        MessageChannel<Integer> channel = MessageChannel.unbounded("test");
        for (int i = 0; i < 10; i++) {
            channel.offer(i);
        }

        assertEquals(4, channel.drain(4));
        assertEquals(6, channel.size());
        assertEquals(6, channel.drain(100));
        assertEquals(0, channel.drain(100));
        assertTrue(channel.poll().isEmpty());
    }

    @Test
    @DisplayName("Bounded channel needs a positive capacity")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> MessageChannel.bounded("test", 0));
    }
}
