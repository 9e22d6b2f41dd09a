package io.github.deepeshpatel.treemirror;

import io.github.deepeshpatel.treemirror.LogChannel.LogMessage;

import java.util.concurrent.atomic.LongAdder;

/**
 * Sole consumer of the {@link LogChannel}: drains records published concurrently by the host, the
 * workers and the receiver, and writes them to the sink one at a time in channel order.
 * Stops on the stream end marker.
 */
public final class LogAggregator implements Runnable {
    private final LogChannel channel;
    private final LongAdder emitted = new LongAdder();

    public LogAggregator(LogChannel channel) {
        this.channel = channel;
    }

    @Override
    public void run() {
        try {
            while (true) {
                LogMessage message = channel.take();
                if (message instanceof LogMessage.StreamEnd) {
                    break;
                }
                emit(((LogMessage.Entry) message).record());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.sink().warn("Log aggregator interrupted, flushing {} pending records", channel.pending());
        }
        flushLateRecords();
    }

    public long emittedCount() {
        return emitted.sum();
    }

    // records that raced with the stream end marker
    private void flushLateRecords() {
        LogMessage message;
        while ((message = channel.pollNow()) != null) {
            if (message instanceof LogMessage.Entry entry) {
                emit(entry.record());
            }
        }
    }

    private void emit(LogRecord record) {
        LogChannel.emit(channel.sink(), record);
        emitted.increment();
    }
}
