package io.github.deepeshpatel.treemirror;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single channel every pipeline unit publishes its {@link LogRecord}s to.
 * <p>
 * The stream is ended exactly once with {@link #end()}. A record published after the end cannot be
 * drained by the aggregator any more, so it goes straight to the sink.
 */
public final class LogChannel {
    static final String UNIT_KEY = "unit";

    /**
     * Message carried by the log channel.
     */
    interface LogMessage {
        record Entry(LogRecord record) implements LogMessage { }

        record StreamEnd() implements LogMessage { }
    }

    private final MessageChannel<LogMessage> channel = MessageChannel.unbounded("log");
    private final AtomicBoolean ended = new AtomicBoolean();
    private final Logger sink;

    public LogChannel(Logger sink) {
        this.sink = sink;
    }

    public void publish(LogRecord record) {
        if (ended.get() || !channel.offer(new LogMessage.Entry(record))) {
            emit(sink, record);
        }
    }

    /**
     * Publishes the stream end marker.
     *
     * @return true if this call ended the stream
     */
    public boolean end() {
        if (!ended.compareAndSet(false, true)) {
            return false;
        }
        channel.offer(new LogMessage.StreamEnd());
        return true;
    }

    public boolean isEnded() {
        return ended.get();
    }

    public Logger sink() {
        return sink;
    }

    int pending() {
        return channel.size();
    }

    LogMessage take() throws InterruptedException {
        return channel.take();
    }

    LogMessage pollNow() {
        return channel.poll().orElse(null);
    }

    static void emit(Logger sink, LogRecord record) {
        MDC.put(UNIT_KEY, record.source());
        try {
            sink.atLevel(record.level())
                    .setCause(record.error())
                    .addKeyValue("at", record.timestamp())
                    .log(record.message());
        } finally {
            MDC.remove(UNIT_KEY);
        }
    }
}
