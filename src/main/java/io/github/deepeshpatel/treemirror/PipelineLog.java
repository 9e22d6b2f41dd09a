package io.github.deepeshpatel.treemirror;

import org.slf4j.event.Level;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

import java.time.Instant;

/**
 * Logger handle given to each pipeline unit at construction.
 * <p>
 * Messages use SLF4J's {@code {}} placeholders and a trailing throwable, are stamped with the unit's
 * identity and the current instant, and are published to the shared {@link LogChannel} instead of
 * being written directly.
 */
public final class PipelineLog {
    private final LogChannel channel;
    private final String source;
    private final Level threshold;

    public PipelineLog(LogChannel channel, String source, Level threshold) {
        this.channel = channel;
        this.source = source;
        this.threshold = threshold;
    }

    /**
     * A handle publishing to the same channel under another identity.
     */
    public PipelineLog forSource(String otherSource) {
        return new PipelineLog(channel, otherSource, threshold);
    }

    public String source() {
        return source;
    }

    public boolean isEnabled(Level level) {
        return level.toInt() >= threshold.toInt();
    }

    public void debug(String format, Object... args) {
        log(Level.DEBUG, format, args);
    }

    public void info(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        log(Level.WARN, format, args);
    }

    public void error(String format, Object... args) {
        log(Level.ERROR, format, args);
    }

    public void log(Level level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
        channel.publish(new LogRecord(level, source, Instant.now(), tuple.getMessage(), tuple.getThrowable()));
    }
}
