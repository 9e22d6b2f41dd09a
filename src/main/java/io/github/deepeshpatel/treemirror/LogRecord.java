package io.github.deepeshpatel.treemirror;

import org.slf4j.event.Level;

import java.time.Instant;

/**
 * One diagnostic record travelling through the log channel.
 *
 * @param level     severity
 * @param source    identity of the producing unit, e.g. {@code worker-2}
 * @param timestamp when the producer created the record
 * @param message   fully formatted message
 * @param error     attached throwable, may be null
 */
public record LogRecord(Level level, String source, Instant timestamp, String message, Throwable error) {
}
