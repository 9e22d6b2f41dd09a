package io.github.deepeshpatel.treemirror;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Message carried by the work queue: either a {@link Task} naming one artifact to create,
 * or a {@link Stop} marker telling exactly one worker to finish.
 */
public interface WorkMessage {

    Stop STOP = new Stop();

    static Task task(Path relativePath) {
        return new Task(relativePath);
    }

    /**
     * A tree-relative path of the artifact to create.
     */
    record Task(Path relativePath) implements WorkMessage {
        public Task {
            Objects.requireNonNull(relativePath, "relativePath");
            if (relativePath.isAbsolute()) {
                throw new IllegalArgumentException("Task path must be relative: " + relativePath);
            }
        }
    }

    /**
     * Per-worker termination marker. Each instance is consumed by exactly one worker.
     */
    record Stop() implements WorkMessage { }
}
