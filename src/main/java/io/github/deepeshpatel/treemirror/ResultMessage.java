package io.github.deepeshpatel.treemirror;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Message carried by the result queue: a {@link Completed} artifact or the single {@link StreamEnd}
 * marker that ends the receiver's loop.
 */
public interface ResultMessage {

    StreamEnd END = new StreamEnd();

    static Completed completed(Path absolutePath) {
        return new Completed(absolutePath);
    }

    record Completed(Path absolutePath) implements ResultMessage {
        public Completed {
            Objects.requireNonNull(absolutePath, "absolutePath");
        }
    }

    record StreamEnd() implements ResultMessage { }
}
