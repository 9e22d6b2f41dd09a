package io.github.deepeshpatel.treemirror;

import java.nio.file.Path;

/**
 * Source or destination path is unusable. Raised before anything is created.
 */
public class PathValidationException extends MirrorException {
    private final Path path;

    public PathValidationException(String message, Path path) {
        super(ErrorKind.PATH, message + ": " + path, null);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
