package io.github.deepeshpatel.treemirror;

/**
 * Base of the fatal failures of a mirror run.
 */
public abstract class MirrorException extends Exception {
    private final ErrorKind kind;

    protected MirrorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
