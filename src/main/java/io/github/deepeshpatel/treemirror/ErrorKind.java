package io.github.deepeshpatel.treemirror;

/**
 * Failure kinds of a mirror run, each with its own process exit code.
 */
public enum ErrorKind {
    /** Source missing or not a directory, or destination already exists. */
    PATH(2),
    /** A worker could not write an artifact; the whole pool was aborted. */
    WORKER_WRITE(3),
    /** Results received differ in number from tasks submitted. */
    COUNT_MISMATCH(4),
    /** Source, destination and received results are not the same path set. */
    STRUCTURAL_MISMATCH(5),
    /** The run was interrupted. */
    CANCELLED(130);

    public static final int SUCCESS_EXIT_CODE = 0;

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
