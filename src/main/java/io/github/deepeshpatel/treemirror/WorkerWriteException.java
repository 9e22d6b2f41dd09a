package io.github.deepeshpatel.treemirror;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A worker failed to write an artifact. The worker terminates and the whole pool is aborted.
 */
public class WorkerWriteException extends MirrorException {
    private final String worker;
    private final Path relativePath;

    public WorkerWriteException(String worker, Path relativePath, IOException cause) {
        super(ErrorKind.WORKER_WRITE,
                String.format("%s failed to write %s: %s", worker, relativePath, cause.getMessage()), cause);
        this.worker = worker;
        this.relativePath = relativePath;
    }

    public String getWorker() {
        return worker;
    }

    public Path getRelativePath() {
        return relativePath;
    }
}
