package io.github.deepeshpatel.treemirror;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tree-relative paths of the artifacts confirmed to the receiver, in arrival order.
 * Arrival order carries no meaning; compare through {@link #sortedPaths()}.
 * A duplicated confirmation is kept, so it shows up in {@link #size()}.
 */
public final class ResultCollection {
    private final List<Path> paths;
    private final boolean complete;

    public ResultCollection(List<Path> paths, boolean complete) {
        this.paths = List.copyOf(paths);
        this.complete = complete;
    }

    public int size() {
        return paths.size();
    }

    public List<Path> paths() {
        return paths;
    }

    public List<Path> sortedPaths() {
        List<Path> sorted = new ArrayList<>(paths);
        sorted.sort(null);
        return sorted;
    }

    /**
     * @return false if the receiver was cancelled before it saw the end of the result stream
     */
    public boolean isComplete() {
        return complete;
    }

    @Override
    public String toString() {
        return "ResultCollection{size=" + paths.size() + ", complete=" + complete + '}';
    }
}
