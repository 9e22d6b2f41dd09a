package io.github.deepeshpatel.treemirror;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link TreeVerifier#verify}.
 *
 * @param consistent       true if source, destination and results are the same sorted path list
 * @param sourceCount      number of files below the source root
 * @param destinationCount number of files below the destination root
 * @param resultCount      number of received results
 * @param firstDivergence  index of the first differing row, or -1 when consistent
 * @param divergences      index-aligned rows starting at {@code firstDivergence}
 */
public record VerificationReport(boolean consistent, int sourceCount, int destinationCount, int resultCount,
                                 int firstDivergence, List<Divergence> divergences) {

    /**
     * One index-aligned row of the three sorted lists. A null entry means that list is shorter.
     */
    public record Divergence(int index, Path source, Path destination, Path result) {
        @Override
        public String toString() {
            return String.format("%d: \"%s\", \"%s\", \"%s\"", index, source, destination, result);
        }
    }

    static VerificationReport success(int count) {
        return new VerificationReport(true, count, count, count, -1, List.of());
    }
}
