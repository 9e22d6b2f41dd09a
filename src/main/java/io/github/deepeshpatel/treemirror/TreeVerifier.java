package io.github.deepeshpatel.treemirror;

import io.github.deepeshpatel.treemirror.VerificationReport.Divergence;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a finished mirror run against fresh listings of both trees.
 * <p>
 * The source and destination are enumerated again, independently of the recorded results, and the
 * three sorted lists must be equal. Order of arrival is never compared, only sorted content.
 */
public final class TreeVerifier {
    static final int DIVERGENCE_WINDOW = 20;

    private TreeVerifier() {
    }

    public static VerificationReport verify(Path source, Path destination, ResultCollection results)
            throws IOException {
        return compare(SourceTreeWalker.listFiles(source), SourceTreeWalker.listFiles(destination),
                results.sortedPaths());
    }

    /**
     * Compares three path lists after sorting them.
     */
    public static VerificationReport compare(List<Path> source, List<Path> destination, List<Path> results) {
        List<Path> s = sorted(source);
        List<Path> d = sorted(destination);
        List<Path> r = sorted(results);
        if (s.equals(d) && d.equals(r)) {
            return VerificationReport.success(s.size());
        }

        int rows = Math.max(s.size(), Math.max(d.size(), r.size()));
        int first = 0;
        while (first < rows && rowMatches(s, d, r, first)) {
            first++;
        }
        List<Divergence> window = new ArrayList<>();
        for (int i = first; i < rows && window.size() < DIVERGENCE_WINDOW; i++) {
            window.add(new Divergence(i, at(s, i), at(d, i), at(r, i)));
        }
        return new VerificationReport(false, s.size(), d.size(), r.size(), first, List.copyOf(window));
    }

    private static boolean rowMatches(List<Path> s, List<Path> d, List<Path> r, int i) {
        Path source = at(s, i);
        return Objects.equals(source, at(d, i)) && Objects.equals(source, at(r, i));
    }

    private static Path at(List<Path> paths, int i) {
        return i < paths.size() ? paths.get(i) : null;
    }

    private static List<Path> sorted(List<Path> paths) {
        List<Path> copy = new ArrayList<>(paths);
        copy.sort(null);
        return copy;
    }
}
