package io.github.deepeshpatel.treemirror;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Result of an uninterrupted mirror run. Count and structural mismatches are reported here
 * rather than thrown.
 *
 * @param source         absolute source root
 * @param destination    absolute destination root
 * @param tasksSubmitted number of tasks the host published
 * @param results        collection delivered by the receiver
 * @param verification   outcome of the final verification
 * @param stats          run counters
 */
public record MirrorReport(Path source, Path destination, long tasksSubmitted, ResultCollection results,
                           VerificationReport verification, MirrorStats stats) {

    public boolean countMatches() {
        return results.size() == tasksSubmitted;
    }

    public boolean isSuccessful() {
        return countMatches() && verification.consistent();
    }

    /**
     * The most specific failure of the run; count mismatch takes precedence.
     */
    public Optional<ErrorKind> errorKind() {
        if (!countMatches()) {
            return Optional.of(ErrorKind.COUNT_MISMATCH);
        }
        if (!verification.consistent()) {
            return Optional.of(ErrorKind.STRUCTURAL_MISMATCH);
        }
        return Optional.empty();
    }

    public int exitCode() {
        return errorKind().map(ErrorKind::exitCode).orElse(ErrorKind.SUCCESS_EXIT_CODE);
    }
}
