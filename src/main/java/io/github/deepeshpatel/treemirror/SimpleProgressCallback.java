package io.github.deepeshpatel.treemirror;

/**
 * Utility class providing a simple progress callback that prints the stats of a mirror run.
 * Users can plug in their own callback instead.
 */
public class SimpleProgressCallback {
    /**
     * A simple progress callback that prints mirror progress to the console.
     * @param stats the current statistics of the mirror run
     */
    public static void simpleProgressCallback(MirrorStats stats) {
        long written = stats.getArtifactsWritten();
        long elapsedTime = stats.getElapsedTimeMillis();
        double rate = elapsedTime > 0 ? written * 1000.0 / elapsedTime : 0;

        System.out.printf(
                "Progress: %.2f%% (%d/%d artifacts written, %d skipped) | Data: %s | Rate: %.1f files/s | Elapsed: %d sec%n",
                stats.getProgressPercentage(), written, stats.getTasksPublished(), stats.getTasksSkipped(),
                formatSize(stats.getBytesWritten()), rate, elapsedTime / 1000
        );
    }

    public static String formatSize(long size) {
        return SizeFormatter.formatSize(size);
    }

    private static class SizeFormatter {
        private static final long BYTES_PER_KB = 1024L;
        private static final long BYTES_PER_MB = BYTES_PER_KB * 1024L;
        private static final long BYTES_PER_GB = BYTES_PER_MB * 1024L;

        /**
         * Formats a size in bytes into a human-readable string (e.g., "1.23 MB").
         *
         * @param size the size in bytes
         * @return a formatted string representing the size
         */
        static String formatSize(long size) {
            if (size < BYTES_PER_KB) {
                return String.format("%d B", size);
            } else if (size < BYTES_PER_MB) {
                return String.format("%.2f KB", size / (double) BYTES_PER_KB);
            } else if (size < BYTES_PER_GB) {
                return String.format("%.2f MB", size / (double) BYTES_PER_MB);
            }
            return String.format("%.2f GB", size / (double) BYTES_PER_GB);
        }
    }
}
