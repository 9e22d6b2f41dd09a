package io.github.deepeshpatel.treemirror;

import java.util.concurrent.atomic.LongAdder;

/**
 * Counters of one mirror run, updated concurrently by the host, the workers and the receiver.
 * Only classes in the same package can modify them.
 */
public final class MirrorStats {
    private final LongAdder tasksPublished = new LongAdder();
    private final LongAdder stopMarkersPublished = new LongAdder();
    private final LongAdder stopMarkersConsumed = new LongAdder();
    private final LongAdder tasksSkipped = new LongAdder();
    private final LongAdder artifactsWritten = new LongAdder();
    private final LongAdder bytesWritten = new LongAdder();
    private final LongAdder resultsPublished = new LongAdder();
    private final LongAdder resultsDropped = new LongAdder();
    private final LongAdder resultsReceived = new LongAdder();
    private final LongAdder workersJoined = new LongAdder();
    private final int poolSize;
    private volatile long startTime;
    private volatile long endTime = -1; // -1 indicates run in progress

    MirrorStats(int poolSize) {
        this.poolSize = poolSize;
    }

    // =======================
    // Public getters
    // =======================
    public int getPoolSize() { return poolSize; }
    public long getTasksPublished() { return tasksPublished.sum(); }
    public long getStopMarkersPublished() { return stopMarkersPublished.sum(); }
    public long getStopMarkersConsumed() { return stopMarkersConsumed.sum(); }
    public long getTasksSkipped() { return tasksSkipped.sum(); }
    public long getArtifactsWritten() { return artifactsWritten.sum(); }
    public long getBytesWritten() { return bytesWritten.sum(); }
    public long getResultsPublished() { return resultsPublished.sum(); }
    public long getResultsDropped() { return resultsDropped.sum(); }
    public long getResultsReceived() { return resultsReceived.sum(); }
    public long getWorkersJoined() { return workersJoined.sum(); }
    public long getStartTime() { return startTime; }
    public long getEndTime() { return endTime; }
    public long getElapsedTimeMillis() {
        if (startTime == 0) {
            return 0;
        }
        return endTime != -1 ? endTime - startTime : System.currentTimeMillis() - startTime;
    }

    public boolean isComplete() { return endTime != -1; }

    public double getProgressPercentage() {
        long published = tasksPublished.sum();
        return published > 0 ? (artifactsWritten.sum() * 100.0) / published : 0;
    }

    // =======================
    // Package-private modifiers
    // =======================
    void markStarted() {
        this.startTime = System.currentTimeMillis();
    }

    void markCompleted() {
        this.endTime = System.currentTimeMillis();
    }

    void incrementTasksPublished() { tasksPublished.increment(); }
    void incrementStopMarkersPublished() { stopMarkersPublished.increment(); }
    void incrementStopMarkersConsumed() { stopMarkersConsumed.increment(); }
    void incrementTasksSkipped() { tasksSkipped.increment(); }
    void incrementResultsPublished() { resultsPublished.increment(); }
    void incrementResultsDropped() { resultsDropped.increment(); }
    void incrementResultsReceived() { resultsReceived.increment(); }
    void incrementWorkersJoined() { workersJoined.increment(); }

    void recordArtifact(long bytes) {
        artifactsWritten.increment();
        bytesWritten.add(bytes);
    }

    // =======================
    // String representation
    // =======================
    @Override
    public String toString() {
        return "MirrorStats{" +
                "tasksPublished=" + tasksPublished +
                ", artifactsWritten=" + artifactsWritten +
                ", resultsReceived=" + resultsReceived +
                ", stopMarkersConsumed=" + stopMarkersConsumed +
                ", progress=" + String.format("%.1f%%", getProgressPercentage()) +
                '}';
    }

    public String getSummary() {
        return String.format(
                "Mirror Run Summary:\n" +
                        "-------------------\n" +
                        "Workers: %d (joined %d)\n" +
                        "Tasks: %d published | %d written | %d skipped (%.1f%%)\n" +
                        "Data: %s\n" +
                        "Results: %d published | %d received | %d dropped\n" +
                        "Stop markers: %d published | %d consumed\n" +
                        "Elapsed: %d ms\n" +
                        "Status: %s",
                getPoolSize(), getWorkersJoined(),
                getTasksPublished(), getArtifactsWritten(), getTasksSkipped(), getProgressPercentage(),
                SimpleProgressCallback.formatSize(getBytesWritten()),
                getResultsPublished(), getResultsReceived(), getResultsDropped(),
                getStopMarkersPublished(), getStopMarkersConsumed(),
                getElapsedTimeMillis(),
                isComplete() ? "COMPLETED" : "IN PROGRESS"
        );
    }
}
