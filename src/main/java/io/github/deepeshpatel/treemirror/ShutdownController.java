package io.github.deepeshpatel.treemirror;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tears a cancelled pipeline down: {@code RUNNING -> ABORTING -> DRAINED}.
 * <p>
 * Aborting publishes the same termination markers as a normal run (one stop marker per worker still
 * running and the result stream end), then every unit is joined with a bounded wait. Draining removes
 * whatever is left in the work and result queues with a bounded number of non-blocking polls and
 * collects a result collection the receiver delivered but nobody read. Reaching {@code DRAINED}
 * ends the log stream.
 */
public final class ShutdownController {

    public enum State { RUNNING, ABORTING, DRAINED }

    /**
     * What the teardown found and did.
     *
     * @param stopMarkersPublished stop markers added while aborting
     * @param drainedWork          messages removed from the work queue
     * @param drainedResults       messages removed from the result queue
     * @param unjoined             units still alive after their join timeout
     * @param strandedResults      collection delivered by the receiver but not yet read, if any
     */
    public record AbortSummary(int stopMarkersPublished, int drainedWork, int drainedResults,
                               List<String> unjoined, Optional<ResultCollection> strandedResults) {
        public boolean fullyJoined() {
            return unjoined.isEmpty();
        }
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final List<ExecutionUnit> workers;
    private final ExecutionUnit receiver;
    private final MessageChannel<WorkMessage> workQueue;
    private final MessageChannel<ResultMessage> resultQueue;
    private final OneShot<ResultCollection> handoff;
    private final LogChannel logChannel;
    private final Duration joinTimeout;
    private final int maxDrainAttempts;
    private final MirrorStats stats;
    private final PipelineLog log;

    public ShutdownController(List<ExecutionUnit> workers, ExecutionUnit receiver,
                              MessageChannel<WorkMessage> workQueue, MessageChannel<ResultMessage> resultQueue,
                              OneShot<ResultCollection> handoff, LogChannel logChannel,
                              Duration joinTimeout, int maxDrainAttempts, MirrorStats stats, PipelineLog log) {
        this.workers = List.copyOf(workers);
        this.receiver = receiver;
        this.workQueue = workQueue;
        this.resultQueue = resultQueue;
        this.handoff = handoff;
        this.logChannel = logChannel;
        this.joinTimeout = joinTimeout;
        this.maxDrainAttempts = maxDrainAttempts;
        this.stats = stats;
        this.log = log;
    }

    public State state() {
        return state.get();
    }

    /**
     * Runs the teardown. Only the first call does anything.
     *
     * @return the summary, or empty if the controller was not running
     */
    public Optional<AbortSummary> abort() {
        if (!state.compareAndSet(State.RUNNING, State.ABORTING)) {
            return Optional.empty();
        }
        int stops = publishTerminationMarkers();

        List<String> unjoined = new ArrayList<>();
        for (ExecutionUnit worker : workers) {
            joinBounded(worker, unjoined);
        }
        joinBounded(receiver, unjoined);

        int drainedWork = 0;
        int drainedResults = 0;
        // one poll budget shared by both queues
        int budget = maxDrainAttempts;
        while (budget > 0) {
            int work = workQueue.drain(budget);
            budget -= work;
            int results = resultQueue.drain(budget);
            budget -= results;
            drainedWork += work;
            drainedResults += results;
            if (work == 0 && results == 0) {
                break;
            }
        }
        if (budget == 0 && !(workQueue.isEmpty() && resultQueue.isEmpty())) {
            log.warn("Drain budget of {} polls exhausted, {} work and {} result messages left",
                    maxDrainAttempts, workQueue.size(), resultQueue.size());
        }
        Optional<ResultCollection> stranded = handoff.poll();
        stranded.ifPresent(c -> log.warn("Collected unread result collection of {} entries", c.size()));

        AbortSummary summary = new AbortSummary(stops, drainedWork, drainedResults, List.copyOf(unjoined), stranded);
        log.info("Pipeline drained: {} stop markers published, {} work and {} result messages drained, unjoined {}",
                stops, drainedWork, drainedResults, unjoined);
        state.set(State.DRAINED);
        logChannel.end();
        return Optional.of(summary);
    }

    private int publishTerminationMarkers() {
        int stops = 0;
        for (ExecutionUnit worker : workers) {
            if (worker.isAlive() && workQueue.offer(WorkMessage.STOP)) {
                stats.incrementStopMarkersPublished();
                stops++;
            }
        }
        if (!resultQueue.offer(ResultMessage.END)) {
            log.debug("Result queue full, receiver will stop on cancellation instead");
        }
        log.warn("Aborting pipeline: {} stop markers published", stops);
        return stops;
    }

    private void joinBounded(ExecutionUnit unit, List<String> unjoined) {
        boolean joined;
        try {
            joined = unit.join(joinTimeout);
        } catch (InterruptedException e) {
            // a second interruption must not leave the remaining units unjoined
            log.warn("Interrupted again while joining {}, retrying once", unit.name());
            try {
                joined = unit.join(joinTimeout);
            } catch (InterruptedException again) {
                Thread.currentThread().interrupt();
                joined = !unit.isAlive();
            }
        }
        if (joined) {
            log.debug("Joined {}", unit.name());
        } else {
            unjoined.add(unit.name());
            log.error("{} did not terminate within {}", unit.name(), joinTimeout);
        }
    }
}
