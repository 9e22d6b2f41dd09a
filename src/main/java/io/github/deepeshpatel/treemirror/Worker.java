package io.github.deepeshpatel.treemirror;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Consumer of the work queue.
 * <p>
 * Takes one message at a time: a {@link WorkMessage.Task} is turned into a placeholder artifact
 * below the destination root and confirmed on the result queue; a {@link WorkMessage.Stop} ends the
 * worker. Each worker consumes exactly one stop marker, leaving the others to its peers.
 * <p>
 * After cancellation, tasks still in the queue are discarded unwritten. A failed write is fatal:
 * the worker cancels the run with a {@link WorkerWriteException} and returns.
 */
public final class Worker implements Runnable {
    private final String name;
    private final MessageChannel<WorkMessage> workQueue;
    private final MessageChannel<ResultMessage> resultQueue;
    private final Path destinationRoot;
    private final PlaceholderWriter writer;
    private final Duration taskDelay;
    private final CancellationSignal signal;
    private final MirrorStats stats;
    private final PipelineLog log;

    public Worker(String name, MessageChannel<WorkMessage> workQueue, MessageChannel<ResultMessage> resultQueue,
                  Path destinationRoot, PlaceholderWriter writer, Duration taskDelay,
                  CancellationSignal signal, MirrorStats stats, PipelineLog log) {
        this.name = name;
        this.workQueue = workQueue;
        this.resultQueue = resultQueue;
        this.destinationRoot = destinationRoot;
        this.writer = writer;
        this.taskDelay = taskDelay;
        this.signal = signal;
        this.stats = stats;
        this.log = log;
    }

    @Override
    public void run() {
        log.debug("{} started", name);
        try {
            while (true) {
                WorkMessage message = workQueue.receive(signal);
                if (message instanceof WorkMessage.Stop) {
                    stats.incrementStopMarkersConsumed();
                    log.debug("{} received stop marker", name);
                    return;
                }
                if (!process((WorkMessage.Task) message)) {
                    return;
                }
            }
        } catch (CancellationException e) {
            log.debug("{} leaving empty work queue after cancellation", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", name);
        }
    }

    public String name() {
        return name;
    }

    /**
     * @return false if the worker must terminate
     */
    private boolean process(WorkMessage.Task task) throws InterruptedException {
        Path relativePath = task.relativePath();
        if (!taskDelay.isZero() && signal.await(taskDelay)) {
            log.debug("{} cancelled while delaying {}", name, relativePath);
        }
        if (signal.isCancelled()) {
            stats.incrementTasksSkipped();
            log.debug("{} skipping {} after cancellation", name, relativePath);
            return true;
        }

        Path target = destinationRoot.resolve(relativePath);
        try {
            long bytes = writer.write(target);
            stats.recordArtifact(bytes);
        } catch (IOException e) {
            WorkerWriteException failure = new WorkerWriteException(name, relativePath, e);
            log.error("{} failed to write artifact {}, aborting the pool", name, target, e);
            signal.cancel(failure);
            return false;
        }

        if (resultQueue.send(ResultMessage.completed(target), signal)) {
            stats.incrementResultsPublished();
            log.debug("{} wrote {}", name, target);
        } else {
            stats.incrementResultsDropped();
            log.warn("{} dropped result {}: result queue full after cancellation", name, target);
        }
        return true;
    }
}
