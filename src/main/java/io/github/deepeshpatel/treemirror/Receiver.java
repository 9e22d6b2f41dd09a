package io.github.deepeshpatel.treemirror;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Sole consumer of the result queue and the single point where results are aggregated.
 * <p>
 * Converts every confirmed artifact to its tree-relative path until the stream end marker arrives,
 * then hands the collection to the host through the one-shot channel. The collection is delivered
 * exactly once, partially if the run is cancelled before the stream end.
 */
public final class Receiver implements Runnable {
    private final MessageChannel<ResultMessage> resultQueue;
    private final Path destinationRoot;
    private final OneShot<ResultCollection> handoff;
    private final CancellationSignal signal;
    private final MirrorStats stats;
    private final PipelineLog log;

    public Receiver(MessageChannel<ResultMessage> resultQueue, Path destinationRoot,
                    OneShot<ResultCollection> handoff, CancellationSignal signal,
                    MirrorStats stats, PipelineLog log) {
        this.resultQueue = resultQueue;
        this.destinationRoot = destinationRoot;
        this.handoff = handoff;
        this.signal = signal;
        this.stats = stats;
        this.log = log;
    }

    @Override
    public void run() {
        List<Path> received = new ArrayList<>();
        boolean complete = false;
        log.debug("Receiver waiting for results");
        try {
            while (true) {
                ResultMessage message = resultQueue.receive(signal);
                if (message instanceof ResultMessage.StreamEnd) {
                    complete = true;
                    log.debug("Result stream ended after {} results", received.size());
                    break;
                }
                Path relativePath = destinationRoot.relativize(((ResultMessage.Completed) message).absolutePath());
                received.add(relativePath);
                stats.incrementResultsReceived();
                log.debug("Obtained {} from result queue", relativePath);
            }
        } catch (CancellationException e) {
            log.warn("Receiver cancelled after {} results", received.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Receiver interrupted after {} results", received.size());
        } finally {
            handoff.deliver(new ResultCollection(received, complete));
        }
    }
}
