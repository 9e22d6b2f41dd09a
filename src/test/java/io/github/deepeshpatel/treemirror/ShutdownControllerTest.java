package io.github.deepeshpatel.treemirror;

import io.github.deepeshpatel.treemirror.ShutdownController.AbortSummary;
import io.github.deepeshpatel.treemirror.ShutdownController.State;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownControllerTest {

    @TempDir
    Path destinationRoot;

    private MessageChannel<WorkMessage> workQueue;
    private MessageChannel<ResultMessage> resultQueue;
    private OneShot<ResultCollection> handoff;
    private LogChannel logChannel;
    private CancellationSignal signal;
    private MirrorStats stats;
    private PipelineLog log;

    @BeforeEach
    void setUp() {
        workQueue = MessageChannel.unbounded("work");
        resultQueue = MessageChannel.bounded("results", 16);
        handoff = new OneShot<>();
        logChannel = new LogChannel(LoggerFactory.getLogger(ShutdownControllerTest.class));
        signal = new CancellationSignal();
        stats = new MirrorStats(2);
        log = new PipelineLog(logChannel, "host", Level.WARN);
    }

    private List<ExecutionUnit> workers(int count) {
        List<ExecutionUnit> units = new java.util.ArrayList<>();
        for (int i = 1; i <= count; i++) {
            String name = "worker-" + i;
            Worker worker = new Worker(name, workQueue, resultQueue, destinationRoot, new PlaceholderWriter(),
                    Duration.ZERO, signal, stats, log.forSource(name));
            units.add(new ThreadExecutionUnit(name, worker));
        }
        return units;
    }

    private ExecutionUnit receiver() {
        Receiver receiver = new Receiver(resultQueue, destinationRoot, handoff, signal, stats, log.forSource("receiver"));
        return new ThreadExecutionUnit("receiver", receiver);
    }

    private ShutdownController controller(List<ExecutionUnit> workers, ExecutionUnit receiver) {
        return new ShutdownController(workers, receiver, workQueue, resultQueue, handoff, logChannel,
                Duration.ofSeconds(2), 100, stats, log);
    }

    @Test
    @DisplayName("Abort stops idle units with the normal markers and collects the stranded results")
    void testAbortRunningPipeline() {
        List<ExecutionUnit> workers = workers(2);
        ExecutionUnit receiver = receiver();
        receiver.start();
        workers.forEach(ExecutionUnit::start);
        ShutdownController controller = controller(workers, receiver);
        assertEquals(State.RUNNING, controller.state());

        AbortSummary summary = controller.abort().orElseThrow();

        assertEquals(State.DRAINED, controller.state());
        assertEquals(2, summary.stopMarkersPublished());
        assertTrue(summary.fullyJoined());
        assertTrue(workers.stream().noneMatch(ExecutionUnit::isAlive));
        assertFalse(receiver.isAlive());
        assertTrue(workQueue.isEmpty());
        assertTrue(resultQueue.isEmpty());
        assertTrue(summary.strandedResults().orElseThrow().isComplete());
        assertTrue(logChannel.isEnded());
    }

    @Test
    @DisplayName("Leftover messages are drained")
    void testDrainsLeftovers() throws Exception {
        List<ExecutionUnit> workers = workers(2);
        ShutdownController controller = controller(workers, receiver());
        workQueue.publish(WorkMessage.task(Path.of("never.txt")));
        workQueue.publish(WorkMessage.STOP);

        AbortSummary summary = controller.abort().orElseThrow();

        assertEquals(0, summary.stopMarkersPublished(), "Units that never started get no marker");
        assertEquals(2, summary.drainedWork());
        assertEquals(1, summary.drainedResults(), "The stream end marker nobody consumed");
        assertTrue(summary.strandedResults().isEmpty());
        assertTrue(workQueue.isEmpty());
        assertTrue(resultQueue.isEmpty());
    }

    @Test
    @DisplayName("Drain budget is shared by both queues")
    void testDrainBudgetShared() {
        for (int i = 0; i < 10; i++) {
            workQueue.offer(WorkMessage.task(Path.of("left-" + i + ".txt")));
        }
        ShutdownController controller = new ShutdownController(workers(1), receiver(), workQueue, resultQueue,
                handoff, logChannel, Duration.ofSeconds(2), 5, stats, log);

        AbortSummary summary = controller.abort().orElseThrow();

        assertEquals(5, summary.drainedWork() + summary.drainedResults());
        assertEquals(5, workQueue.size());
        assertEquals(1, resultQueue.size(), "The stream end marker is left once the budget is spent");
        assertEquals(State.DRAINED, controller.state());
    }

    @Test
    @DisplayName("Unit that outlives its join timeout is reported")
    void testUnjoinedUnit() {
        CountDownLatch release = new CountDownLatch(1);
        ExecutionUnit stuck = new ThreadExecutionUnit("stuck", () -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        stuck.start();
        ShutdownController controller = new ShutdownController(List.of(stuck), receiver(), workQueue, resultQueue,
                handoff, logChannel, Duration.ofMillis(100), 100, stats, log);

        AbortSummary summary = controller.abort().orElseThrow();
        release.countDown();

        assertEquals(List.of("stuck"), summary.unjoined());
        assertFalse(summary.fullyJoined());
        assertEquals(State.DRAINED, controller.state());
    }

    @Test
    @DisplayName("Only the first abort runs")
    void testAbortOnce() {
        ShutdownController controller = controller(workers(1), receiver());

        assertTrue(controller.abort().isPresent());
        assertTrue(controller.abort().isEmpty());
        assertEquals(State.DRAINED, controller.state());
    }
}
