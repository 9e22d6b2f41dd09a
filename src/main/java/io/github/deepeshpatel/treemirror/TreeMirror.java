package io.github.deepeshpatel.treemirror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Mirrors a source directory tree into a new destination tree, writing a fixed-size placeholder
 * file for every source file, with a pool of concurrent workers.
 * <p>
 * The host walks the source tree, creates every mirrored directory itself and publishes one task
 * per file on the work queue. Workers write the artifacts and confirm them on the result queue,
 * where a single receiver aggregates them. All units log through one channel drained by a single
 * aggregator. The host finally verifies the result against fresh listings of both trees.
 * <p>
 * Each call to {@link #mirror(Path, Path)} or {@link #start(Path, Path)} builds its own pipeline, so
 * one instance can serve concurrent runs.
 */
public class TreeMirror {
    private static final Logger logger = LoggerFactory.getLogger(TreeMirror.class);

    /** Name of the logger the aggregated pipeline records are written to. */
    public static final String PIPELINE_LOGGER = "io.github.deepeshpatel.treemirror.pipeline";

    private final int poolSize;
    private final Duration taskDelay;
    private final ExecutionUnitKind receiverKind;
    private final ExecutionUnitKind logAggregatorKind;
    private final Level logLevel;
    private final int resultQueueCapacity;
    private final Duration joinTimeout;
    private final int maxDrainAttempts;
    private final long progressUpdateInterval;
    private final Consumer<MirrorStats> progressCallback;
    private final PlaceholderWriter placeholderWriter;

    /**
     * A mirror run executing on its own host thread, with cancellation control.
     */
    public class MirrorOperation {
        private final Pipeline pipeline;
        private final CompletableFuture<MirrorReport> future = new CompletableFuture<>();
        private final Thread hostThread;

        private MirrorOperation(Pipeline pipeline) {
            this.pipeline = pipeline;
            this.hostThread = new Thread(this::runHost, "treemirror-host");
        }

        private void runHost() {
            try {
                future.complete(pipeline.run());
            } catch (Exception | Error e) {
                future.completeExceptionally(e);
            }
        }

        /**
         * Requests cancellation. The run tears down and its future completes with an
         * {@link InterruptedException}.
         */
        public void cancel() {
            pipeline.signal.cancel(new InterruptedException("Mirror operation cancelled"));
        }

        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            hostThread.join(Math.max(1, unit.toMillis(timeout)));
            return !hostThread.isAlive();
        }

        public boolean isCancelled() { return pipeline.signal.isCancelled(); }

        public boolean isDone() { return future.isDone(); }

        public boolean isTerminated() { return future.isDone() && !hostThread.isAlive(); }

        public CompletableFuture<MirrorReport> getFuture() { return future; }

        public MirrorStats getStats() { return pipeline.stats; }

        public ShutdownController.State getShutdownState() { return pipeline.shutdown.state(); }

        public Optional<ShutdownController.AbortSummary> getAbortSummary() {
            return Optional.ofNullable(pipeline.abortSummary);
        }
    }

    /**
     * Channels, units and state of one run.
     */
    private final class Pipeline {
        private final Path source;
        private final Path destination;
        private final MirrorStats stats = new MirrorStats(poolSize);
        private final CancellationSignal signal = new CancellationSignal();
        private final LogChannel logChannel = new LogChannel(LoggerFactory.getLogger(PIPELINE_LOGGER));
        private final PipelineLog log = new PipelineLog(logChannel, "host", logLevel);
        private final MessageChannel<WorkMessage> workQueue = MessageChannel.unbounded("work");
        private final MessageChannel<ResultMessage> resultQueue =
                MessageChannel.bounded("results", resultQueueCapacity);
        private final OneShot<ResultCollection> handoff = new OneShot<>();
        private final ExecutorService taskPool = Executors.newCachedThreadPool();
        private final ExecutionUnit logAggregatorUnit;
        private final ExecutionUnit receiverUnit;
        private final List<ExecutionUnit> workerUnits = new ArrayList<>();
        private final ShutdownController shutdown;
        private ScheduledExecutorService progressExecutor;
        private volatile ShutdownController.AbortSummary abortSummary;

        private Pipeline(Path source, Path destination) {
            this.source = source;
            this.destination = destination;
            logAggregatorUnit = logAggregatorKind.create("log-aggregator", new LogAggregator(logChannel), taskPool);
            receiverUnit = receiverKind.create("receiver",
                    new Receiver(resultQueue, destination, handoff, signal, stats, log.forSource("receiver")),
                    taskPool);
            for (int i = 1; i <= poolSize; i++) {
                String name = "worker-" + i;
                Worker worker = new Worker(name, workQueue, resultQueue, destination, placeholderWriter,
                        taskDelay, signal, stats, log.forSource(name));
                workerUnits.add(ExecutionUnitKind.THREAD.create(name, worker, taskPool));
            }
            shutdown = new ShutdownController(workerUnits, receiverUnit, workQueue, resultQueue, handoff,
                    logChannel, joinTimeout, maxDrainAttempts, stats, log.forSource("shutdown"));
        }

        private MirrorReport run() throws IOException, MirrorException, InterruptedException {
            signal.bindOwner(Thread.currentThread());
            logAggregatorUnit.start();
            progressExecutor = setupProgressReporter(stats);
            try {
                try {
                    return runStages();
                } catch (InterruptedException e) {
                    signal.cancel(e);
                } catch (IOException | RuntimeException e) {
                    log.error("Mirror run failed: {}", e.getMessage(), e);
                    signal.cancel(e);
                }
                abortSummary = shutdown.abort().orElse(null);
                return failAfterAbort();
            } finally {
                signal.disarm();
                finish();
            }
        }

        private MirrorReport runStages() throws IOException, InterruptedException {
            checkCancelled();
            log.info("Mirroring {} into {} with {} workers", source, destination, poolSize);
            stats.markStarted();

            // the receiver must consume before any worker can publish
            receiverUnit.start();
            log.debug("Started {}", receiverUnit.name());
            for (ExecutionUnit worker : workerUnits) {
                worker.start();
                log.debug("Started {}", worker.name());
            }

            long submitted = publishTasks();
            for (int i = 0; i < workerUnits.size(); i++) {
                workQueue.publish(WorkMessage.STOP);
                stats.incrementStopMarkersPublished();
            }
            for (ExecutionUnit worker : workerUnits) {
                log.debug("Joining {}", worker.name());
                worker.join();
                stats.incrementWorkersJoined();
            }
            checkCancelled();

            if (!resultQueue.send(ResultMessage.END, signal)) {
                checkCancelled();
            }
            ResultCollection results = handoff.await();
            receiverUnit.join();
            checkCancelled();
            stats.markCompleted();

            if (results.size() != submitted) {
                log.error("Result count mismatch: {} tasks submitted, {} results received", submitted, results.size());
            }
            VerificationReport verification = TreeVerifier.verify(source, destination, results);
            checkCancelled();
            reportVerification(verification);
            if (progressCallback != null) {
                progressCallback.accept(stats);
            }
            // a cancel during the completion callback still aborts the run
            checkCancelled();
            log.info("Mirrored {} files into {} in {} ms", results.size(), destination, stats.getElapsedTimeMillis());
            return new MirrorReport(source, destination, submitted, results, verification, stats);
        }

        private long publishTasks() throws IOException, InterruptedException {
            SourceTreeWalker.walk(source, new SourceTreeWalker.Visitor() {
                @Override
                public void directory(Path relativePath) throws IOException {
                    // created here, never by a worker, so a parent always exists before its files
                    Files.createDirectories(destination.resolve(relativePath));
                    log.debug("Created directory {}", relativePath);
                }

                @Override
                public void file(Path relativePath) {
                    log.debug("Pushing {} to work queue", relativePath);
                    if (!workQueue.offer(WorkMessage.task(relativePath))) {
                        throw new IllegalStateException("Work queue rejected " + relativePath);
                    }
                    stats.incrementTasksPublished();
                }
            }, signal::isCancelled);
            checkCancelled();
            log.info("Published {} tasks", stats.getTasksPublished());
            return stats.getTasksPublished();
        }

        private void reportVerification(VerificationReport verification) {
            if (verification.consistent()) {
                log.info("Verified {} files: source, destination and results agree", verification.sourceCount());
                return;
            }
            log.error("Result is inconsistent: {} source files, {} destination files, {} results",
                    verification.sourceCount(), verification.destinationCount(), verification.resultCount());
            for (VerificationReport.Divergence divergence : verification.divergences()) {
                log.error("{}", divergence);
            }
        }

        private void checkCancelled() throws InterruptedException {
            if (signal.isCancelled() || Thread.interrupted()) {
                throw new InterruptedException("Mirror run cancelled");
            }
        }

        private MirrorReport failAfterAbort() throws IOException, MirrorException, InterruptedException {
            Throwable cause = signal.cause().orElseThrow();
            // the host was interrupted by the signal itself
            Thread.interrupted();
            if (cause instanceof MirrorException e) {
                throw e;
            } else if (cause instanceof InterruptedException e) {
                throw e;
            } else if (cause instanceof IOException e) {
                throw e;
            } else if (cause instanceof RuntimeException e) {
                throw e;
            } else if (cause instanceof Error e) {
                throw e;
            }
            throw new IllegalStateException("Mirror run aborted", cause);
        }

        private void finish() {
            logChannel.end();
            boolean interrupted = Thread.interrupted();
            try {
                if (!logAggregatorUnit.join(joinTimeout)) {
                    logger.warn("Log aggregator did not terminate within {}", joinTimeout);
                }
            } catch (InterruptedException e) {
                interrupted = true;
            } finally {
                if (progressExecutor != null) {
                    progressExecutor.shutdown();
                }
                taskPool.shutdown();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Builder for constructing {@link TreeMirror} instances with custom settings.
     * <p>
     * Example:
     * <pre>{@code
     * TreeMirror mirror = new TreeMirror.Builder()
     *     .poolSize(8)
     *     .receiverKind(ExecutionUnitKind.POOLED_TASK)
     *     .logLevel(Level.DEBUG)
     *     .build();
     * }</pre>
     */
    public static class Builder {
        private int poolSize = 5;
        private Duration taskDelay = Duration.ZERO;
        private ExecutionUnitKind receiverKind = ExecutionUnitKind.THREAD;
        private ExecutionUnitKind logAggregatorKind = ExecutionUnitKind.THREAD;
        private Level logLevel = Level.INFO;
        private int resultQueueCapacity = 1024;
        private Duration joinTimeout = Duration.ofSeconds(10);
        private int maxDrainAttempts = 10_000;
        private long progressUpdateInterval = 2;
        private Consumer<MirrorStats> progressCallback;
        private PlaceholderWriter placeholderWriter = new PlaceholderWriter();

        public Builder poolSize(int size) {
            this.poolSize = size;
            return this;
        }

        /**
         * Artificial delay before each task, for timing and backpressure experiments.
         */
        public Builder taskDelay(Duration delay) {
            this.taskDelay = delay;
            return this;
        }

        public Builder receiverKind(ExecutionUnitKind kind) {
            this.receiverKind = kind;
            return this;
        }

        public Builder logAggregatorKind(ExecutionUnitKind kind) {
            this.logAggregatorKind = kind;
            return this;
        }

        public Builder logLevel(Level level) {
            this.logLevel = level;
            return this;
        }

        public Builder resultQueueCapacity(int capacity) {
            this.resultQueueCapacity = capacity;
            return this;
        }

        public Builder joinTimeout(Duration timeout) {
            this.joinTimeout = timeout;
            return this;
        }

        public Builder maxDrainAttempts(int attempts) {
            this.maxDrainAttempts = attempts;
            return this;
        }

        public Builder progressUpdateInterval(long seconds) {
            this.progressUpdateInterval = seconds;
            return this;
        }

        /**
         * Sets the progress callback invoked periodically during a run and once at its end.
         *
         * @param callback the callback to receive progress updates (can be null to disable)
         * @return this builder
         */
        public Builder progressCallback(Consumer<MirrorStats> callback) {
            this.progressCallback = callback;
            return this;
        }

        public Builder placeholderWriter(PlaceholderWriter writer) {
            this.placeholderWriter = writer;
            return this;
        }

        public TreeMirror build() {
            return new TreeMirror(this);
        }
    }

    protected TreeMirror(Builder builder) {
        if (builder.poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be >=1");
        }
        if (builder.taskDelay == null || builder.taskDelay.isNegative()) {
            throw new IllegalArgumentException("Task delay must be non-negative");
        }
        if (builder.receiverKind == null || builder.logAggregatorKind == null) {
            throw new IllegalArgumentException("Execution unit kinds must not be null");
        }
        if (builder.logLevel == null) {
            throw new IllegalArgumentException("Log level must not be null");
        }
        if (builder.resultQueueCapacity <= 0) {
            throw new IllegalArgumentException("Result queue capacity must be positive");
        }
        if (builder.joinTimeout == null || builder.joinTimeout.isNegative() || builder.joinTimeout.isZero()) {
            throw new IllegalArgumentException("Join timeout must be positive");
        }
        if (builder.maxDrainAttempts <= 0) {
            throw new IllegalArgumentException("Drain attempts must be positive");
        }
        if (builder.progressUpdateInterval <= 0) {
            throw new IllegalArgumentException("Progress update interval must be positive");
        }
        if (builder.placeholderWriter == null) {
            throw new IllegalArgumentException("Placeholder writer must not be null");
        }
        this.poolSize = builder.poolSize;
        this.taskDelay = builder.taskDelay;
        this.receiverKind = builder.receiverKind;
        this.logAggregatorKind = builder.logAggregatorKind;
        this.logLevel = builder.logLevel;
        this.resultQueueCapacity = builder.resultQueueCapacity;
        this.joinTimeout = builder.joinTimeout;
        this.maxDrainAttempts = builder.maxDrainAttempts;
        this.progressUpdateInterval = builder.progressUpdateInterval;
        this.progressCallback = builder.progressCallback;
        this.placeholderWriter = builder.placeholderWriter;
    }

    /**
     * Mirrors {@code source} into {@code destination} on the calling thread.
     * <p>
     * Interrupting the calling thread cancels the run: the pipeline is torn down and the
     * {@link InterruptedException} is re-thrown once every unit has been joined.
     *
     * @param source      an existing readable directory
     * @param destination a path that must not exist yet; its parent must exist
     * @return the report of the uninterrupted run
     * @throws PathValidationException if a path is unusable; nothing has been created then
     * @throws WorkerWriteException    if a worker failed to write an artifact and the run was aborted
     * @throws InterruptedException    if the run was cancelled
     * @throws IOException             if a mirrored directory cannot be created
     */
    public MirrorReport mirror(Path source, Path destination)
            throws IOException, MirrorException, InterruptedException {
        return prepare(source, destination).run();
    }

    /**
     * Starts mirroring on a dedicated host thread and returns immediately.
     * Paths are validated and the destination root is created before this method returns.
     *
     * @throws PathValidationException if a path is unusable; nothing has been created then
     * @throws IOException             if the destination root cannot be created
     */
    public MirrorOperation start(Path source, Path destination) throws IOException, MirrorException {
        MirrorOperation operation = new MirrorOperation(prepare(source, destination));
        operation.hostThread.start();
        return operation;
    }

    private Pipeline prepare(Path source, Path destination) throws IOException, PathValidationException {
        Path absoluteSource = source.toAbsolutePath().normalize();
        Path absoluteDestination = destination.toAbsolutePath().normalize();
        validateSourceDirectory(absoluteSource);
        validateDestination(absoluteSource, absoluteDestination);
        Files.createDirectory(absoluteDestination);
        logger.debug("Created destination root {}", absoluteDestination);
        return new Pipeline(absoluteSource, absoluteDestination);
    }

    private void validateSourceDirectory(Path source) throws PathValidationException {
        if (!Files.exists(source)) {
            logger.error("Source directory does not exist: {}", source);
            throw new PathValidationException("Source directory does not exist", source);
        }
        if (!Files.isDirectory(source)) {
            logger.error("Source is not a directory: {}", source);
            throw new PathValidationException("Source is not a directory", source);
        }
        if (!Files.isReadable(source)) {
            throw new PathValidationException("Read permission denied for source directory", source);
        }
    }

    private void validateDestination(Path source, Path destination) throws PathValidationException {
        if (Files.exists(destination, LinkOption.NOFOLLOW_LINKS)) {
            logger.error("Destination already exists: {}", destination);
            throw new PathValidationException("Destination already exists", destination);
        }
        if (destination.startsWith(source)) {
            throw new PathValidationException("Destination cannot be inside the source directory", destination);
        }
    }

    private ScheduledExecutorService setupProgressReporter(MirrorStats stats) {
        if (progressCallback == null) {
            return null;
        }
        ScheduledExecutorService progressExecutor = Executors.newSingleThreadScheduledExecutor();
        progressExecutor.scheduleAtFixedRate(
                () -> progressCallback.accept(stats),
                progressUpdateInterval,
                progressUpdateInterval,
                TimeUnit.SECONDS
        );
        return progressExecutor;
    }

    public int getPoolSize() { return poolSize; }
    public Duration getTaskDelay() { return taskDelay; }
    public ExecutionUnitKind getReceiverKind() { return receiverKind; }
    public ExecutionUnitKind getLogAggregatorKind() { return logAggregatorKind; }
    public Level getLogLevel() { return logLevel; }
    public int getResultQueueCapacity() { return resultQueueCapacity; }
    public Duration getJoinTimeout() { return joinTimeout; }
    public int getMaxDrainAttempts() { return maxDrainAttempts; }
}
