package io.github.deepeshpatel.treemirror.cli;

import io.github.deepeshpatel.treemirror.ErrorKind;
import io.github.deepeshpatel.treemirror.ExecutionUnitKind;
import io.github.deepeshpatel.treemirror.MirrorException;
import io.github.deepeshpatel.treemirror.MirrorReport;
import io.github.deepeshpatel.treemirror.SimpleProgressCallback;
import io.github.deepeshpatel.treemirror.TreeMirror;
import io.github.deepeshpatel.treemirror.TreeMirror.MirrorOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: tree-mirror &lt;source&gt; &lt;destination&gt;
 * <p>
 * Walks the source directory and builds the same tree under the destination, writing a 1 KB
 * placeholder of random ASCII letters for every file. The relative paths of both trees are
 * identical. Directory walking happens on the host; writing is shared among the workers.
 * <p>
 * The exit code tells the failure kind apart, see {@link ErrorKind}.
 */
@Command(
        name = "tree-mirror",
        mixinStandardHelpOptions = true,
        version = "tree-mirror 1.0.0",
        description = "Mirror a directory tree into 1 KB placeholder files using a pool of workers"
)
public class TreeMirrorCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(TreeMirrorCommand.class);
    private static final String BASE_LOGGER = "io.github.deepeshpatel.treemirror";
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Path to input directory")
    private Path source;

    @Parameters(index = "1", description = "Path to output directory (must not exist)")
    private Path destination;

    @Option(names = {"-n", "--num-workers"}, defaultValue = "5",
            description = "Number of workers (default: ${DEFAULT-VALUE})")
    private int workers;

    @Option(names = "--log", defaultValue = "INFO",
            description = "Set log level, e.g. DEBUG, INFO, WARN (default: ${DEFAULT-VALUE})")
    private String logLevel;

    @Option(names = {"-d", "--debug"}, description = "Shortcut for --log DEBUG")
    private boolean debug;

    @Option(names = "--task-delay-ms", defaultValue = "0",
            description = "Artificial delay before each task in milliseconds (default: ${DEFAULT-VALUE})")
    private long taskDelayMillis;

    @Option(names = "--receiver", defaultValue = "THREAD",
            description = "Receiver execution unit: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ExecutionUnitKind receiverKind;

    @Option(names = "--log-aggregator", defaultValue = "THREAD",
            description = "Log aggregator execution unit: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ExecutionUnitKind logAggregatorKind;

    @Option(names = "--progress", description = "Print a progress line every few seconds")
    private boolean progress;

    public static void main(String[] args) {
        System.exit(new CommandLine(new TreeMirrorCommand()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        Level level = resolveLevel();
        applyLogLevel(level);

        TreeMirror mirror = new TreeMirror.Builder()
                .poolSize(workers)
                .taskDelay(Duration.ofMillis(taskDelayMillis))
                .receiverKind(receiverKind)
                .logAggregatorKind(logAggregatorKind)
                .logLevel(level)
                .progressCallback(progress ? SimpleProgressCallback::simpleProgressCallback : null)
                .build();

        PrintWriter out = spec.commandLine().getOut();
        logger.info("Start running");
        MirrorOperation operation;
        try {
            operation = mirror.start(source, destination);
        } catch (MirrorException e) {
            logger.error(e.getMessage());
            return e.kind().exitCode();
        }

        Thread shutdownHook = new Thread(() -> cancelOnShutdown(operation), "tree-mirror-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            MirrorReport report = operation.getFuture().get();
            out.println(report.stats().getSummary());
            report.errorKind().ifPresent(kind -> logger.error("Run finished with {}", kind));
            logger.info("Finished running");
            return report.exitCode();
        } catch (ExecutionException e) {
            return exitCodeOf(e.getCause());
        } finally {
            removeShutdownHook(shutdownHook);
        }
    }

    private int exitCodeOf(Throwable failure) throws Exception {
        if (failure instanceof MirrorException e) {
            logger.error(e.getMessage());
            return e.kind().exitCode();
        }
        if (failure instanceof InterruptedException) {
            logger.info("Interrupt occurred. Exiting");
            return ErrorKind.CANCELLED.exitCode();
        }
        if (failure instanceof IOException e) {
            throw e;
        }
        throw new IllegalStateException("Mirror run failed", failure);
    }

    private static void cancelOnShutdown(MirrorOperation operation) {
        if (operation.isDone()) {
            return;
        }
        operation.cancel();
        try {
            if (!operation.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Mirror run did not tear down within {} seconds", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM shutdown in progress, keeping shutdown hook");
        }
    }

    private Level resolveLevel() {
        if (debug) {
            return Level.DEBUG;
        }
        String name = logLevel.trim().toUpperCase();
        if ("WARNING".equals(name)) {
            return Level.WARN;
        }
        try {
            return Level.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unknown log level: " + logLevel);
        }
    }

    private static void applyLogLevel(Level level) {
        Logger base = LoggerFactory.getLogger(BASE_LOGGER);
        if (base instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(ch.qos.logback.classic.Level.toLevel(level.name()));
        }
    }
}
