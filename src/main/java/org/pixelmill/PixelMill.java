package org.pixelmill;

import org.pixelmill.config.AppConfig;
import org.pixelmill.config.ConfigManager;
import org.pixelmill.config.StressItem;
import org.pixelmill.exception.AccessException;
import org.pixelmill.imaging.AwtImagingLibrary;
import org.pixelmill.imaging.ImagingLibrary;
import org.pixelmill.metrics.BatchSummary;
import org.pixelmill.metrics.ResultStatusWriter;
import org.pixelmill.metrics.SummaryReportWriter;
import org.pixelmill.processing.BatchCoordinator;
import org.pixelmill.processing.FileDiscovery;
import org.pixelmill.processing.LoadAmplifier;
import org.pixelmill.processing.ScalingComparison;
import org.pixelmill.processing.TransformConfig;
import org.pixelmill.processing.WorkItem;
import org.pixelmill.util.Utils;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point. Runs a normal batch, a stress batch or a sequential/parallel comparison over one
 * input directory.
 */
@Command(name = "pixelmill", mixinStandardHelpOptions = true, version = "PixelMill 1.0.0",
        description = "Resizes, blurs, sharpens and adjusts every image of a directory using a pool of workers.")
public class PixelMill implements Callable<Integer> {

    private static final Logger LOGGER = Logger.getLogger(PixelMill.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_SETUP = 2;
    static final String LOCK_FILE_NAME = ".pixelmill.lock";

    @CommandLine.Spec
    CommandSpec spec;

    @Option(names = {"-i", "--input"}, description = "Directory holding the source images.")
    Path input;

    @Option(names = {"-o", "--output"}, description = "Directory receiving the processed images.")
    Path output;

    @Option(names = {"-n", "--iterations"}, description = "Chain passes per image.")
    Integer iterations;

    @Option(names = "--image-count", description = "Stress mode: number of work items to amplify to.")
    Integer imageCount;

    @Option(names = "--blur-radius", description = "Blur radius, ramped across passes in stress mode.")
    Double blurRadius;

    @Option(names = {"-c", "--concurrency"}, description = "Worker count. Defaults to min(cpus, images).")
    Integer concurrency;

    @Option(names = "--config", description = "YAML configuration file (default: ${DEFAULT-VALUE}).")
    Path configFile = ConfigManager.DEFAULT_CONFIG_PATH;

    @Option(names = "--report", description = "Write a JSON summary report to this file.")
    Path reportFile;

    @Option(names = "--status", description = "Append one CSV row per image to this file.")
    Path statusFile;

    @Option(names = "--stress", description = "Amplify the input to --image-count items with ramped blur.")
    boolean stress;

    @Option(names = "--compare", description = "Run sequentially and in parallel and report the speedup.")
    boolean compare;

    @Option(names = "--repeat", defaultValue = "3", description = "Comparison repetitions (default: ${DEFAULT-VALUE}).")
    int repeat;

    @Option(names = "--lock-file", description = "Lock file preventing concurrent runs (default: ${DEFAULT-VALUE}).")
    Path lockFile = Path.of(LOCK_FILE_NAME);

    private final ImagingLibrary imaging;

    public PixelMill() {
        this(new AwtImagingLibrary());
    }

    PixelMill(final ImagingLibrary imaging) {
        this.imaging = imaging;
    }

    public static void main(final String[] args) {
        System.exit(new CommandLine(new PixelMill()).execute(args));
    }

    @Override
    public Integer call() {
        validateOptions();

        final AppConfig config;
        try {
            config = applyOverrides(ConfigManager.load(configFile));
        } catch (IOException e) {
            LOGGER.severe("Could not read configuration " + configFile + ": " + e.getMessage());
            return EXIT_SETUP;
        }

        final TransformConfig transform;
        try {
            transform = effectiveTransform(config);
        } catch (IllegalArgumentException e) {
            LOGGER.severe("Invalid transform configuration in " + configFile + ": " + e.getMessage());
            return EXIT_SETUP;
        }

        try (RandomAccessFile raf = new RandomAccessFile(lockFile.toFile(), "rw");
             FileChannel channel = raf.getChannel();
             FileLock lock = channel.tryLock()) {
            if (lock == null) {
                LOGGER.severe("Could not acquire lock (%s), another instance already running?".formatted(lockFile));
                return EXIT_SETUP;
            }
            return execute(config, transform);
        } catch (OverlappingFileLockException e) {
            LOGGER.severe("Lock (%s) held by another run in this JVM".formatted(lockFile));
            return EXIT_SETUP;
        } catch (AccessException e) {
            LOGGER.severe(e.getMessage());
            return EXIT_SETUP;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "I/O failure: " + e.getMessage(), e);
            return EXIT_UNEXPECTED;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "An unexpected error occurred during execution", e);
            return EXIT_UNEXPECTED;
        }
    }

    private void validateOptions() {
        if (stress && compare)
            throw new CommandLine.ParameterException(spec.commandLine(), "--stress and --compare are mutually exclusive");
        if (iterations != null && iterations < 1)
            throw new CommandLine.ParameterException(spec.commandLine(), "--iterations must be >= 1");
        if (imageCount != null && imageCount < 0)
            throw new CommandLine.ParameterException(spec.commandLine(), "--image-count must be >= 0");
        if (blurRadius != null && !(blurRadius >= 0))
            throw new CommandLine.ParameterException(spec.commandLine(), "--blur-radius must be >= 0");
        if (concurrency != null && concurrency < 1)
            throw new CommandLine.ParameterException(spec.commandLine(), "--concurrency must be >= 1");
        if (repeat < 1)
            throw new CommandLine.ParameterException(spec.commandLine(), "--repeat must be >= 1");
    }

    AppConfig applyOverrides(final AppConfig loaded) {
        AppConfig config = loaded;
        if (input != null) config = config.withInputDir(input);
        if (output != null) config = config.withOutputDir(output);
        if (concurrency != null) config = config.withConcurrency(concurrency);
        if (reportFile != null) config = config.withReportFile(reportFile);
        if (statusFile != null) config = config.withStatusFile(statusFile);

        StressItem stressItem = config.stress();
        if (stress) stressItem = stressItem.withEnabled(true);
        if (imageCount != null) stressItem = stressItem.withImageCount(imageCount);
        if (iterations != null) stressItem = stressItem.withIterations(iterations);
        if (blurRadius != null) stressItem = stressItem.withBlurRadius(blurRadius);
        return config.withStress(stressItem);
    }

    /**
     * Builds the transform the selected mode runs with, so invalid values fail before any work starts.
     */
    TransformConfig effectiveTransform(final AppConfig config) {
        final StressItem stressItem = config.stress();
        if (!compare && Boolean.TRUE.equals(stressItem.enabled())) {
            if (stressItem.imageCount() < 0)
                throw new IllegalArgumentException("stress.imageCount must be >= 0: " + stressItem.imageCount());
            return config.transformConfig()
                    .withIterationCount(stressItem.iterations())
                    .withBlurRadius(stressItem.blurRadius())
                    .withBlurRamp(true);
        }
        TransformConfig transform = config.transformConfig();
        if (iterations != null) transform = transform.withIterationCount(iterations);
        if (blurRadius != null) transform = transform.withBlurRadius(blurRadius);
        return transform;
    }

    private int execute(final AppConfig config, final TransformConfig transform) throws IOException {
        if (compare) {
            runComparison(config, transform);
            return EXIT_OK;
        }
        final boolean stressMode = Boolean.TRUE.equals(config.stress().enabled());
        try (ResultStatusWriter statusWriter = openStatusWriter(config.statusFile())) {
            final BatchCoordinator coordinator = new BatchCoordinator(config, imaging, statusWriter);
            final CountDownLatch finished = new CountDownLatch(1);
            final Thread hook = new Thread(() -> {
                coordinator.shutdown();
                try {
                    finished.await(config.shutdownGraceSeconds() + 5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "PixelMillShutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            final BatchSummary summary;
            try {
                System.out.println("========================================================");
                System.out.println(stressMode ? " Starting Stress Run " : " Starting Batch Run ");
                System.out.println("========================================================");
                summary = stressMode ? runStress(config, coordinator, transform) : runBatch(config, coordinator, transform);
            } finally {
                finished.countDown();
                removeHook(hook);
            }

            final String runName = stressMode ? "stress" : "batch";
            printSummary(runName, summary);
            if (config.reportFile() != null) writeReport(config.reportFile(), runName, summary);
            return EXIT_OK;
        }
    }

    private static ResultStatusWriter openStatusWriter(final Path statusFile) throws AccessException {
        if (statusFile == null) return null;
        try {
            return new ResultStatusWriter(statusFile);
        } catch (IOException e) {
            throw new AccessException(statusFile, "Cannot open status file " + statusFile + ": " + e.getMessage(), e);
        }
    }

    private BatchSummary runBatch(final AppConfig config, final BatchCoordinator coordinator,
                                  final TransformConfig transform) throws AccessException {
        return coordinator.run(config.inputDir(), config.outputDir(), transform);
    }

    private BatchSummary runStress(final AppConfig config, final BatchCoordinator coordinator,
                                   final TransformConfig transform) throws IOException {
        final StressItem stressItem = config.stress();
        final List<Path> base = FileDiscovery.discover(config.inputDir(), config.extensions());
        if (base.isEmpty()) {
            LOGGER.warning("No image files found in " + config.inputDir());
            BatchCoordinator.prepareOutputDir(config.outputDir());
            return BatchSummary.empty();
        }
        LOGGER.info("Stress run: %d base image(s) amplified to %d item(s), %d pass(es), blur radius up to %s".formatted(
                base.size(), stressItem.imageCount(), stressItem.iterations(), stressItem.blurRadius()));

        final LoadAmplifier amplifier = new LoadAmplifier(config.outputDir(), stressItem.outputPrefix(), transform);
        List<WorkItem> items = amplifier.amplify(base, stressItem.imageCount(), stressItem.iterations());
        if (Boolean.TRUE.equals(stressItem.materializeDuplicates())) {
            final Path staging = stressItem.stagingDir() != null
                    ? stressItem.stagingDir() : config.outputDir().resolveSibling("stress_staging");
            items = amplifier.materialize(items, staging);
        }
        return coordinator.run(items, config.outputDir());
    }

    private void runComparison(final AppConfig config, final TransformConfig transform) throws IOException {
        final ScalingComparison.Comparison result = new ScalingComparison(config, imaging)
                .compare(config.inputDir(), config.outputDir(), transform, repeat);

        System.out.println("==================== PERFORMANCE COMPARISON ====================");
        System.out.printf("Sequential (1 worker)  : %s s average over %d run(s)%n",
                Utils.formatSeconds(result.averageSequential()), result.sequentialRuns().size());
        System.out.printf("Parallel   (%d workers): %s s average over %d run(s)%n", result.parallelWorkers(),
                Utils.formatSeconds(result.averageParallel()), result.parallelRuns().size());
        System.out.printf("Speedup                : %.2fx%n", result.speedup());
        System.out.printf("Identical outputs      : %s%n", result.outputsIdentical());
        System.out.println("================================================================");

        if (config.reportFile() != null) {
            final Path report = config.reportFile();
            final String stem = Utils.stemOf(report);
            final String ext = report.getFileName().toString().substring(stem.length());
            final List<BatchSummary> seq = result.sequentialRuns();
            final List<BatchSummary> par = result.parallelRuns();
            writeReport(report.resolveSibling(stem + "-sequential" + ext), "sequential", seq.get(seq.size() - 1));
            writeReport(report.resolveSibling(stem + "-parallel" + ext), "parallel", par.get(par.size() - 1));
        }
    }

    /**
     * The run has already completed when this is called; a report that cannot be written is logged, not fatal.
     */
    private static void writeReport(final Path file, final String runName, final BatchSummary summary) {
        try {
            new SummaryReportWriter().write(file, runName, summary);
            LOGGER.info("Summary report written to " + file.toAbsolutePath());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Could not write summary report " + file + ": " + e.getMessage(), e);
        }
    }

    private static void removeHook(final Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOGGER.fine("JVM shutdown in progress, keeping shutdown hook.");
        }
    }

    private static void printSummary(final String runName, final BatchSummary summary) {
        System.out.println("---------------------- SUMMARY (" + runName + ") ----------------------");
        System.out.printf("Status: %-4s | Images: %d | Succeeded: %d | Failed: %d%n",
                summary.status(), summary.totalItems(), summary.succeeded(), summary.failed());
        System.out.printf("Wall clock: %s s | Processing time: %s s | Average per image: %s s%n",
                Utils.formatSeconds(summary.wallClock()), Utils.formatSeconds(summary.totalElapsed()),
                Utils.formatSeconds(summary.perImageAverage()));
        summary.errorsByKind().forEach((kind, count) -> System.out.printf("  %-16s %d%n", kind, count));
        System.out.println("----------------------------------------------------------------");
    }
}
