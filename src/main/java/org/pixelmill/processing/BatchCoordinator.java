package org.pixelmill.processing;

import org.pixelmill.config.AppConfig;
import org.pixelmill.exception.AccessException;
import org.pixelmill.imaging.ImagingLibrary;
import org.pixelmill.metrics.BatchSummary;
import org.pixelmill.metrics.ResultRecord;
import org.pixelmill.metrics.ResultStatusWriter;
import org.pixelmill.metrics.SummaryAccumulator;
import org.pixelmill.util.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs one batch: discovers the input images, hands them to a {@link WorkerPool} and folds the results into a
 * {@link BatchSummary}. The summary is only ever touched by the thread calling {@code run}.
 */
public class BatchCoordinator {

    private static final Logger LOGGER = Logger.getLogger(BatchCoordinator.class.getName());

    private final AppConfig config;
    private final ImagingLibrary imaging;
    private final ResultStatusWriter statusWriter;
    private volatile WorkerPool activePool;
    private volatile boolean shutdownRequested;

    public BatchCoordinator(final AppConfig config, final ImagingLibrary imaging) {
        this(config, imaging, null);
    }

    /**
     * @param statusWriter receives every record as it is collected; may be null
     */
    public BatchCoordinator(final AppConfig config, final ImagingLibrary imaging, final ResultStatusWriter statusWriter) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null").withDefaults();
        this.imaging = Objects.requireNonNull(imaging);
        this.statusWriter = statusWriter;
    }

    /**
     * Processes every image of {@code inputDir} into {@code outputDir}.
     *
     * @throws AccessException when the input directory cannot be read or the output directory cannot be prepared;
     *                         raised before any item is submitted
     */
    public BatchSummary run(final Path inputDir, final Path outputDir, final TransformConfig transform) throws AccessException {
        final Instant start = Instant.now();
        final List<Path> files = FileDiscovery.discover(inputDir, config.extensions());
        prepareOutputDir(outputDir);
        if (files.isEmpty()) {
            LOGGER.warning("No image files found in " + inputDir);
            return BatchSummary.empty();
        }
        LOGGER.info("Found %d images to process".formatted(files.size()));
        final List<WorkItem> items = buildWorkItems(files, outputDir, config.outputPrefix(), transform);
        return collect(items, start);
    }

    /**
     * Processes prepared work items, such as those produced by the {@link LoadAmplifier}.
     */
    public BatchSummary run(final List<WorkItem> items, final Path outputDir) throws AccessException {
        final Instant start = Instant.now();
        prepareOutputDir(outputDir);
        if (items.isEmpty()) return BatchSummary.empty();
        return collect(items, start);
    }

    /**
     * Asks the running batch, if any, to stop dispatching new items.
     */
    public void shutdown() {
        shutdownRequested = true;
        final WorkerPool pool = activePool;
        if (pool != null) pool.shutdown();
    }

    /**
     * One work item per file, in discovery order, writing {@code outputDir/<prefix><fileName>}.
     */
    public static List<WorkItem> buildWorkItems(final List<Path> files, final Path outputDir, final String prefix,
                                                final TransformConfig transform) {
        final List<WorkItem> items = new ArrayList<>(files.size());
        for (Path file : files) {
            items.add(new WorkItem(file, outputDir.resolve(prefix + file.getFileName()), transform));
        }
        return items;
    }

    /**
     * Creates the output directory if needed and checks it is writable. Idempotent.
     */
    public static void prepareOutputDir(final Path outputDir) throws AccessException {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new AccessException(outputDir, "Cannot create output directory", e);
        }
        if (!Files.isWritable(outputDir)) throw new AccessException(outputDir, "Output directory is not writable");
    }

    private BatchSummary collect(final List<WorkItem> items, final Instant start) {
        final WorkerPool pool = new WorkerPool(new ImageWorker(imaging, config.outputQuality()),
                config.concurrency() != null ? config.concurrency() : 0,
                config.queueCapacity(), Duration.ofSeconds(config.shutdownGraceSeconds()));
        final SummaryAccumulator accumulator = new SummaryAccumulator();

        activePool = pool;
        if (shutdownRequested) pool.shutdown();
        try {
            pool.run(items, record -> {
                accumulator.add(record);
                writeStatus(record);
            });
        } finally {
            activePool = null;
        }

        final BatchSummary summary = accumulator.finish(Duration.between(start, Instant.now()));
        LOGGER.info("Processed %d of %d images in %s seconds (average: %s seconds per image)".formatted(
                summary.succeeded(), summary.totalItems(), Utils.formatSeconds(summary.wallClock()),
                Utils.formatSeconds(summary.perImageAverage())));
        if (summary.failed() > 0) LOGGER.warning("Failures by kind: " + summary.errorsByKind());
        return summary;
    }

    private void writeStatus(final ResultRecord record) {
        if (statusWriter == null) return;
        try {
            statusWriter.write(record);
        } catch (IOException e) {
            LOGGER.warning("Could not write status row for " + record.sourcePath() + ": " + e.getMessage());
        }
    }
}
