package org.pixelmill.processing;

import org.pixelmill.exception.DecodeException;
import org.pixelmill.exception.TransformException;
import org.pixelmill.imaging.ImagingLibrary;
import org.pixelmill.metrics.ErrorKind;
import org.pixelmill.metrics.ResultRecord;
import org.pixelmill.metrics.StatusHelper;
import org.pixelmill.util.Utils;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads, decodes, transforms, encodes and writes one image. The source file is only ever read.
 */
public class ImageWorker implements WorkItemProcessor {

    private static final Logger LOGGER = Logger.getLogger(ImageWorker.class.getName());

    private final ImagingLibrary imaging;
    private final float outputQuality;

    public ImageWorker(final ImagingLibrary imaging, final float outputQuality) {
        this.imaging = Objects.requireNonNull(imaging);
        this.outputQuality = outputQuality;
    }

    @Override
    public ResultRecord process(final WorkItem item) {
        final Path source = item.sourcePath();
        final Path destination = item.destinationPath();
        final Instant start = Instant.now();
        LOGGER.info("Processing " + item.displayName() + "...");

        final byte[] data;
        try {
            data = Files.readAllBytes(source);
        } catch (IOException e) {
            return fail(item, ErrorKind.ACCESS_ERROR, null, e, start);
        }

        final BufferedImage decoded;
        try {
            decoded = imaging.decode(data);
        } catch (DecodeException e) {
            return fail(item, ErrorKind.DECODE_ERROR, null, e, start);
        }

        final BufferedImage transformed;
        try {
            transformed = new TransformChain(imaging, item.transformConfig()).apply(decoded);
        } catch (TransformException e) {
            return fail(item, ErrorKind.TRANSFORM_ERROR, e.getStageName(), e, start);
        }

        final long written;
        try {
            final byte[] encoded = imaging.encode(transformed, formatFor(destination), outputQuality);
            Files.write(destination, encoded);
            written = encoded.length;
        } catch (IOException e) {
            return fail(item, ErrorKind.ACCESS_ERROR, null, e, start);
        }

        final Duration elapsed = Duration.between(start, Instant.now());
        LOGGER.info("Finished processing %s in %s seconds".formatted(item.displayName(), Utils.formatSeconds(elapsed)));
        return ResultRecord.succeeded(source, destination, elapsed, written);
    }

    /**
     * ImageIO format name for a destination path, from its extension; PNG when it has none.
     */
    static String formatFor(final Path destination) {
        final String ext = Utils.extensionOf(destination);
        if (ext.isEmpty()) return "png";
        final String format = ext.substring(1);
        return format.equals("jpeg") ? "jpg" : format;
    }

    private ResultRecord fail(WorkItem item, ErrorKind kind, String stage, Throwable cause, Instant start) {
        LOGGER.warning("Error processing %s (%s%s): %s".formatted(item.displayName(), kind,
                stage != null ? " in " + stage : "", cause.getMessage()));
        return StatusHelper.createFailedResult(item.sourcePath(), item.destinationPath(), kind, stage, cause,
                Duration.between(start, Instant.now()));
    }
}
