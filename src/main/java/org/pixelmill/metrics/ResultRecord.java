package org.pixelmill.metrics;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Outcome of one work item. Created once by the worker (or the pool, for faults and cancellations).
 *
 * @param errorKind          null on success
 * @param failedStage        name of the transform stage that failed, null unless {@link ErrorKind#TRANSFORM_ERROR}
 * @param outputBytesWritten null unless the image was written
 */
public record ResultRecord(Path sourcePath, Path destinationPath, boolean success, ErrorKind errorKind,
                           String failedStage, String message, Duration elapsed, Long outputBytesWritten,
                           String threadName) implements HasStatus {

    public ResultRecord {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(elapsed, "elapsed");
        if (success && errorKind != null)
            throw new IllegalArgumentException("A successful result cannot carry an error kind");
        if (!success && errorKind == null)
            throw new IllegalArgumentException("A failed result must carry an error kind");
    }

    public static ResultRecord succeeded(Path sourcePath, Path destinationPath, Duration elapsed, long bytesWritten) {
        return new ResultRecord(sourcePath, destinationPath, true, null, null, null, elapsed, bytesWritten,
                Thread.currentThread().getName());
    }

    @Override
    public Status status() {
        return success ? Status.PASS : Status.FAIL;
    }

    public Optional<ErrorKind> error() {
        return Optional.ofNullable(errorKind);
    }

    public OptionalLong bytesWritten() {
        return outputBytesWritten == null ? OptionalLong.empty() : OptionalLong.of(outputBytesWritten);
    }
}
