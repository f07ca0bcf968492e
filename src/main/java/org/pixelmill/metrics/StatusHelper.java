package org.pixelmill.metrics;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Helper methods for creating failed result records.
 */
public final class StatusHelper {

    private StatusHelper() {
    } // Prevent instantiation

    // --- Failure Record Creators ---

    public static ResultRecord createFailedResult(Path source, Path destination, ErrorKind kind, String stage,
                                                  Throwable cause, Duration elapsed) {
        return new ResultRecord(source, destination, false, kind, stage, describe(cause), elapsed, null,
                Thread.currentThread().getName());
    }

    public static ResultRecord createWorkerFault(Path source, Path destination, Throwable cause, Duration elapsed) {
        return createFailedResult(source, destination, ErrorKind.WORKER_FAULT, null, cause, elapsed);
    }

    public static ResultRecord createCancelledResult(Path source, Path destination, String reason) {
        return new ResultRecord(source, destination, false, ErrorKind.CANCELLED, null, reason, Duration.ZERO, null,
                Thread.currentThread().getName());
    }

    static String describe(Throwable cause) {
        if (cause == null) return "Unknown cause";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
