package org.pixelmill.metrics;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate over all results of one batch.
 *
 * @param totalElapsed    summed processing time of the succeeded items
 * @param perImageAverage totalElapsed / succeeded, zero when nothing succeeded
 * @param wallClock       end-to-end duration of the batch
 */
public record BatchSummary(int totalItems, int succeeded, int failed, Duration totalElapsed,
                           Duration perImageAverage, Duration wallClock, Map<ErrorKind, Integer> errorsByKind)
        implements HasStatus {

    public BatchSummary {
        errorsByKind = errorsByKind.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(errorsByKind));
    }

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO, Map.of());
    }

    public int errorCount(ErrorKind kind) {
        return errorsByKind.getOrDefault(kind, 0);
    }

    @Override
    public Status status() {
        return failed == 0 ? Status.PASS : Status.FAIL;
    }
}
