package org.pixelmill.metrics;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Running aggregate of result records.
 * <p>
 * Not thread-safe: the instance belongs to the single collector thread that reads the pool's result channel.
 * The first thread to call {@link #add(ResultRecord)} becomes the owner and any other writer is rejected.
 * Accumulation is commutative, so the final summary does not depend on arrival order.
 */
public final class SummaryAccumulator {

    private final Map<ErrorKind, Integer> errorsByKind = new EnumMap<>(ErrorKind.class);
    private Thread owner;
    private int total;
    private int succeeded;
    private int failed;
    private Duration successElapsed = Duration.ZERO;

    public void add(final ResultRecord record) {
        checkOwner();
        total++;
        if (record.success()) {
            succeeded++;
            successElapsed = successElapsed.plus(record.elapsed());
        } else {
            failed++;
            errorsByKind.merge(record.errorKind(), 1, Integer::sum);
        }
    }

    public int total() {
        return total;
    }

    public int succeeded() {
        return succeeded;
    }

    public int failed() {
        return failed;
    }

    public BatchSummary finish(final Duration wallClock) {
        final Duration average = succeeded == 0 ? Duration.ZERO : successElapsed.dividedBy(succeeded);
        return new BatchSummary(total, succeeded, failed, successElapsed, average, wallClock, errorsByKind);
    }

    private void checkOwner() {
        final Thread current = Thread.currentThread();
        if (owner == null) {
            owner = current;
        } else if (owner != current) {
            throw new IllegalStateException("SummaryAccumulator is owned by " + owner.getName()
                                            + ", write attempted from " + current.getName());
        }
    }
}
