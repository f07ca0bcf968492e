package org.pixelmill.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Utility methods for handling executors and thread naming.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());

    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named, non-daemon platform threads ({@code prefix0}, {@code prefix1}, ...).
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Default worker count for CPU-bound work: one per available processor, never more than there are items,
     * never less than one.
     */
    public static int defaultConcurrency(final int itemCount) {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), itemCount));
    }

    /**
     * Gracefully shuts down an ExecutorService using the default grace period.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        shutdownExecutorService(executor, name, DEFAULT_SHUTDOWN_GRACE);
    }

    /**
     * Gracefully shuts down an ExecutorService, forcing it after {@code grace} has elapsed.
     *
     * @return true if the executor terminated within the grace period without being forced
     */
    public static boolean shutdownExecutorService(final ExecutorService executor, final String name, final Duration grace) {
        if (executor == null) return true;
        LOGGER.fine(() -> "Attempting graceful shutdown of executor: " + name);

        executor.shutdown(); // Disable new tasks
        try {
            if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.fine(() -> "Executor " + name + " terminated gracefully.");
                return true;
            }
            LOGGER.warning("Executor %s did not terminate in %dms, attempting forceful shutdown...".formatted(name, grace.toMillis()));
            final List<Runnable> droppedTasks = executor.shutdownNow(); // Cancel executing tasks
            LOGGER.warning("Executor %s forcing shutdown. Dropped %d waiting tasks.".formatted(name, droppedTasks.size()));

            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS))
                LOGGER.severe("Executor " + name + " did not terminate even after forcing.");
            else
                LOGGER.info("Executor " + name + " terminated after forcing.");
        } catch (final InterruptedException ie) {
            LOGGER.warning("Shutdown wait for executor " + name + " interrupted. Forcing shutdown now.");
            executor.shutdownNow(); // Re-cancel if interrupted
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
        return false;
    }
}
