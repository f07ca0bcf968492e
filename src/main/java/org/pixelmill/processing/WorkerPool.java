package org.pixelmill.processing;

import org.pixelmill.metrics.ResultRecord;
import org.pixelmill.metrics.StatusHelper;
import org.pixelmill.util.ConcurrencyUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of platform threads that turns work items into result records.
 * <p>
 * Guarantees for every {@code run}:
 * <ul>
 *     <li>each item yields exactly one record, whatever happens inside the worker;</li>
 *     <li>anything thrown by the processor becomes a {@code WORKER_FAULT} record and never reaches other items;</li>
 *     <li>at most {@code workers + queueCapacity} items are handed to the executor at a time, further submission
 *     blocks the dispatcher thread;</li>
 *     <li>records travel through a single result queue and are handed to the collector on the calling thread only.</li>
 * </ul>
 * Returning from {@code run} is the drain signal: all records have been delivered.
 * <p>
 * {@link #shutdown()} stops dispatching. Items not yet started are reported {@code CANCELLED}, running items get
 * the grace period to finish and are reported {@code CANCELLED} (and their late result discarded) if they do not.
 */
public class WorkerPool {

    private static final Logger LOGGER = Logger.getLogger(WorkerPool.class.getName());
    private static final long POLL_MILLIS = 50;

    /**
     * Life cycle of one item within a run.
     */
    public enum ItemState {
        QUEUED, IN_PROGRESS, COMPLETED, FAILED
    }

    private final WorkItemProcessor processor;
    private final int concurrency;
    private final int queueCapacity;
    private final Duration shutdownGrace;

    private volatile boolean shutdownRequested;
    private volatile long shutdownRequestedAt;

    /**
     * @param concurrency   worker count, or 0 for {@code min(cpuCount, itemCount)}
     * @param queueCapacity number of dispatched items allowed to wait for a free worker
     */
    public WorkerPool(final WorkItemProcessor processor, final int concurrency, final int queueCapacity,
                      final Duration shutdownGrace) {
        if (concurrency < 0) throw new IllegalArgumentException("concurrency must be >= 0: " + concurrency);
        if (queueCapacity < 0) throw new IllegalArgumentException("queueCapacity must be >= 0: " + queueCapacity);
        this.processor = Objects.requireNonNull(processor);
        this.concurrency = concurrency;
        this.queueCapacity = queueCapacity;
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace);
    }

    public int workersFor(final int itemCount) {
        return concurrency > 0 ? concurrency : ConcurrencyUtils.defaultConcurrency(itemCount);
    }

    /**
     * Cooperative shutdown. Safe to call from any thread, including while {@code run} is blocked.
     */
    public void shutdown() {
        if (!shutdownRequested) {
            shutdownRequestedAt = System.nanoTime();
            shutdownRequested = true;
            LOGGER.warning("Shutdown requested: no further items will be dispatched.");
        }
    }

    public boolean isShutdown() {
        return shutdownRequested;
    }

    /**
     * Processes all items and returns their records in completion order.
     */
    public List<ResultRecord> run(final List<WorkItem> items) {
        final List<ResultRecord> records = new ArrayList<>(items.size());
        run(items, records::add);
        return records;
    }

    /**
     * Processes all items, handing each record to {@code collector} on the calling thread as it arrives.
     */
    public void run(final List<WorkItem> items, final Consumer<ResultRecord> collector) {
        if (items.isEmpty()) {
            LOGGER.fine("No work items to process.");
            return;
        }
        new Run(List.copyOf(items), workersFor(items.size())).execute(collector);
    }

    /**
     * State of a single {@code run} call.
     */
    private final class Run {
        private final List<WorkItem> items;
        private final int workers;
        private final AtomicReferenceArray<ItemState> states;
        private final BlockingQueue<ResultRecord> results = new LinkedBlockingQueue<>();
        private final Semaphore window;
        private final ExecutorService executor;
        private int abandoned;

        Run(final List<WorkItem> items, final int workers) {
            this.items = items;
            this.workers = workers;
            this.states = new AtomicReferenceArray<>(items.size());
            for (int i = 0; i < items.size(); i++) states.set(i, ItemState.QUEUED);
            this.window = new Semaphore(workers + queueCapacity);
            this.executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(), ConcurrencyUtils.createPlatformThreadFactory("ImageWorker-"));
        }

        void execute(final Consumer<ResultRecord> collector) {
            LOGGER.info("Processing %d item(s) with %d worker(s).".formatted(items.size(), workers));
            final Thread dispatcher = new Thread(this::dispatch, "PoolDispatcher");
            dispatcher.setDaemon(true);
            dispatcher.start();

            boolean interrupted = false;
            boolean drained = false;
            try {
                int received = 0;
                while (received < items.size()) {
                    final ResultRecord record;
                    try {
                        record = results.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        interrupted = true;
                        shutdown();
                        continue;
                    }
                    if (record != null) {
                        collector.accept(record);
                        received++;
                    } else if (shutdownRequested) {
                        cancelNotStarted();
                        if (graceExpired()) abandonInFlight();
                    }
                }
                drained = true;
            } finally {
                dispatcher.interrupt();
                if (!drained) {
                    // collector failed: stop dispatching and drop whatever is queued or running
                    shutdown();
                    executor.shutdownNow();
                } else if (abandoned > 0) {
                    LOGGER.warning("Abandoned %d running item(s); forcing worker shutdown.".formatted(abandoned));
                    executor.shutdownNow();
                } else {
                    ConcurrencyUtils.shutdownExecutorService(executor, "ImageWorkerPool", shutdownGrace);
                }
                if (interrupted) Thread.currentThread().interrupt();
            }
        }

        private void dispatch() {
            int next = 0;
            try {
                for (; next < items.size(); next++) {
                    if (!acquireSlot()) break;
                    final int index = next;
                    try {
                        executor.execute(() -> work(index));
                    } catch (RejectedExecutionException e) {
                        window.release();
                        break;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                for (int i = next; i < items.size(); i++) {
                    cancel(i, ItemState.QUEUED, "Pool shut down before dispatch");
                }
            }
        }

        // Blocks until a slot in the submission window is free; false once shutdown is requested.
        private boolean acquireSlot() throws InterruptedException {
            while (!window.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (shutdownRequested) return false;
            }
            if (shutdownRequested) {
                window.release();
                return false;
            }
            return true;
        }

        private void work(final int index) {
            try {
                if (shutdownRequested) {
                    cancel(index, ItemState.QUEUED, "Pool shut down before start");
                    return;
                }
                if (!states.compareAndSet(index, ItemState.QUEUED, ItemState.IN_PROGRESS)) return;

                final WorkItem item = items.get(index);
                final Instant start = Instant.now();
                ResultRecord record;
                try {
                    record = processor.process(item);
                    if (record == null) {
                        record = StatusHelper.createWorkerFault(item.sourcePath(), item.destinationPath(),
                                new IllegalStateException("Processor returned no result"), Duration.between(start, Instant.now()));
                    }
                } catch (Throwable t) {
                    LOGGER.log(Level.WARNING, "Worker fault while processing " + item.displayName(), t);
                    record = StatusHelper.createWorkerFault(item.sourcePath(), item.destinationPath(), t,
                            Duration.between(start, Instant.now()));
                }
                complete(index, record);
            } finally {
                window.release();
            }
        }

        private void complete(final int index, final ResultRecord record) {
            final ItemState terminal = record.success() ? ItemState.COMPLETED : ItemState.FAILED;
            if (states.compareAndSet(index, ItemState.IN_PROGRESS, terminal)) {
                results.add(record);
            } else {
                LOGGER.fine(() -> "Discarding late result for abandoned item " + items.get(index).displayName());
            }
        }

        private boolean cancel(final int index, final ItemState expected, final String reason) {
            if (!states.compareAndSet(index, expected, ItemState.FAILED)) return false;
            final WorkItem item = items.get(index);
            results.add(StatusHelper.createCancelledResult(item.sourcePath(), item.destinationPath(), reason));
            return true;
        }

        private boolean graceExpired() {
            return System.nanoTime() - shutdownRequestedAt >= shutdownGrace.toNanos();
        }

        // Items handed to the executor but still waiting for a worker.
        private void cancelNotStarted() {
            for (int i = 0; i < items.size(); i++) cancel(i, ItemState.QUEUED, "Pool shut down before start");
        }

        private void abandonInFlight() {
            for (int i = 0; i < items.size(); i++) {
                if (cancel(i, ItemState.IN_PROGRESS, "Abandoned after shutdown grace period")) abandoned++;
            }
        }
    }
}
