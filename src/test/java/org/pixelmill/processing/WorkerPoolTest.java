package org.pixelmill.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pixelmill.metrics.ErrorKind;
import org.pixelmill.metrics.ResultRecord;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private static final Duration GRACE = Duration.ofSeconds(5);

    private static List<WorkItem> items(int count) {
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(new WorkItem(Path.of("in", "img_" + i + ".png"), Path.of("out", "img_" + i + ".png"),
                    TransformConfig.defaults()));
        }
        return items;
    }

    private static ResultRecord success(WorkItem item) {
        return ResultRecord.succeeded(item.sourcePath(), item.destinationPath(), Duration.ofMillis(1), 10);
    }

    private static long count(List<ResultRecord> records, ErrorKind kind) {
        return records.stream().filter(r -> r.errorKind() == kind).count();
    }

    @Test
    void testRun_emptyListReturnsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        WorkerPool pool = new WorkerPool(item -> {
            calls.incrementAndGet();
            return success(item);
        }, 4, 8, GRACE);

        assertTrue(pool.run(List.of()).isEmpty());
        assertEquals(0, calls.get());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testRun_everyItemReportedExactlyOnce() {
        List<WorkItem> items = items(200);
        WorkerPool pool = new WorkerPool(WorkerPoolTest::success, 4, 2, GRACE);

        List<ResultRecord> records = pool.run(items);

        assertEquals(items.size(), records.size());
        Set<Path> sources = new HashSet<>();
        records.forEach(r -> sources.add(r.sourcePath()));
        assertEquals(items.size(), sources.size(), "No item may be reported twice.");
        assertTrue(records.stream().allMatch(ResultRecord::success));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testRun_faultsAreContainedPerItem() {
        List<WorkItem> items = items(10);
        Path exploding = items.get(3).sourcePath();
        Path erroring = items.get(5).sourcePath();
        Path silent = items.get(7).sourcePath();
        WorkerPool pool = new WorkerPool(item -> {
            if (item.sourcePath().equals(exploding)) throw new IllegalStateException("native crash");
            if (item.sourcePath().equals(erroring)) throw new StackOverflowError("deep");
            if (item.sourcePath().equals(silent)) return null;
            return success(item);
        }, 3, 4, GRACE);

        List<ResultRecord> records = pool.run(items);

        assertEquals(10, records.size());
        assertEquals(3, count(records, ErrorKind.WORKER_FAULT));
        assertEquals(7, records.stream().filter(ResultRecord::success).count());
        ResultRecord crash = records.stream().filter(r -> r.sourcePath().equals(exploding)).findFirst().orElseThrow();
        assertEquals("native crash", crash.message());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testRun_collectorCalledOnCallingThreadOnly() {
        Thread caller = Thread.currentThread();
        Set<Thread> collectorThreads = new HashSet<>();
        Set<String> workerThreads = ConcurrentHashMap.newKeySet();

        new WorkerPool(item -> {
            workerThreads.add(Thread.currentThread().getName());
            return success(item);
        }, 4, 4, GRACE).run(items(40), record -> collectorThreads.add(Thread.currentThread()));

        assertEquals(Set.of(caller), collectorThreads);
        assertTrue(workerThreads.stream().allMatch(name -> name.startsWith("ImageWorker-")));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testRun_neverExceedsConcurrency() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        WorkerPool pool = new WorkerPool(item -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(5);
            running.decrementAndGet();
            return success(item);
        }, 2, 1, GRACE);

        assertEquals(30, pool.run(items(30)).size());
        assertTrue(maxRunning.get() <= 2, "At most two items may run at once, saw " + maxRunning.get());
    }

    @Test
    void testWorkersFor() {
        int cpus = Runtime.getRuntime().availableProcessors();
        WorkerPool auto = new WorkerPool(WorkerPoolTest::success, 0, 8, GRACE);
        assertEquals(1, auto.workersFor(1));
        assertEquals(Math.min(cpus, 5), auto.workersFor(5));
        assertEquals(3, new WorkerPool(WorkerPoolTest::success, 3, 8, GRACE).workersFor(100));
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(WorkerPoolTest::success, -1, 8, GRACE));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testShutdown_pendingItemsAreCancelledNotDropped() {
        List<WorkItem> items = items(10);
        WorkerPool[] holder = new WorkerPool[1];
        holder[0] = new WorkerPool(item -> {
            holder[0].shutdown();
            return success(item);
        }, 1, 0, GRACE);

        List<ResultRecord> records = holder[0].run(items);

        assertTrue(holder[0].isShutdown());
        assertEquals(10, records.size(), "Shutdown must not drop any item.");
        assertEquals(1, records.stream().filter(ResultRecord::success).count());
        assertEquals(9, count(records, ErrorKind.CANCELLED));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testShutdown_runningItemAbandonedAfterGrace() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        WorkerPool pool = new WorkerPool(item -> {
            started.countDown();
            never.await();
            return success(item);
        }, 1, 2, Duration.ofMillis(200));

        Thread stopper = new Thread(() -> {
            try {
                started.await();
                pool.shutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        stopper.start();

        List<ResultRecord> records = pool.run(items(4));
        stopper.join();

        assertEquals(4, records.size());
        assertEquals(4, count(records, ErrorKind.CANCELLED));
        assertTrue(records.stream().anyMatch(r -> r.message().startsWith("Abandoned")));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testRun_collectorFailureStopsRemainingWork() throws InterruptedException {
        AtomicInteger started = new AtomicInteger();
        WorkerPool pool = new WorkerPool(item -> {
            started.incrementAndGet();
            Thread.sleep(50);
            return success(item);
        }, 1, 20, GRACE);

        assertThrows(IllegalStateException.class, () -> pool.run(items(20), record -> {
            throw new IllegalStateException("status sink closed");
        }));

        assertTrue(pool.isShutdown());
        int afterFailure = started.get();
        Thread.sleep(300);
        assertEquals(afterFailure, started.get(), "No item may start once the collector has failed.");
        assertTrue(started.get() < 20);
    }
}
