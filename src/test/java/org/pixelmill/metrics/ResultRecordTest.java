package org.pixelmill.metrics;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ResultRecordTest {

    @Test
    void testSucceeded() {
        ResultRecord record = ResultRecord.succeeded(Path.of("a.png"), Path.of("out.png"), Duration.ofMillis(3), 42);
        assertTrue(record.success());
        assertEquals(Status.PASS, record.status());
        assertTrue(record.error().isEmpty());
        assertEquals(42, record.bytesWritten().getAsLong());
        assertEquals(Thread.currentThread().getName(), record.threadName());
    }

    @Test
    void testFailureCarriesKindAndMessage() {
        ResultRecord record = StatusHelper.createFailedResult(Path.of("a.png"), Path.of("out.png"),
                ErrorKind.TRANSFORM_ERROR, "Blur", new IllegalArgumentException("bad radius"), Duration.ZERO);
        assertFalse(record.success());
        assertEquals(Status.FAIL, record.status());
        assertEquals(ErrorKind.TRANSFORM_ERROR, record.error().orElseThrow());
        assertEquals("Blur", record.failedStage());
        assertEquals("bad radius", record.message());
        assertTrue(record.bytesWritten().isEmpty());
    }

    @Test
    void testCancelledResult() {
        ResultRecord record = StatusHelper.createCancelledResult(Path.of("a.png"), null, "stopped");
        assertEquals(ErrorKind.CANCELLED, record.errorKind());
        assertEquals("stopped", record.message());
    }

    @Test
    void testDescribe_fallsBackToClassName() {
        assertEquals("java.lang.NullPointerException", StatusHelper.describe(new NullPointerException()));
        assertEquals("Unknown cause", StatusHelper.describe(null));
    }

    @Test
    void testInconsistentRecordsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResultRecord(Path.of("a.png"), null, true,
                ErrorKind.DECODE_ERROR, null, null, Duration.ZERO, null, "t"));
        assertThrows(IllegalArgumentException.class, () -> new ResultRecord(Path.of("a.png"), null, false,
                null, null, null, Duration.ZERO, null, "t"));
    }
}
