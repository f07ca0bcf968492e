package org.pixelmill.metrics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultStatusWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWrite_headerOnceAndOneRowPerRecord() throws IOException {
        Path statusFile = tempDir.resolve("status.csv");

        try (ResultStatusWriter writer = new ResultStatusWriter(statusFile)) {
            writer.write(ResultRecord.succeeded(Path.of("a.png"), Path.of("out", "processed_a.png"), Duration.ofMillis(12), 1234));
        }
        try (ResultStatusWriter writer = new ResultStatusWriter(statusFile)) {
            writer.write(StatusHelper.createFailedResult(Path.of("b,c.png"), Path.of("out", "processed_b.png"),
                    ErrorKind.TRANSFORM_ERROR, "Sharpen", new RuntimeException("bad"), Duration.ofMillis(3)));
        }

        List<String> lines = Files.readAllLines(statusFile);
        assertEquals(3, lines.size(), "Header is written only when the file is new.");
        assertEquals(ResultStatusWriter.HEADER.trim(), lines.get(0));
        assertTrue(lines.get(1).contains(",PASS,,,12,1234,"));
        assertTrue(lines.get(2).contains("\"b,c.png\""), "Fields with commas are quoted.");
        assertTrue(lines.get(2).contains(",FAIL,TRANSFORM_ERROR,Sharpen,3,,"));
        assertTrue(lines.get(2).endsWith(",bad"));
    }
}
