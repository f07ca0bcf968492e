package org.pixelmill.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes a {@link BatchSummary} as JSON for external profiling and visualization tools.
 * Durations are written as milliseconds.
 */
public class SummaryReportWriter {

    private final ObjectMapper mapper;

    public SummaryReportWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Flat, tool-friendly view of a summary.
     */
    public record SummaryReport(String runName, String generatedAt, String status, int totalItems, int succeeded,
                                int failed, long totalElapsedMs, double perImageAverageMs, long wallClockMs,
                                double imagesPerSecond, Map<String, Integer> errorsByKind) {
    }

    public SummaryReport toReport(String runName, BatchSummary summary) {
        Map<String, Integer> errors = new LinkedHashMap<>();
        summary.errorsByKind().forEach((kind, count) -> errors.put(kind.name(), count));
        long wallMs = summary.wallClock().toMillis();
        double throughput = wallMs == 0 ? 0.0 : summary.succeeded() * 1000.0 / wallMs;
        return new SummaryReport(runName, Instant.now().toString(), summary.status().name(), summary.totalItems(),
                summary.succeeded(), summary.failed(), summary.totalElapsed().toMillis(),
                summary.perImageAverage().toNanos() / 1_000_000.0, wallMs, throughput, errors);
    }

    public String toJson(String runName, BatchSummary summary) throws IOException {
        return mapper.writeValueAsString(toReport(runName, summary));
    }

    public void write(Path reportFile, String runName, BatchSummary summary) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(reportFile.toFile(), toReport(runName, summary));
    }
}
