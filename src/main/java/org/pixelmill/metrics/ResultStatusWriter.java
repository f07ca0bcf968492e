package org.pixelmill.metrics;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.Logger;

import static org.pixelmill.util.Utils.escapeCsvField;

/**
 * Appends one CSV row per result record to a status file. The header is written only when the file is new.
 */
public class ResultStatusWriter implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(ResultStatusWriter.class.getName());
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    static final String HEADER = "logged_ts,source,destination,status,error_kind,failed_stage,elapsed_ms,bytes_written,thread,message\n";

    private final BufferedWriter statusWriter;

    public ResultStatusWriter(Path statusFile) throws IOException {
        Path parent = statusFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        boolean isNew = !Files.exists(statusFile) || Files.size(statusFile) == 0;

        this.statusWriter = Files.newBufferedWriter(statusFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        if (isNew) {
            this.statusWriter.write(HEADER);
            this.statusWriter.flush();
        }
        LOGGER.fine(() -> "Writing per-image status to " + statusFile);
    }

    public synchronized void write(ResultRecord r) throws IOException {
        String csv = LocalDateTime.now().format(FORMATTER)
                     + "," + escapeCsvField(r.sourcePath().toString())
                     + "," + escapeCsvField(r.destinationPath() == null ? "" : r.destinationPath().toString())
                     + "," + r.status()
                     + "," + (r.errorKind() == null ? "" : r.errorKind().name())
                     + "," + escapeCsvField(r.failedStage())
                     + "," + r.elapsed().toMillis()
                     + "," + (r.outputBytesWritten() == null ? "" : r.outputBytesWritten())
                     + "," + escapeCsvField(r.threadName())
                     + "," + escapeCsvField(r.message()) + "\n";
        this.statusWriter.write(csv);
        this.statusWriter.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        this.statusWriter.close();
    }
}
