package org.pixelmill.processing;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One image to process: read {@code sourcePath}, transform it, write {@code destinationPath}.
 * Several items may share a source (load amplification); destination collisions are the caller's concern.
 */
public record WorkItem(Path sourcePath, Path destinationPath, TransformConfig transformConfig) {

    public WorkItem {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(destinationPath, "destinationPath");
        Objects.requireNonNull(transformConfig, "transformConfig");
    }

    public String displayName() {
        return sourcePath.getFileName().toString();
    }
}
