package org.pixelmill.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A path could not be read or written. Fatal when it concerns the batch's input or output root.
 */
public class AccessException extends IOException {

    private final Path path;

    public AccessException(final Path path, final String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public AccessException(final Path path, final String message, final Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
