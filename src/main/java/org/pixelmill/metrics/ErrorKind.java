package org.pixelmill.metrics;

/**
 * Failure taxonomy for per-item results.
 */
public enum ErrorKind {
    /** A source could not be read or a destination could not be written. */
    ACCESS_ERROR,
    /** The source bytes are not a decodable image. */
    DECODE_ERROR,
    /** A transform stage rejected the image; the record names the stage. */
    TRANSFORM_ERROR,
    /** Anything else thrown inside a worker. */
    WORKER_FAULT,
    /** The pool was shut down before the item ran, or the item was abandoned after the grace period. */
    CANCELLED
}
