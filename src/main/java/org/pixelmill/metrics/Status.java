package org.pixelmill.metrics;

/**
 * Represents the status of a processed item.
 */
public enum Status {
    PASS, // Completed successfully
    FAIL  // Failed, see the error kind
}
