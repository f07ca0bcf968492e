package org.pixelmill.metrics;

public interface HasStatus {
    Status status();
}
