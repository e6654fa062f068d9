package org.imagebatch.metrics;

public interface HasStatus {
    Status status();
}
