package org.imagebatch.metrics;

/**
 * Represents the status of a batch, task or run.
 */
public enum Status {
    PASS,    // no failures
    FAIL,    // failures and nothing converted
    PARTIAL  // some converted, some failed
}
