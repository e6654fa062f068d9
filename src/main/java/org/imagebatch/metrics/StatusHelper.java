package org.imagebatch.metrics;

import java.time.Duration;
import java.util.List;

/**
 * Helper methods for building outcomes, especially for failure cases, and for deriving status.
 */
public final class StatusHelper {

    private StatusHelper() {
    } // Prevent instantiation

    /**
     * Outcome for a batch that failed as a whole: every one of its items counts as failed,
     * whatever happened to the individual items before the failure.
     */
    public static BatchOutcome createFailedBatchOutcome(int batchId, String batchName, int itemCount, Throwable cause) {
        return new BatchOutcome(batchId, batchName, itemCount, 0, itemCount, Duration.ZERO,
                Thread.currentThread().getName(), cause);
    }

    public static Status statusOf(int success, int failed) {
        if (failed == 0) return Status.PASS;
        return success == 0 ? Status.FAIL : Status.PARTIAL;
    }

    /**
     * FAIL if any result failed outright, PARTIAL if any was partial, PASS otherwise
     * (including an empty list).
     */
    public static <T extends HasStatus> Status determineOverallStatus(final List<T> results) {
        if (results.stream().anyMatch(r -> r.status() == Status.FAIL)) return Status.FAIL;
        if (results.stream().anyMatch(r -> r.status() == Status.PARTIAL)) return Status.PARTIAL;
        return Status.PASS;
    }
}
