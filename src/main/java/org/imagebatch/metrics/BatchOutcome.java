package org.imagebatch.metrics;

import java.time.Duration;

/**
 * Result of one dispatched batch. {@code failureCause} is set only when the batch as a whole
 * failed, in which case every item of the batch is counted in {@code failed}.
 */
public record BatchOutcome(int batchId, String batchName, int itemCount, int success, int failed,
                           Duration duration, String threadName, Throwable failureCause) implements HasStatus {

    @Override
    public Status status() {
        return StatusHelper.statusOf(success, failed);
    }
}
