package org.imagebatch.metrics;

/**
 * Success, failure and skip counts of one task, or of a whole run once folded together.
 * Immutable; {@link #plus(TaskResult)} is a commutative sum so totals do not depend on the
 * order in which batches or tasks complete.
 */
public record TaskResult(int success, int failed, int skipped) implements HasStatus {

    public static final TaskResult EMPTY = new TaskResult(0, 0, 0);

    public TaskResult {
        if (success < 0 || failed < 0 || skipped < 0) {
            throw new IllegalArgumentException("Counts must be non-negative: " + success + "/" + failed + "/" + skipped);
        }
    }

    public static TaskResult skippedOnly(int skipped) {
        return new TaskResult(0, 0, skipped);
    }

    public TaskResult plus(TaskResult other) {
        return new TaskResult(success + other.success, failed + other.failed, skipped + other.skipped);
    }

    public TaskResult plus(BatchOutcome batch) {
        return new TaskResult(success + batch.success(), failed + batch.failed(), skipped);
    }

    public TaskResult withSkipped(int skippedCount) {
        return new TaskResult(success, failed, skippedCount);
    }

    public int processed() {
        return success + failed;
    }

    @Override
    public Status status() {
        return StatusHelper.statusOf(success, failed);
    }
}
