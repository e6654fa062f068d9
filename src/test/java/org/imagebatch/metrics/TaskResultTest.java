package org.imagebatch.metrics;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskResultTest {

    @Test
    void testPlusIsOrderIndependent() {
        TaskResult a = new TaskResult(3, 1, 0);
        TaskResult b = new TaskResult(0, 2, 5);
        TaskResult c = new TaskResult(7, 0, 1);
        assertEquals(a.plus(b).plus(c), c.plus(a).plus(b));
        assertEquals(new TaskResult(10, 3, 6), a.plus(b).plus(c));
    }

    @Test
    void testPlusBatchKeepsSkipped() {
        BatchOutcome batch = new BatchOutcome(1, "Batch-1_a..b", 3, 2, 1, Duration.ZERO, "t", null);
        assertEquals(new TaskResult(2, 1, 4), TaskResult.skippedOnly(4).plus(batch));
    }

    @Test
    void testNegativeCountsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TaskResult(-1, 0, 0));
    }

    @Test
    void testStatus() {
        assertEquals(Status.PASS, TaskResult.EMPTY.status());
        assertEquals(Status.PASS, TaskResult.skippedOnly(3).status());
        assertEquals(Status.FAIL, new TaskResult(0, 2, 0).status());
        assertEquals(Status.PARTIAL, new TaskResult(1, 2, 0).status());
    }

    @Test
    void testFailedBatchOutcomeCountsEveryItem() {
        RuntimeException cause = new RuntimeException("pool gone");
        BatchOutcome outcome = StatusHelper.createFailedBatchOutcome(4, "Batch-4_x", 6, cause);
        assertEquals(0, outcome.success());
        assertEquals(6, outcome.failed());
        assertSame(cause, outcome.failureCause());
        assertEquals(Status.FAIL, outcome.status());
    }

    @Test
    void testDetermineOverallStatus() {
        assertEquals(Status.PASS, StatusHelper.determineOverallStatus(List.<TaskResult>of()));
        assertEquals(Status.PARTIAL, StatusHelper.determineOverallStatus(
                List.of(new TaskResult(1, 0, 0), new TaskResult(1, 1, 0))));
        assertEquals(Status.FAIL, StatusHelper.determineOverallStatus(
                List.of(new TaskResult(1, 1, 0), new TaskResult(0, 1, 0))));
    }
}
