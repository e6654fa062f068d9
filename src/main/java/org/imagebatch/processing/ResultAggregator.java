package org.imagebatch.processing;

import org.imagebatch.metrics.Status;
import org.imagebatch.metrics.StatusHelper;
import org.imagebatch.metrics.TaskResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Run-wide totals. Every processed task is added, including tasks that contributed nothing.
 */
public class ResultAggregator {

    private final List<TaskResult> taskResults = new ArrayList<>();
    private TaskResult total = TaskResult.EMPTY;

    public synchronized void add(final TaskResult taskResult) {
        taskResults.add(taskResult);
        total = total.plus(taskResult);
    }

    public synchronized TaskResult total() {
        return total;
    }

    public synchronized int taskCount() {
        return taskResults.size();
    }

    public synchronized Status status() {
        return StatusHelper.determineOverallStatus(taskResults);
    }

    /**
     * 0 when nothing failed across the run, 1 otherwise.
     */
    public int exitCode() {
        return total().failed() == 0 ? 0 : 1;
    }
}
