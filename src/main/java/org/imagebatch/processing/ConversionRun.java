package org.imagebatch.processing;

import org.imagebatch.config.TaskConfig;
import org.imagebatch.metrics.TaskResult;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the enabled tasks of a task file one after another and folds their results.
 */
public class ConversionRun {
    private static final Logger LOGGER = Logger.getLogger(ConversionRun.class.getName());
    private static final String SEPARATOR = "=".repeat(60);

    private final TaskProcessor processor;
    private final ShutdownController shutdown;
    private final PrintStream out;

    public ConversionRun(TaskProcessor processor, ShutdownController shutdown, PrintStream out) {
        this.processor = Objects.requireNonNull(processor);
        this.shutdown = Objects.requireNonNull(shutdown);
        this.out = Objects.requireNonNull(out);
    }

    /**
     * Processes {@code tasks} in order. Once shutdown is requested the remaining tasks are not
     * started; they are still added to the totals, as zero.
     */
    public ResultAggregator execute(final List<TaskConfig> tasks) {
        final ResultAggregator aggregator = new ResultAggregator();
        for (TaskConfig task : tasks) {
            if (shutdown.isShutdown()) {
                LOGGER.warning(String.format("[%s] Skipped, shutdown requested.", task.name()));
                aggregator.add(TaskResult.EMPTY);
                continue;
            }
            TaskResult result;
            try {
                result = processor.process(task);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, String.format("[%s] Uncaught exception, task contributes nothing: %s", task.name(), e), e);
                result = TaskResult.EMPTY;
            }
            aggregator.add(result);
        }
        printSummary(aggregator);
        return aggregator;
    }

    private void printSummary(final ResultAggregator aggregator) {
        final TaskResult total = aggregator.total();
        out.println();
        out.println(SEPARATOR);
        out.printf("Total (%d task(s), %s): success %d, failed %d, skipped %d%n", aggregator.taskCount(),
                aggregator.status(), total.success(), total.failed(), total.skipped());
        out.println(SEPARATOR);
    }
}
