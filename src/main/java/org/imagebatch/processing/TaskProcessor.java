package org.imagebatch.processing;

import org.imagebatch.config.TaskConfig;
import org.imagebatch.metrics.TaskResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one task: discovery, planning, batch execution. Problems with the task itself (missing
 * input directory, nothing to convert, unreadable directory) end the task with an all-zero result.
 */
public class TaskProcessor {
    private static final Logger LOGGER = Logger.getLogger(TaskProcessor.class.getName());
    private static final String SEPARATOR = "=".repeat(60);

    private final BatchScheduler scheduler;
    private final PrintStream out;
    private final boolean showProgress;

    public TaskProcessor(BatchScheduler scheduler, PrintStream out, boolean showProgress) {
        this.scheduler = Objects.requireNonNull(scheduler);
        this.out = Objects.requireNonNull(out);
        this.showProgress = showProgress;
    }

    public TaskResult process(final TaskConfig task) {
        final Path inputDir = Path.of(task.inputPath());
        if (!Files.isDirectory(inputDir)) {
            LOGGER.warning(String.format("[%s] Input directory does not exist: %s", task.name(), inputDir));
            return TaskResult.EMPTY;
        }

        final FormatResolution formats = TaskPlanner.resolveFormats(task);
        final Path outputDir = TaskPlanner.resolveOutputDir(task, formats);

        final TaskPlan plan;
        try {
            final List<Path> files = FileDiscovery.findFiles(inputDir, formats.inputFormats());
            if (files.isEmpty()) {
                LOGGER.warning(String.format("[%s] No files found (format: %s)", task.name(),
                        formats.autoInput() ? TaskConfig.AUTO : formats.inputFormats().get(0).tag()));
                return TaskResult.EMPTY;
            }
            plan = TaskPlanner.plan(files, outputDir, formats, task.skipExisting());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, String.format("[%s] Could not prepare task: %s", task.name(), e), e);
            return TaskResult.EMPTY;
        }

        printTaskInfo(task, inputDir, plan);
        if (plan.toProcess() == 0) {
            out.println("All output files already exist.");
            return TaskResult.skippedOnly(plan.skipped());
        }

        out.printf("Converting %d file(s), %d skipped...%n", plan.toProcess(), plan.skipped());
        final Instant start = Instant.now();
        final ProgressTracker progress = new ProgressTracker(plan.toProcess(), out, showProgress);
        final TaskResult result = scheduler.run(task.name(), plan.workItems(), task.quality(), formats.direction(), progress)
                .withSkipped(plan.skipped());
        progress.finish();

        out.printf("[%s] success: %d, failed: %d, skipped: %d (%ds)%n", task.name(),
                result.success(), result.failed(), result.skipped(), Duration.between(start, Instant.now()).toSeconds());
        return result;
    }

    private void printTaskInfo(final TaskConfig task, final Path inputDir, final TaskPlan plan) {
        out.println();
        out.println(SEPARATOR);
        out.printf("Task      : %s%n", task.name());
        out.printf("Input     : %s%n", inputDir);
        out.printf("Output    : %s%n", plan.outputDir());
        out.printf("Direction : %s%n", plan.formats().describe());
        out.printf("Quality   : %d%n", task.quality());
        out.printf("Files     : %d%n", plan.discovered());
        out.println(SEPARATOR);
    }
}
