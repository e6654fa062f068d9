package org.imagebatch.processing;

import org.imagebatch.config.ImageFormat;
import org.imagebatch.config.TaskConfig;
import org.imagebatch.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns a task and its discovered files into work items.
 */
public final class TaskPlanner {
    private static final Logger LOGGER = Logger.getLogger(TaskPlanner.class.getName());

    private TaskPlanner() {
    }

    /**
     * Applies the format defaults of a task.
     * <ul>
     *     <li>No input format: {@code auto} when the output is JPG, JPG otherwise.</li>
     *     <li>No output format: the default modern format for JPG input, JPG for anything else.</li>
     *     <li>Modern or auto input always produces JPG, whatever output format was asked for.</li>
     * </ul>
     */
    public static FormatResolution resolveFormats(final TaskConfig task) {
        final String requestedIn = task.inputFormat();
        final String requestedOut = task.outputFormat();

        final boolean autoInput = TaskConfig.AUTO.equals(requestedIn)
                || (requestedIn.isEmpty() && ImageFormat.BASELINE.tag().equals(requestedOut));
        final ImageFormat inputFormat = autoInput ? null
                : ImageFormat.fromTag(requestedIn).orElse(ImageFormat.BASELINE);

        final ImageFormat outputFormat;
        if (autoInput || inputFormat.isModern()) {
            outputFormat = ImageFormat.BASELINE;
            if (!requestedOut.isEmpty() && !ImageFormat.BASELINE.tag().equals(requestedOut)) {
                LOGGER.warning(String.format("Task '%s': output_format '%s' ignored, %s input is always converted to %s",
                        task.name(), requestedOut, autoInput ? TaskConfig.AUTO : requestedIn, ImageFormat.BASELINE.tag()));
            }
        } else {
            outputFormat = ImageFormat.fromTag(requestedOut).orElse(ImageFormat.DEFAULT_MODERN);
        }

        final List<ImageFormat> inputFormats = autoInput ? ImageFormat.modernFormats() : List.of(inputFormat);
        return new FormatResolution(autoInput, inputFormats, outputFormat, ConversionDirection.towards(outputFormat));
    }

    /**
     * {@code output_path} when given, otherwise {@code <input_path>/converted_<output format>}.
     */
    public static Path resolveOutputDir(final TaskConfig task, final FormatResolution formats) {
        if (task.outputPath() != null) {
            return Path.of(task.outputPath());
        }
        return Path.of(task.inputPath()).resolve("converted_" + formats.outputFormat().tag());
    }

    /**
     * Builds the work items for {@code files}, in their order. With {@code skipExisting} an item
     * whose output already exists is counted as skipped. This is checked here only, not again when
     * the item runs. Two inputs mapping to the same output (for example {@code a.heic} and
     * {@code a.avif} in auto mode) keep the first one; later ones are skipped with a warning.
     * Creates the output directory if it is missing.
     */
    public static TaskPlan plan(final List<Path> files, final Path outputDir, final FormatResolution formats,
                                final boolean skipExisting) throws IOException {
        Files.createDirectories(outputDir);

        final List<WorkItem> items = new ArrayList<>(files.size());
        final Set<Path> plannedOutputs = new HashSet<>();
        int skipped = 0;
        for (Path input : files) {
            final Path output = outputDir.resolve(FileUtils.stem(input) + formats.outputExtension());
            if (!plannedOutputs.add(output)) {
                LOGGER.warning(String.format("Skipping %s: %s is already produced by another input", input, output.getFileName()));
                skipped++;
                continue;
            }
            if (skipExisting && Files.exists(output)) {
                skipped++;
                continue;
            }
            items.add(new WorkItem(input, output, formats.outputFormat()));
        }
        return new TaskPlan(outputDir, formats, items, files.size(), skipped);
    }
}
