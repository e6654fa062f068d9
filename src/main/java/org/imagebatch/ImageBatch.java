package org.imagebatch;

import org.imagebatch.codecs.ImageMagickCodecFactory;
import org.imagebatch.config.AppConfig;
import org.imagebatch.config.ConfigManager;
import org.imagebatch.config.TaskConfig;
import org.imagebatch.plugin.CodecFactory;
import org.imagebatch.processing.BatchScheduler;
import org.imagebatch.processing.ConversionRun;
import org.imagebatch.processing.ResultAggregator;
import org.imagebatch.processing.ShutdownController;
import org.imagebatch.processing.TaskProcessor;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;

/**
 * Converts images in bulk between JPEG and HEIC/AVIF/JXL as described by a task file.
 * <p>
 * Exit code 0 when no conversion failed, 1 when any failed or the task file could not be loaded.
 */
@Command(name = "image-batch", mixinStandardHelpOptions = true, version = "image-batch 1.0.0",
        description = "Bulk image converter: JPG -> HEIC/AVIF/JXL and back, driven by a JSON task file.",
        footer = {"", "Directions:",
                "  JPG -> HEIC/AVIF/JXL     compress into a modern format",
                "  HEIC/AVIF/JXL -> JPG     restore the compatible format",
                "  auto -> JPG              pick up every modern format in the directory"})
public class ImageBatch implements Callable<Integer> {

    static final int DEFAULT_BATCH_SIZE = 10;

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--config"}, required = true, paramLabel = "PATH",
            description = "Task file (JSON, or YAML with a .yaml/.yml extension)")
    Path configPath;

    @Option(names = {"-w", "--workers"}, paramLabel = "N",
            description = "Parallel workers (default: number of processors)")
    int workers = Math.max(1, Runtime.getRuntime().availableProcessors());

    @Option(names = {"-b", "--batch-size"}, paramLabel = "N",
            description = "Files per dispatched batch (default: ${DEFAULT-VALUE})")
    int batchSize = DEFAULT_BATCH_SIZE;

    @Option(names = "--no-progress", description = "Do not render the progress bar")
    boolean noProgress;

    @Option(names = "--magick", paramLabel = "PATH",
            description = "ImageMagick executable (default: magick or convert on PATH)")
    Path magickPath;

    @Option(names = {"-v", "--verbose"}, description = "Log every converted file")
    boolean verbose;

    private final PrintStream out;
    private final CodecFactory codecFactoryOverride;
    private final ShutdownController shutdown;

    public ImageBatch() {
        this(System.out, null, new ShutdownController());
    }

    ImageBatch(PrintStream out, CodecFactory codecFactoryOverride, ShutdownController shutdown) {
        this.out = out;
        this.codecFactoryOverride = codecFactoryOverride;
        this.shutdown = shutdown;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ImageBatch()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (workers < 1) {
            throw new ParameterException(spec.commandLine(), "--workers must be at least 1, got " + workers);
        }
        if (batchSize < 1) {
            throw new ParameterException(spec.commandLine(), "--batch-size must be at least 1, got " + batchSize);
        }

        final AppConfig appConfig;
        try {
            appConfig = ConfigManager.load(configPath);
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().printf("Could not load config %s: %s%n", configPath, e.getMessage());
            return 1;
        }
        if (verbose) {
            ConfigManager.setLogLevel(Level.FINE);
        }

        final List<TaskConfig> tasks = appConfig.enabledTasks();
        if (tasks.isEmpty()) {
            out.println("No enabled tasks.");
            return 0;
        }
        printHeader(tasks.size());

        final CodecFactory codecFactory = codecFactoryOverride != null
                ? codecFactoryOverride : new ImageMagickCodecFactory(magickPath);
        final BatchScheduler scheduler = new BatchScheduler(workers, batchSize, codecFactory, shutdown);
        final TaskProcessor processor = new TaskProcessor(scheduler, out, !noProgress);

        shutdown.install();
        int exitCode = 1;
        try {
            ResultAggregator aggregator = new ConversionRun(processor, shutdown, out).execute(tasks);
            exitCode = aggregator.exitCode();
            return exitCode;
        } finally {
            shutdown.runFinished(exitCode);
        }
    }

    private void printHeader(int taskCount) {
        String separator = "=".repeat(60);
        out.println(separator);
        out.println("image-batch");
        out.println(separator);
        out.printf("Config  : %s%n", configPath);
        out.printf("Tasks   : %d%n", taskCount);
        out.printf("Workers : %d, batch size: %d%n", workers, batchSize);
    }
}
