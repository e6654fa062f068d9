package org.imagebatch.codecs;

import org.imagebatch.config.ImageFormat;
import org.imagebatch.plugin.ConversionResult;
import org.imagebatch.plugin.ImageCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts files by running the ImageMagick command line tool, one process per file.
 * EXIF and other metadata are carried over by the tool itself. A failed conversion removes
 * whatever partial output the tool left behind.
 */
public class ImageMagickCodec implements ImageCodec {
    private static final Logger LOGGER = Logger.getLogger(ImageMagickCodec.class.getName());

    private static final int MAX_OUTPUT_CHARS = 2048;

    private final Path executable;

    public ImageMagickCodec(Path executable) {
        this.executable = Objects.requireNonNull(executable);
    }

    @Override
    public ConversionResult toBaseline(Path input, Path output, int quality) {
        // [0] keeps only the primary image of multi-image HEIF containers
        return run(List.of(input + "[0]",
                "-background", "white", "-alpha", "remove", "-alpha", "off",
                "-colorspace", "sRGB",
                "-quality", Integer.toString(quality),
                prefixed(ImageFormat.BASELINE, output)), output);
    }

    @Override
    public ConversionResult toModern(Path input, Path output, int quality, ImageFormat format) {
        if (!format.isModern()) {
            return ConversionResult.failure("Not a modern format: " + format.tag());
        }
        return run(List.of(input + "[0]",
                "-colorspace", "sRGB",
                "-quality", Integer.toString(quality),
                prefixed(format, output)), output);
    }

    List<String> command(List<String> arguments) {
        final List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(executable.toString());
        command.addAll(arguments);
        return command;
    }

    private ConversionResult run(List<String> arguments, Path output) {
        final List<String> command = command(arguments);
        Process process = null;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
            final String toolOutput = drain(process.getInputStream());
            final int exitCode = process.waitFor();
            if (exitCode != 0) {
                deletePartialOutput(output);
                return ConversionResult.failure("exit code " + exitCode + (toolOutput.isBlank() ? "" : ": " + toolOutput.strip()));
            }
            if (!Files.exists(output)) {
                return ConversionResult.failure("no output written to " + output);
            }
            return ConversionResult.success();
        } catch (IOException e) {
            if (process != null) {
                process.destroyForcibly();
            }
            deletePartialOutput(output);
            return ConversionResult.failure(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            deletePartialOutput(output);
            return ConversionResult.failure("interrupted");
        }
    }

    private static String prefixed(ImageFormat format, Path output) {
        return format.tag().toUpperCase(Locale.ROOT) + ":" + output;
    }

    // reads everything so the process cannot block on a full pipe, keeps the head for the error message
    private static String drain(InputStream stream) throws IOException {
        try (stream) {
            final byte[] all = stream.readAllBytes();
            final String text = new String(all, StandardCharsets.UTF_8);
            return text.length() > MAX_OUTPUT_CHARS ? text.substring(0, MAX_OUTPUT_CHARS) : text;
        }
    }

    private static void deletePartialOutput(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not remove partial output " + output, e);
        }
    }
}
