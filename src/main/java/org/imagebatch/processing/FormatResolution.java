package org.imagebatch.processing;

import org.imagebatch.config.ImageFormat;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Effective formats of a task after defaults have been applied.
 *
 * @param autoInput     input format was {@code auto}: every modern format is picked up
 * @param inputFormats  formats the input directory is scanned for
 * @param outputFormat  format every output is written in
 * @param direction     codec operation applied to each item
 */
public record FormatResolution(boolean autoInput, List<ImageFormat> inputFormats, ImageFormat outputFormat,
                               ConversionDirection direction) {

    public FormatResolution {
        inputFormats = List.copyOf(inputFormats);
    }

    public String outputExtension() {
        return outputFormat.extension();
    }

    /** Header label such as {@code JPG -> HEIC} or {@code AUTO (HEIC/AVIF/JXL) -> JPG}. */
    public String describe() {
        String out = outputFormat.tag().toUpperCase(Locale.ROOT);
        if (autoInput) {
            String modern = inputFormats.stream().map(f -> f.tag().toUpperCase(Locale.ROOT))
                    .collect(Collectors.joining("/"));
            return "AUTO (" + modern + ") -> " + out;
        }
        return inputFormats.get(0).tag().toUpperCase(Locale.ROOT) + " -> " + out;
    }
}
