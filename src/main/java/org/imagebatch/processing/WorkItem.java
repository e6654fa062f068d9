package org.imagebatch.processing;

import org.imagebatch.config.ImageFormat;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One planned file conversion: read {@code inputPath}, write {@code outputPath} as {@code format}.
 */
public record WorkItem(Path inputPath, Path outputPath, ImageFormat format) {

    public WorkItem {
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(format, "format");
    }
}
