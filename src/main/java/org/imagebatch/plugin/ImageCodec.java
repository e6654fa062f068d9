package org.imagebatch.plugin;

import org.imagebatch.config.ImageFormat;

import java.nio.file.Path;

/**
 * Pixel-level conversion of a single file.
 * <p>
 * Implementations report failures through {@link ConversionResult#failure(String)}. A
 * {@link RuntimeException} thrown out of these methods fails only that file; an {@link Error}
 * fails the whole batch the file belongs to.
 * <p>
 * One instance is used by one worker at a time; implementations need not be thread-safe.
 */
public interface ImageCodec {

    /**
     * Decodes {@code input} (any supported format), flattens transparency onto a white
     * background and writes a baseline JPEG.
     */
    ConversionResult toBaseline(Path input, Path output, int quality);

    /**
     * Decodes the baseline {@code input} and encodes it as {@code format}.
     */
    ConversionResult toModern(Path input, Path output, int quality, ImageFormat format);
}
