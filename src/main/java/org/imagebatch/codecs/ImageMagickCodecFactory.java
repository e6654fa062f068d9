package org.imagebatch.codecs;

import org.imagebatch.plugin.CodecFactory;
import org.imagebatch.plugin.ImageCodec;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Locates the ImageMagick executable once and hands out codecs bound to it.
 * ImageMagick 7 ships {@code magick}; version 6 installs {@code convert} instead.
 */
public class ImageMagickCodecFactory implements CodecFactory {
    private static final Logger LOGGER = Logger.getLogger(ImageMagickCodecFactory.class.getName());

    static final List<String> EXECUTABLE_NAMES = List.of("magick", "convert");

    private final Path executable;

    /**
     * @param override explicit path to the tool, or null to search {@code PATH}
     */
    public ImageMagickCodecFactory(Path override) {
        this.executable = override != null ? override : locate(System.getenv("PATH")).orElse(null);
        if (this.executable != null) {
            LOGGER.fine("Using ImageMagick at " + this.executable);
        }
    }

    @Override
    public ImageCodec create() {
        if (executable == null) {
            throw new IllegalStateException("ImageMagick not found on PATH (looked for " + EXECUTABLE_NAMES
                    + "), install it or pass --magick");
        }
        if (!Files.isExecutable(executable)) {
            throw new IllegalStateException("ImageMagick executable is not executable: " + executable);
        }
        return new ImageMagickCodec(executable);
    }

    public Optional<Path> executable() {
        return Optional.ofNullable(executable);
    }

    static Optional<Path> locate(String searchPath) {
        if (searchPath == null || searchPath.isBlank()) return Optional.empty();
        for (String name : EXECUTABLE_NAMES) {
            for (String dir : searchPath.split(File.pathSeparator)) {
                if (dir.isBlank()) continue;
                Path candidate = Path.of(dir, name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }
}
