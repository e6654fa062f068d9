package org.imagebatch.processing;

import org.imagebatch.config.ImageFormat;
import org.imagebatch.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Lists the input files of a task. Results are sorted by path and free of duplicates.
 */
public final class FileDiscovery {

    private FileDiscovery() {
    }

    /**
     * Files in {@code directory} carrying one of {@code format}'s extensions. Empty when the
     * directory does not exist.
     */
    public static List<Path> findFiles(final Path directory, final ImageFormat format) throws IOException {
        return FileUtils.listFiles(directory, format::matches).stream().sorted().toList();
    }

    /**
     * Union of {@link #findFiles(Path, ImageFormat)} over {@code formats}, used for auto input.
     */
    public static List<Path> findFiles(final Path directory, final Collection<ImageFormat> formats) throws IOException {
        final TreeSet<Path> union = new TreeSet<>();
        for (ImageFormat format : formats) {
            union.addAll(findFiles(directory, format));
        }
        return List.copyOf(union);
    }
}
