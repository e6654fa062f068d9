package org.imagebatch.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Logger;

public final class FileUtils {
    private static final Logger LOGGER = Logger.getLogger(FileUtils.class.getName());

    private FileUtils() {
    }

    /**
     * Regular files directly inside {@code sourceDir} whose file name passes {@code nameFilter}.
     * A missing directory yields an empty list, not an error.
     */
    public static List<Path> listFiles(final Path sourceDir, final Predicate<String> nameFilter) throws IOException {
        if (!Files.isDirectory(sourceDir)) {
            LOGGER.fine("Dir not found: " + sourceDir + ". Empty list.");
            return Collections.emptyList();
        }
        try (var stream = Files.list(sourceDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> nameFilter.test(p.getFileName().toString()))
                    .toList();
        }
    }

    /**
     * File name without its last extension: {@code IMG_0001.HEIC -> IMG_0001},
     * {@code archive.tar.gz -> archive.tar}.
     */
    public static String stem(final Path path) {
        final String fileName = path.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Splits {@code items} into consecutive chunks of at most {@code chunkSize}, keeping order.
     * Only the last chunk may be smaller.
     */
    public static <T> List<List<T>> partition(final List<T> items, final int chunkSize) {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        if (items.isEmpty()) return Collections.emptyList();
        final List<List<T>> chunks = new ArrayList<>((items.size() + chunkSize - 1) / chunkSize);
        for (int from = 0; from < items.size(); from += chunkSize) {
            chunks.add(List.copyOf(items.subList(from, Math.min(items.size(), from + chunkSize))));
        }
        return chunks;
    }
}
