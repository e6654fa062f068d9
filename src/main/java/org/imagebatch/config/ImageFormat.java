package org.imagebatch.config;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Image formats the converter knows about. JPG is the baseline format, the others are
 * the modern formats that JPEG files are compressed into or restored from.
 */
public enum ImageFormat {
    JPG("jpg", ".jpg", Set.of(".jpg", ".jpeg", ".JPG", ".JPEG")),
    HEIC("heic", ".heic", Set.of(".heic", ".HEIC", ".heif", ".HEIF")),
    AVIF("avif", ".avif", Set.of(".avif", ".AVIF")),
    JXL("jxl", ".jxl", Set.of(".jxl", ".JXL"));

    public static final ImageFormat BASELINE = JPG;
    public static final ImageFormat DEFAULT_MODERN = HEIC;

    private final String tag;
    private final String extension;
    private final Set<String> matchingExtensions;

    ImageFormat(String tag, String extension, Set<String> matchingExtensions) {
        this.tag = tag;
        this.extension = extension;
        this.matchingExtensions = matchingExtensions;
    }

    public String tag() {
        return tag;
    }

    /** Extension written for outputs of this format, including the dot. */
    public String extension() {
        return extension;
    }

    public boolean isBaseline() {
        return this == BASELINE;
    }

    public boolean isModern() {
        return this != BASELINE;
    }

    /**
     * True when the file name ends with one of this format's extensions. The comparison is
     * case-sensitive against the listed variants, so {@code .Jpg} does not match.
     */
    public boolean matches(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && matchingExtensions.contains(fileName.substring(dot));
    }

    public static List<ImageFormat> modernFormats() {
        return Arrays.stream(values()).filter(ImageFormat::isModern).toList();
    }

    public static Optional<ImageFormat> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.tag.equals(normalized)).findFirst();
    }
}
