package org.imagebatch.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * One conversion task from the task file. Missing fields are filled with their defaults,
 * format tags are lower-cased and blank formats are kept as {@code ""} so the planner can
 * infer them.
 */
public record TaskConfig(@JsonProperty("name") String name,
                         @JsonProperty("input_path") String inputPath,
                         @JsonProperty("output_path") String outputPath,
                         @JsonProperty("input_format") String inputFormat,
                         @JsonProperty("output_format") String outputFormat,
                         @JsonProperty("quality") Integer quality,
                         @JsonProperty("skip_existing") Boolean skipExisting,
                         @JsonProperty("enabled") Boolean enabled) {

    public static final String AUTO = "auto";
    public static final String DEFAULT_NAME = "unnamed";
    public static final int DEFAULT_QUALITY = 90;

    public TaskConfig {
        name = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
        inputPath = inputPath == null ? "" : inputPath;
        outputPath = (outputPath == null || outputPath.isBlank()) ? null : outputPath;
        inputFormat = normalizeFormat(inputFormat);
        outputFormat = normalizeFormat(outputFormat);
        quality = quality == null ? DEFAULT_QUALITY : quality;
        skipExisting = skipExisting == null ? Boolean.TRUE : skipExisting;
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    /**
     * Checks the values that the task file schema cannot express.
     *
     * @throws IllegalArgumentException naming the task and the offending field
     */
    public void validate() {
        if (inputPath.isBlank()) {
            throw new IllegalArgumentException("Task '" + name + "': input_path is required");
        }
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("Task '" + name + "': quality must be within 0-100, got " + quality);
        }
        if (!inputFormat.isEmpty() && !AUTO.equals(inputFormat) && ImageFormat.fromTag(inputFormat).isEmpty()) {
            throw new IllegalArgumentException("Task '" + name + "': unsupported input_format '" + inputFormat + "'");
        }
        if (!outputFormat.isEmpty() && ImageFormat.fromTag(outputFormat).isEmpty()) {
            throw new IllegalArgumentException("Task '" + name + "': unsupported output_format '" + outputFormat + "'");
        }
    }

    private static String normalizeFormat(String format) {
        return format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
    }
}
