package org.imagebatch.plugin;

/**
 * Outcome of a single file conversion. {@code error} is empty on success.
 */
public record ConversionResult(boolean ok, String error) {

    private static final ConversionResult SUCCESS = new ConversionResult(true, "");

    public ConversionResult {
        error = error == null ? "" : error;
    }

    public static ConversionResult success() {
        return SUCCESS;
    }

    public static ConversionResult failure(String error) {
        return new ConversionResult(false, error == null || error.isBlank() ? "unknown error" : error);
    }
}
