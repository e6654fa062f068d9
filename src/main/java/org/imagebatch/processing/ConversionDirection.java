package org.imagebatch.processing;

import org.imagebatch.config.ImageFormat;
import org.imagebatch.plugin.ConversionResult;
import org.imagebatch.plugin.ImageCodec;

/**
 * Which codec operation a task runs for each of its items. Resolved once per task.
 */
public enum ConversionDirection {
    TO_BASELINE {
        @Override
        public ConversionResult apply(ImageCodec codec, WorkItem item, int quality) {
            return codec.toBaseline(item.inputPath(), item.outputPath(), quality);
        }
    },
    TO_MODERN {
        @Override
        public ConversionResult apply(ImageCodec codec, WorkItem item, int quality) {
            return codec.toModern(item.inputPath(), item.outputPath(), quality, item.format());
        }
    };

    public abstract ConversionResult apply(ImageCodec codec, WorkItem item, int quality);

    public static ConversionDirection towards(ImageFormat outputFormat) {
        return outputFormat.isBaseline() ? TO_BASELINE : TO_MODERN;
    }
}
