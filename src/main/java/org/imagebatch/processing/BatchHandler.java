package org.imagebatch.processing;

import org.imagebatch.metrics.BatchOutcome;
import org.imagebatch.plugin.ConversionResult;
import org.imagebatch.plugin.ImageCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts the items of one batch, one after the other, on the calling worker thread.
 * A failing item is recorded and the batch moves on to the next one.
 */
public class BatchHandler {
    private static final Logger LOGGER = Logger.getLogger(BatchHandler.class.getName());

    private final ConversionDirection direction;
    private final int quality;

    public BatchHandler(ConversionDirection direction, int quality) {
        this.direction = Objects.requireNonNull(direction);
        this.quality = quality;
    }

    public BatchOutcome handle(final int batchId, final List<WorkItem> items, final ImageCodec codec) {
        final Instant batchStart = Instant.now();
        final String batchName = batchName(batchId, items);
        final String threadName = Thread.currentThread().getName();
        LOGGER.fine(() -> String.format("%s: %d item(s) on %s", batchName, items.size(), threadName));

        int success = 0;
        int failed = 0;
        for (WorkItem item : items) {
            ConversionResult result;
            try {
                result = direction.apply(codec, item, quality);
            } catch (RuntimeException e) {
                result = ConversionResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (result.ok()) {
                success++;
                LOGGER.fine(() -> "OK   " + item.inputPath().getFileName() + " -> " + item.outputPath().getFileName());
            } else {
                failed++;
                LOGGER.log(Level.WARNING, "FAIL {0} - {1}", new Object[]{item.inputPath().getFileName(), result.error()});
            }
        }
        return new BatchOutcome(batchId, batchName, items.size(), success, failed,
                Duration.between(batchStart, Instant.now()), threadName, null);
    }

    static String batchName(final int batchId, final List<WorkItem> items) {
        final String suffix = items.isEmpty() ? "empty"
                : items.get(0).inputPath().getFileName()
                  + (items.size() > 1 ? ".." + items.get(items.size() - 1).inputPath().getFileName() : "");
        return "Batch-%d_%s".formatted(batchId, suffix);
    }
}
