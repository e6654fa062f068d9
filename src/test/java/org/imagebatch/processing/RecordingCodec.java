package org.imagebatch.processing;

import org.imagebatch.config.ImageFormat;
import org.imagebatch.plugin.ConversionResult;
import org.imagebatch.plugin.ImageCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test codec: writes a small marker file to the output path and records every call.
 * Inputs whose file name is in {@code failing} are reported as failed.
 */
public class RecordingCodec implements ImageCodec {

    private final Set<String> failing;
    private final List<Path> converted = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private volatile Runnable afterEachConversion = () -> { };

    public RecordingCodec() {
        this(Set.of());
    }

    public RecordingCodec(Set<String> failing) {
        this.failing = failing;
    }

    public RecordingCodec afterEachConversion(Runnable hook) {
        this.afterEachConversion = hook;
        return this;
    }

    @Override
    public ConversionResult toBaseline(Path input, Path output, int quality) {
        return write(input, output, ImageFormat.BASELINE);
    }

    @Override
    public ConversionResult toModern(Path input, Path output, int quality, ImageFormat format) {
        return write(input, output, format);
    }

    private ConversionResult write(Path input, Path output, ImageFormat format) {
        int now = running.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        try {
            Thread.sleep(5);
            if (failing.contains(input.getFileName().toString())) {
                return ConversionResult.failure("cannot decode " + input.getFileName());
            }
            Files.writeString(output, format.tag() + " from " + input.getFileName(), StandardCharsets.UTF_8);
            converted.add(input);
            return ConversionResult.success();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ConversionResult.failure("interrupted");
        } finally {
            running.decrementAndGet();
            afterEachConversion.run();
        }
    }

    public List<Path> converted() {
        return converted;
    }

    public int maxConcurrent() {
        return maxConcurrent.get();
    }
}
