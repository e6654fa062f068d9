package org.imagebatch.processing;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Locale;
import java.util.function.LongSupplier;

/**
 * Counts converted items of one task and renders a single progress line with elapsed time and
 * a linear ETA. {@link #advance(int)} may be called from any thread; the counter update and the
 * render happen under the same lock so lines never go backwards.
 */
public class ProgressTracker {

    private static final int BAR_WIDTH = 30;

    private final int total;
    private final PrintStream out;
    private final boolean render;
    private final LongSupplier nanoClock;
    private final long startNanos;
    private int current;

    public ProgressTracker(int total, PrintStream out, boolean render) {
        this(total, out, render, System::nanoTime);
    }

    ProgressTracker(int total, PrintStream out, boolean render, LongSupplier nanoClock) {
        if (total < 0) throw new IllegalArgumentException("total must be >= 0, got " + total);
        this.total = total;
        this.out = out;
        this.render = render;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
    }

    public void advance(int n) {
        if (n < 0) throw new IllegalArgumentException("Cannot advance by " + n);
        if (total == 0) return;
        synchronized (this) {
            current = Math.min(total, current + n);
            renderLine();
        }
    }

    /**
     * Moves the counter to {@code total} and renders the final line.
     */
    public void finish() {
        if (total == 0) return;
        synchronized (this) {
            current = total;
            renderLine();
            if (render) out.println();
        }
    }

    public synchronized int current() {
        return current;
    }

    public int total() {
        return total;
    }

    /**
     * {@code elapsed * (total - current) / current}, or zero before anything completed.
     */
    static Duration estimateRemaining(Duration elapsed, int current, int total) {
        if (current <= 0) return Duration.ZERO;
        return elapsed.multipliedBy(total - current).dividedBy(current);
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) return seconds + "s";
        long minutes = seconds / 60;
        if (minutes < 60) return minutes + "m " + (seconds % 60) + "s";
        long hours = minutes / 60;
        return hours + "h " + (minutes % 60) + "m";
    }

    // caller holds the monitor
    String line() {
        double fraction = (double) current / total;
        Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - startNanos);
        Duration eta = estimateRemaining(elapsed, current, total);
        int filled = (int) Math.round(fraction * BAR_WIDTH);
        String bar = "#".repeat(filled) + ".".repeat(BAR_WIDTH - filled);
        return String.format(Locale.ROOT, "[%s] %5.1f%% (%d/%d) elapsed %s eta %s",
                bar, fraction * 100, current, total, formatDuration(elapsed), formatDuration(eta));
    }

    private void renderLine() {
        if (!render) return;
        out.print("\r" + line());
        out.flush();
    }
}
