package org.imagebatch.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String rendered() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testEstimateRemaining() {
        assertEquals(Duration.ofSeconds(30), ProgressTracker.estimateRemaining(Duration.ofSeconds(10), 5, 20));
        assertEquals(Duration.ZERO, ProgressTracker.estimateRemaining(Duration.ofSeconds(10), 0, 20));
        assertEquals(Duration.ZERO, ProgressTracker.estimateRemaining(Duration.ofSeconds(10), 20, 20));
    }

    @Test
    void testFormatDuration() {
        assertEquals("42s", ProgressTracker.formatDuration(Duration.ofSeconds(42)));
        assertEquals("2m 5s", ProgressTracker.formatDuration(Duration.ofSeconds(125)));
        assertEquals("1h 1m", ProgressTracker.formatDuration(Duration.ofSeconds(3660)));
    }

    @Test
    void testRenderedLineUsesElapsedAndEta() {
        AtomicLong clock = new AtomicLong(0);
        ProgressTracker tracker = new ProgressTracker(20, out, true, clock::get);
        clock.set(TimeUnit.SECONDS.toNanos(10));

        tracker.advance(5);

        String line = rendered();
        assertTrue(line.startsWith("\r["), line);
        assertTrue(line.contains(" 25.0% (5/20)"), line);
        assertTrue(line.contains("elapsed 10s eta 30s"), line);
    }

    @Test
    void testFinishEndsAtHundredPercent() {
        ProgressTracker tracker = new ProgressTracker(4, out, true);
        tracker.advance(1);
        tracker.finish();
        assertEquals(4, tracker.current());
        assertTrue(rendered().contains("100.0% (4/4)"));
        assertTrue(rendered().endsWith(System.lineSeparator()));
    }

    @Test
    void testAdvanceNeverExceedsTotal() {
        ProgressTracker tracker = new ProgressTracker(3, out, false);
        tracker.advance(2);
        tracker.advance(5);
        assertEquals(3, tracker.current());
        assertThrows(IllegalArgumentException.class, () -> tracker.advance(-1));
    }

    @Test
    void testZeroTotalIsNoOp() {
        ProgressTracker tracker = new ProgressTracker(0, out, true);
        tracker.advance(3);
        tracker.finish();
        assertEquals(0, tracker.current());
        assertEquals("", rendered(), "A zero-total tracker never renders.");
    }

    @Test
    void testDisabledRenderingStillCounts() {
        ProgressTracker tracker = new ProgressTracker(2, out, false);
        tracker.advance(1);
        tracker.finish();
        assertEquals(2, tracker.current());
        assertEquals("", rendered());
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testConcurrentAdvanceIsMonotonicAndComplete() throws InterruptedException {
        int threads = 8;
        int perThread = 250;
        ProgressTracker tracker = new ProgressTracker(threads * perThread, out, true);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Integer> observed = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.advance(1);
                    }
                    return null;
                });
            }
            start.countDown();
            while (tracker.current() < threads * perThread) {
                observed.add(tracker.current());
                Thread.sleep(1);
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(2, TimeUnit.SECONDS));
        }
        assertEquals(threads * perThread, tracker.current());
        for (int i = 1; i < observed.size(); i++) {
            assertTrue(observed.get(i) >= observed.get(i - 1), "Progress must never go backwards.");
        }
    }
}
