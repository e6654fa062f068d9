package org.imagebatch.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyUtilsTest {

    @Test
    void testCreatePlatformThreadFactory() {
        ThreadFactory factory = ConcurrencyUtils.createPlatformThreadFactory("MyTestThread-");
        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});
        assertEquals("MyTestThread-1", first.getName());
        assertEquals("MyTestThread-2", second.getName());
        assertFalse(first.isDaemon());
    }

    @Test
    void testShutdownExecutorService_nullExecutor() {
        assertDoesNotThrow(() -> ConcurrencyUtils.shutdownExecutorService(null, "NullTestExecutor"));
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_normalShutdown() {
        ExecutorService localExecutor = Executors.newFixedThreadPool(1);
        localExecutor.submit(() -> {
            try {
                Thread.sleep(50); // Simulate some work
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        ConcurrencyUtils.shutdownExecutorService(localExecutor, "NormalShutdownTest");
        assertTrue(localExecutor.isTerminated(), "Executor should be terminated after shutdown.");
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_interruptedCallerForcesShutdown() {
        ExecutorService localExecutor = Executors.newFixedThreadPool(1);
        localExecutor.submit(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread.currentThread().interrupt();
        try {
            ConcurrencyUtils.shutdownExecutorService(localExecutor, "InterruptedShutdownTest");
            assertTrue(Thread.currentThread().isInterrupted(), "Interrupt status must be preserved.");
            assertTrue(localExecutor.isShutdown());
        } finally {
            Thread.interrupted(); // clear for the next test
        }
    }
}
