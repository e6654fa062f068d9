package org.imagebatch.processing;

import org.imagebatch.util.ConcurrencyUtils;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import java.util.logging.Logger;

/**
 * Cooperative cancellation flag for one run. Created once by the command and passed to
 * everything that has to stop starting new work.
 * <p>
 * {@link #install()} hooks the flag to SIGINT/SIGTERM through a JVM shutdown hook. The hook sets
 * the flag and then holds the JVM open until {@link #runFinished(int)} is called, so batches that
 * are already converting can complete. The JVM then halts with the run's own exit code rather
 * than the signal status.
 */
public class ShutdownController {
    private static final Logger LOGGER = Logger.getLogger(ShutdownController.class.getName());

    static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofMinutes(10);
    static final int EXIT_INCOMPLETE = 1;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicBoolean installed = new AtomicBoolean(false);
    private final CountDownLatch runDone = new CountDownLatch(1);
    private final Duration drainTimeout;
    private final IntConsumer halter;
    private volatile int exitCode = EXIT_INCOMPLETE;

    public ShutdownController() {
        this(DEFAULT_DRAIN_TIMEOUT);
    }

    public ShutdownController(Duration drainTimeout) {
        this(drainTimeout, ShutdownController::halt);
    }

    ShutdownController(Duration drainTimeout, IntConsumer halter) {
        this.drainTimeout = drainTimeout;
        this.halter = halter;
    }

    /**
     * Registers the shutdown hook. Further calls do nothing.
     */
    public void install() {
        if (!installed.compareAndSet(false, true)) return;
        Runtime.getRuntime().addShutdownHook(
                ConcurrencyUtils.createPlatformThreadFactory("shutdown-hook-").newThread(this::onSignal));
    }

    /**
     * Sets the flag.
     *
     * @return true if this call set it, false if it was already set
     */
    public boolean requestShutdown() {
        return shutdown.compareAndSet(false, true);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Marks the run as complete, releasing a pending shutdown hook.
     *
     * @param exitCode status the process ends with if a signal interrupted the run
     */
    public void runFinished(int exitCode) {
        this.exitCode = exitCode;
        runDone.countDown();
    }

    boolean isInstalled() {
        return installed.get();
    }

    void onSignal() {
        if (runDone.getCount() == 0) return; // normal exit
        if (requestShutdown()) {
            LOGGER.warning("Interrupt received, letting running batches finish. No new batches or tasks will start.");
        }
        final int status;
        try {
            if (runDone.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                status = exitCode;
            } else {
                LOGGER.severe("Running batches did not finish within " + drainTimeout + ", exiting anyway.");
                status = EXIT_INCOMPLETE;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        // returning from the hook would end the JVM with the signal status (130/143)
        halter.accept(status);
    }

    private static void halt(int status) {
        System.out.flush();
        System.err.flush();
        Runtime.getRuntime().halt(status);
    }
}
