package org.imagebatch.processing;

import org.imagebatch.metrics.BatchOutcome;
import org.imagebatch.metrics.StatusHelper;
import org.imagebatch.metrics.TaskResult;
import org.imagebatch.plugin.CodecFactory;
import org.imagebatch.plugin.ImageCodec;
import org.imagebatch.util.ConcurrencyUtils;
import org.imagebatch.util.FileUtils;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the work items of one task on a fixed pool of workers.
 * <p>
 * Items are cut into consecutive batches of {@code batchSize}. At most {@code workerCount}
 * batches are in flight; the next one is dispatched when one completes, after checking the
 * shutdown flag. Outcomes are folded in completion order, which does not change the totals.
 * Each worker holds one codec, created by the {@link CodecFactory} when the pool is built.
 * <p>
 * There is no timeout on a conversion: a codec that never returns blocks its worker and the
 * task with it.
 */
public class BatchScheduler {
    private static final Logger LOGGER = Logger.getLogger(BatchScheduler.class.getName());

    private final int workerCount;
    private final int batchSize;
    private final CodecFactory codecFactory;
    private final ShutdownController shutdown;

    public BatchScheduler(int workerCount, int batchSize, CodecFactory codecFactory, ShutdownController shutdown) {
        if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        this.workerCount = workerCount;
        this.batchSize = batchSize;
        this.codecFactory = Objects.requireNonNull(codecFactory);
        this.shutdown = Objects.requireNonNull(shutdown);
    }

    /**
     * Converts {@code items} and returns success and failure counts; {@code skipped} is left at
     * zero for the caller to fill in.
     */
    public TaskResult run(final String taskName, final List<WorkItem> items, final int quality,
                          final ConversionDirection direction, final ProgressTracker progress) {
        final List<List<WorkItem>> batches = FileUtils.partition(items, batchSize);
        if (batches.isEmpty()) return TaskResult.EMPTY;

        final int poolSize = Math.min(workerCount, batches.size());
        final BlockingQueue<ImageCodec> codecs = new ArrayBlockingQueue<>(poolSize);
        try {
            for (int i = 0; i < poolSize; i++) {
                codecs.add(codecFactory.create());
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Task '" + taskName + "': codec initialization failed, all "
                    + items.size() + " item(s) count as failed", e);
            progress.advance(items.size());
            return new TaskResult(0, items.size(), 0);
        }

        final BatchHandler handler = new BatchHandler(direction, quality);
        final BlockingQueue<BatchOutcome> completed = new LinkedBlockingQueue<>();
        final ExecutorService batchExecutor = Executors.newFixedThreadPool(poolSize,
                ConcurrencyUtils.createPlatformThreadFactory(taskName + "-Batch-"));

        TaskResult result = TaskResult.EMPTY;
        int next = 0;
        int inFlight = 0;
        boolean dispatching = true;
        try {
            while (true) {
                while (dispatching && inFlight < poolSize && next < batches.size()) {
                    if (shutdown.isShutdown()) {
                        LOGGER.warning(String.format("Task '%s': shutdown requested, %d of %d batch(es) not started.",
                                taskName, batches.size() - next, batches.size()));
                        dispatching = false;
                        break;
                    }
                    final int batchId = next + 1;
                    dispatch(batchExecutor, handler, codecs, completed, batchId, batches.get(next));
                    next++;
                    inFlight++;
                }
                if (inFlight == 0) break;

                final BatchOutcome outcome = completed.take();
                inFlight--;
                LOGGER.fine(() -> String.format("%s: %s, %d ok, %d failed in %d ms on %s",
                        outcome.batchName(), outcome.status(), outcome.success(), outcome.failed(),
                        outcome.duration().toMillis(), outcome.threadName()));
                result = result.plus(outcome);
                progress.advance(outcome.itemCount());
            }
        } catch (InterruptedException e) {
            LOGGER.warning(String.format("Task '%s': interrupted while waiting for %d batch(es).", taskName, inFlight));
            shutdown.requestShutdown();
            Thread.currentThread().interrupt();
        } finally {
            ConcurrencyUtils.shutdownExecutorService(batchExecutor, taskName + "-BatchExecutor");
        }
        return result;
    }

    private void dispatch(final ExecutorService batchExecutor, final BatchHandler handler,
                          final BlockingQueue<ImageCodec> codecs, final BlockingQueue<BatchOutcome> completed,
                          final int batchId, final List<WorkItem> batch) {
        final CompletableFuture<BatchOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(() -> runWithLeasedCodec(handler, codecs, batchId, batch), batchExecutor);
        } catch (RejectedExecutionException e) {
            completed.add(handleBatchFailure(e, batchId, batch));
            return;
        }
        future.exceptionally(ex -> handleBatchFailure(ex, batchId, batch))
                .thenAccept(completed::add);
    }

    private static BatchOutcome runWithLeasedCodec(final BatchHandler handler, final BlockingQueue<ImageCodec> codecs,
                                                   final int batchId, final List<WorkItem> batch) {
        final ImageCodec codec;
        try {
            codec = codecs.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted waiting for a codec", e);
        }
        try {
            return handler.handle(batchId, batch, codec);
        } finally {
            codecs.add(codec);
        }
    }

    private static BatchOutcome handleBatchFailure(final Throwable ex, final int batchId, final List<WorkItem> batch) {
        final Throwable cause = (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
        final String batchName = BatchHandler.batchName(batchId, batch);
        LOGGER.log(Level.SEVERE, String.format("%s failed as a whole, counting all %d item(s) as failed: %s",
                batchName, batch.size(), cause), cause);
        return StatusHelper.createFailedBatchOutcome(batchId, batchName, batch.size(), cause);
    }
}
