package org.prisma.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameTask;
import org.slf4j.LoggerFactory;

/**
 * Runs frame tasks somewhere: threads of this process or remote worker ranks.
 * <p>
 * Futures returned by {@link #submit(FrameTask)} complete normally; infrastructure problems
 * are reported as failed outcomes.
 */
public interface IWorkerPool extends AutoCloseable {

    /**
     * Hands a task to the pool without blocking.
     *
     * @param task the task.
     * @return the outcome, once available.
     */
    CompletableFuture<FrameOutcome> submit(FrameTask task);

    int workerCount();

    String describe();

    /**
     * Waits for a set of submissions.
     *
     * @param futures submissions to wait for.
     * @param timeout maximum wait; {@code null} or non-positive waits indefinitely.
     * @return outcomes of the submissions that completed, in submission order. Shorter than the
     *         input only when the timeout expired.
     * @throws InterruptedException if interrupted while waiting.
     */
    default List<FrameOutcome> gatherAll(List<CompletableFuture<FrameOutcome>> futures, Duration timeout)
            throws InterruptedException {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                all.get();
            } else {
                all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (ExecutionException | TimeoutException e) {
            LoggerFactory.getLogger(IWorkerPool.class).debug("Gathering partial results: {}", e.toString());
        }
        List<FrameOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<FrameOutcome> future : futures) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                outcomes.add(future.join());
            }
        }
        return outcomes;
    }

    @Override
    void close();
}
