package org.prisma.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.services.FrameWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed thread pool running a shared {@link FrameWorker}.
 * <p>
 * Retries are not steered away from the failing thread; every slot is equivalent.
 */
public class LocalWorkerPool implements IWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerPool.class);

    private final FrameWorker worker;
    private final int threads;
    private final ExecutorService executor;

    /**
     * @param worker  frame worker shared by all threads.
     * @param threads number of threads; {@code <= 0} selects {@link #defaultWorkerCount()}.
     */
    public LocalWorkerPool(FrameWorker worker, int threads) {
        this.worker = worker;
        this.threads = threads > 0 ? threads : defaultWorkerCount();
        this.executor = Executors.newFixedThreadPool(this.threads, new WorkerThreadFactory());
        log.debug("Local worker pool started with {} threads", this.threads);
    }

    /**
     * @return {@code max(1, floor(cores * 0.75))}.
     */
    public static int defaultWorkerCount() {
        return Math.max(1, (int) Math.floor(Runtime.getRuntime().availableProcessors() * 0.75));
    }

    @Override
    public CompletableFuture<FrameOutcome> submit(FrameTask task) {
        try {
            return CompletableFuture.supplyAsync(() -> worker.process(task, Thread.currentThread().getName()), executor)
                .exceptionally(e -> FrameOutcome.failure(task, "local", FailureKind.WORKER_CRASH, e.toString()));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                FrameOutcome.failure(task, "local", FailureKind.TRANSPORT, "worker pool is shut down"));
        }
    }

    @Override
    public int workerCount() {
        return threads;
    }

    @Override
    public String describe() {
        return "local (" + threads + " threads)";
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Frame workers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "frame-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
