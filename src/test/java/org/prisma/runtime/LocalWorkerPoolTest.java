package org.prisma.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.services.FrameWorker;
import org.prisma.junit.Fixtures;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class LocalWorkerPoolTest {

    @Mock
    private FrameWorker worker;

    private LocalWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    @Test
    void runsEveryTaskOnAPoolThread() throws Exception {
        when(worker.process(any(), anyString())).thenAnswer(invocation -> {
            FrameTask task = invocation.getArgument(0);
            return FrameOutcome.success(task, invocation.getArgument(1),
                Fixtures.result(task.frame().globalIndex(), 2, 1));
        });
        pool = new LocalWorkerPool(worker, 3);

        List<CompletableFuture<FrameOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            futures.add(pool.submit(FrameTask.first(i, Fixtures.frame(100 + i))));
        }
        List<FrameOutcome> outcomes = pool.gatherAll(futures, Duration.ofSeconds(10));

        assertThat(outcomes).hasSize(12).allMatch(FrameOutcome::isSuccess);
        assertThat(outcomes).extracting(FrameOutcome::workerId).allMatch(id -> id.startsWith("frame-worker-"));
        assertThat(pool.workerCount()).isEqualTo(3);
        assertThat(pool.describe()).isEqualTo("local (3 threads)");
    }

    @Test
    void workerExceptionBecomesCrashOutcome() {
        when(worker.process(any(), anyString())).thenThrow(new IllegalStateException("native fault"));
        pool = new LocalWorkerPool(worker, 1);

        FrameOutcome outcome = pool.submit(FrameTask.first(0, Fixtures.frame(7))).join();

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.globalIndex()).isEqualTo(7);
        assertThat(outcome.failure().kind()).isEqualTo(FailureKind.WORKER_CRASH);
        assertThat(outcome.failure().message()).contains("native fault");
    }

    @Test
    void submitAfterCloseIsATransportFailure() {
        pool = new LocalWorkerPool(worker, 1);
        pool.close();

        FrameOutcome outcome = pool.submit(FrameTask.first(0, Fixtures.frame(3))).join();

        assertThat(outcome.failure().kind()).isEqualTo(FailureKind.TRANSPORT);
    }

    @Test
    void defaultThreadCountIsAtLeastOne() {
        pool = new LocalWorkerPool(worker, 0);

        assertThat(pool.workerCount()).isEqualTo(LocalWorkerPool.defaultWorkerCount()).isPositive();
    }
}
