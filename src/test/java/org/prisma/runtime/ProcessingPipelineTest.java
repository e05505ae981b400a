package org.prisma.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.prisma.datapipeline.api.frames.IFrameEnumerator;
import org.prisma.datapipeline.api.job.FrameRange;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.api.results.MeasurementColumns;
import org.prisma.datapipeline.job.JobSpecificationException;
import org.prisma.datapipeline.resources.storage.DatasetReader;
import org.prisma.datapipeline.resources.storage.DatasetWriter;
import org.prisma.datapipeline.resources.storage.StoredDataset;
import org.prisma.junit.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("integration")
class ProcessingPipelineTest {

    private static final int PEAKS = 2;
    private static final int BINS = 4;
    private static final int AVAILABLE = 20;
    private static final int REFERENCE_FRAMES = 3;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path home;
    private Path images;
    private Path references;
    private IFrameEnumerator enumerator;

    @BeforeEach
    void setUp() {
        home = tempDir.resolve("home");
        images = tempDir.resolve("raw");
        references = tempDir.resolve("refs");
        enumerator = (source, range) -> {
            if (source.equals(references)) {
                return Fixtures.frames(range, REFERENCE_FRAMES);
            }
            if (!source.equals(images)) {
                throw new IOException("no such directory: " + source);
            }
            return Fixtures.frames(range, AVAILABLE);
        };
    }

    private static Config config(String execution) {
        return ConfigFactory.parseString("prisma.execution { maxRetries = 2\n" + execution + " }\n"
            + "prisma.storage { targetChunkBytes = 1120, blockBytes = 64, compression { codec = zstd, level = 1 } }");
    }

    private JobSpecification job(FrameRange frames) {
        return Fixtures.job(home, images, frames, PEAKS, BINS);
    }

    private ProcessingPipeline pipeline(Config config, IWorkerPool pool) {
        return new ProcessingPipeline(config, pool, enumerator, CLOCK);
    }

    private static FrameOutcome fitted(FrameTask task, String workerId) {
        int globalIndex = task.frame().globalIndex();
        return FrameOutcome.success(task, workerId, Fixtures.result(globalIndex, BINS, PEAKS));
    }

    @Test
    void processesEveryFrameIntoDatedDataset() throws Exception {
        ScriptedPool pool = new ScriptedPool(1, task -> fitted(task, "local"));

        RunSummary summary = pipeline(config(""), pool).run(job(new FrameRange(0, FrameRange.ALL, 1)),
            ExecutionMode.LOCAL);

        assertThat(summary.isComplete()).isTrue();
        assertThat(summary.requestedFrames).isEqualTo(AVAILABLE);
        assertThat(summary.completedFrames).isEqualTo(AVAILABLE);
        assertThat(summary.mode).isEqualTo("local");
        assertThat(summary.missingFrames).isEmpty();
        assertThat(summary.identity).hasSize(12);

        Path directory = Path.of(summary.path);
        assertThat(directory.getParent())
            .isEqualTo(home.resolve("Processed").resolve("2026-03-01").resolve("S1").resolve("Zarr"));
        assertThat(directory.getFileName().toString())
            .isEqualTo("40deg-4bins-0sf-allfr-4.7l2t_6.3u2t-2peaks-0bkg-" + summary.identity);
        assertThat(directory.resolve(DatasetWriter.SUMMARY_FILE)).exists();

        StoredDataset stored = DatasetReader.read(directory);
        Dataset4D dataset = stored.dataset();
        assertThat(stored.metadata().finalized).isTrue();
        assertThat(stored.metadata().frameCount).isEqualTo(AVAILABLE);
        assertThat(stored.metadata().completedFrames).hasSize(AVAILABLE);
        assertThat(stored.metadata().createdAt).isEqualTo("2026-03-01T10:00:00Z");
        assertThat(stored.metadata().colIdx).containsEntry(MeasurementColumns.ABS_STRAIN, 6);
        assertThat(dataset.frameNumbers()).startsWith(0, 1, 2).endsWith(19);
        assertThat(dataset.azimuthAngles()).containsExactly(5.0, 15.0, 25.0, 35.0);
        assertThat(dataset.get(1, 7, 2, 3)).isEqualTo(Fixtures.value(7, 2, 1, 3));
        assertThat(dataset.get(0, 19, 3, 0)).isEqualTo(Fixtures.value(19, 3, 0, 0));
        assertThat(dataset.missingCount(MeasurementColumns.STRAIN)).isEqualTo(dataset.cellCount());
    }

    @Test
    void steppedRangeKeepsGlobalFrameNumbers() throws Exception {
        ScriptedPool pool = new ScriptedPool(1, task -> fitted(task, "local"));

        RunSummary summary = pipeline(config(""), pool).run(job(new FrameRange(2, 20, 5)), ExecutionMode.LOCAL);

        Dataset4D dataset = DatasetReader.read(Path.of(summary.path)).dataset();
        assertThat(dataset.frameNumbers()).containsExactly(2, 7, 12, 17);
        assertThat(dataset.get(0, 1, 0, 0)).isEqualTo(Fixtures.value(7, 0, 0, 0));
    }

    @Test
    void retriesAvoidTheFailingWorkerAndGiveUpEventually() throws Exception {
        ScriptedPool pool = new ScriptedPool(2, task -> {
            int globalIndex = task.frame().globalIndex();
            if (globalIndex == 3 && task.attempt() == 0) {
                return FrameOutcome.failure(task, "worker-1", FailureKind.WORKER_CRASH, "segfault");
            }
            if (globalIndex == 5) {
                return FrameOutcome.failure(task, "worker-2", FailureKind.RESOURCE_EXHAUSTED, "out of memory");
            }
            return fitted(task, "worker-2");
        });

        RunSummary summary = pipeline(config(""), pool).run(job(new FrameRange(0, AVAILABLE, 1)),
            ExecutionMode.DISTRIBUTED);

        assertThat(pool.submitted()).filteredOn(t -> t.frame().globalIndex() == 3)
            .extracting(FrameTask::attempt, FrameTask::avoidWorker)
            .containsExactly(tuple(0, null),
                tuple(1, "worker-1"));
        assertThat(pool.submitted()).filteredOn(t -> t.frame().globalIndex() == 5).hasSize(3);

        assertThat(summary.mode).isEqualTo("distributed");
        assertThat(summary.completedFrames).isEqualTo(AVAILABLE - 1);
        assertThat(summary.missingFrames).containsOnlyKeys(5);
        assertThat(summary.missingFrames.get(5)).startsWith("RESOURCE_EXHAUSTED");
        assertThat(summary.isComplete()).isFalse();

        Dataset4D dataset = DatasetReader.read(Path.of(summary.path)).dataset();
        assertThat(dataset.get(0, 5, 0, 0)).isNaN();
        assertThat(dataset.get(0, 3, 0, 0)).isEqualTo(Fixtures.value(3, 0, 0, 0));
    }

    @Test
    void singleWorkerRetriesWithoutAvoidance() throws Exception {
        ScriptedPool pool = new ScriptedPool(1, task -> task.attempt() == 0 && task.frame().globalIndex() == 1
            ? FrameOutcome.failure(task, "local", FailureKind.TRANSPORT, "lost")
            : fitted(task, "local"));

        RunSummary summary = pipeline(config(""), pool).run(job(new FrameRange(0, 4, 1)), ExecutionMode.LOCAL);

        assertThat(summary.isComplete()).isTrue();
        assertThat(pool.submitted()).filteredOn(t -> t.attempt() == 1).singleElement()
            .satisfies(t -> assertThat(t.avoidWorker()).isNull());
    }

    @Test
    void partialFitFailuresAreCounted() throws Exception {
        ScriptedPool pool = new ScriptedPool(1, task -> task.frame().globalIndex() == 6
            ? FrameOutcome.success(task, "local", Fixtures.resultWithFailedCell(6, BINS, PEAKS, 2, 1))
            : fitted(task, "local"));

        RunSummary summary = pipeline(config(""), pool).run(job(new FrameRange(0, 10, 1)), ExecutionMode.LOCAL);

        assertThat(summary.completedFrames).isEqualTo(10);
        assertThat(summary.cellFailures).isEqualTo(1);
        Dataset4D dataset = DatasetReader.read(Path.of(summary.path)).dataset();
        assertThat(dataset.get(1, 6, 2, 0)).isNaN();
        assertThat(dataset.get(0, 6, 2, 0)).isEqualTo(Fixtures.value(6, 2, 0, 0));
    }

    @Test
    void timeoutMarksOutstandingFramesMissing() throws Exception {
        ScriptedPool pool = new ScriptedPool(1, task -> task.frame().globalIndex() == 2 ? null : fitted(task, "local"));

        RunSummary summary = pipeline(config("runTimeout = 300ms"), pool).run(job(new FrameRange(0, 8, 1)),
            ExecutionMode.LOCAL);

        assertThat(summary.timedOut).isTrue();
        assertThat(summary.completedFrames).isEqualTo(7);
        assertThat(summary.missingFrames).containsOnlyKeys(2);
        assertThat(summary.missingFrames.get(2)).startsWith("TRANSPORT");
        assertThat(DatasetReader.read(Path.of(summary.path)).dataset().get(0, 2, 0, 0)).isNaN();
    }

    @Test
    void extendedRangeOnlyProcessesNewFrames() throws Exception {
        ScriptedPool first = new ScriptedPool(1, task -> fitted(task, "local"));
        RunSummary initial = pipeline(config(""), first).run(job(new FrameRange(0, 10, 1)), ExecutionMode.LOCAL);

        ScriptedPool second = new ScriptedPool(1, task -> fitted(task, "local"));
        RunSummary extended = pipeline(config(""), second).run(job(new FrameRange(0, AVAILABLE, 1)),
            ExecutionMode.LOCAL);

        assertThat(second.submitted()).extracting(t -> t.frame().globalIndex())
            .containsExactlyInAnyOrder(10, 11, 12, 13, 14, 15, 16, 17, 18, 19);
        assertThat(extended.seededFrames).isEqualTo(10);
        assertThat(extended.completedFrames).isEqualTo(AVAILABLE);
        assertThat(extended.identity).isNotEqualTo(initial.identity);
        assertThat(Path.of(initial.path)).exists();

        Dataset4D dataset = DatasetReader.read(Path.of(extended.path)).dataset();
        assertThat(dataset.get(1, 4, 3, 2)).isEqualTo(Fixtures.value(4, 3, 1, 2));
        assertThat(dataset.get(1, 14, 3, 2)).isEqualTo(Fixtures.value(14, 3, 1, 2));
    }

    @Test
    void identicalRerunReusesEverything() throws Exception {
        RunSummary initial = pipeline(config(""), new ScriptedPool(1, task -> fitted(task, "local")))
            .run(job(new FrameRange(0, 10, 1)), ExecutionMode.LOCAL);
        byte[] chunk = Files.readAllBytes(Path.of(initial.path).resolve(DatasetWriter.DATA_DIR).resolve("c.0.0.zst"));

        ScriptedPool rerunPool = new ScriptedPool(1, task -> fitted(task, "local"));
        RunSummary rerun = pipeline(config(""), rerunPool).run(job(new FrameRange(0, 10, 1)), ExecutionMode.LOCAL);

        assertThat(rerunPool.submitted()).isEmpty();
        assertThat(rerun.identity).isEqualTo(initial.identity);
        assertThat(rerun.path).isEqualTo(initial.path);
        assertThat(Files.readAllBytes(Path.of(rerun.path).resolve(DatasetWriter.DATA_DIR).resolve("c.0.0.zst")))
            .containsExactly(chunk);
    }

    @Test
    void resumeCanBeDisabled() throws Exception {
        pipeline(config(""), new ScriptedPool(1, task -> fitted(task, "local")))
            .run(job(new FrameRange(0, 4, 1)), ExecutionMode.LOCAL);

        Config noResume = config("").withFallback(ConfigFactory.parseString("prisma.storage.resume = false"));
        ScriptedPool pool = new ScriptedPool(1, task -> fitted(task, "local"));
        RunSummary summary = pipeline(noResume, pool).run(job(new FrameRange(0, 4, 1)), ExecutionMode.LOCAL);

        assertThat(pool.submitted()).hasSize(4);
        assertThat(summary.seededFrames).isZero();
    }

    @Test
    void referenceFramesDriveStrain() throws Exception {
        ScriptedPool pool = new ScriptedPool(1, task -> fitted(task, "local"));
        JobSpecification job = Fixtures.withReference(job(new FrameRange(0, 10, 1)), references);

        RunSummary summary = pipeline(config(""), pool).run(job, ExecutionMode.LOCAL);

        assertThat(summary.referenceFrames).isEqualTo(REFERENCE_FRAMES);
        StoredDataset stored = DatasetReader.read(Path.of(summary.path));
        assertThat(stored.metadata().referenceDataset).isEqualTo(references.toString());
        assertThat(stored.metadata().referenceValues).containsKey(MeasurementColumns.D_SPACING);

        int d = MeasurementColumns.BASE.indexOf(MeasurementColumns.D_SPACING);
        double reference = 0;
        for (int g = 0; g < REFERENCE_FRAMES; g++) {
            reference += Fixtures.value(g, 1, 0, d);
        }
        reference /= REFERENCE_FRAMES;
        double expected = (Fixtures.value(7, 1, 0, d) - reference) / reference;
        Dataset4D dataset = stored.dataset();
        assertThat(dataset.get(0, 7, 1, dataset.columnIndex(MeasurementColumns.STRAIN)))
            .isCloseTo((float) expected, within(1e-5f));
        assertThat(dataset.get(0, 7, 1, dataset.columnIndex(MeasurementColumns.ABS_STRAIN)))
            .isCloseTo((float) Math.abs(expected), within(1e-5f));
    }

    @Test
    void unreadableReferenceLeavesStrainEmpty() throws Exception {
        ScriptedPool pool = new ScriptedPool(1, task -> fitted(task, "local"));
        JobSpecification job = Fixtures.withReference(job(new FrameRange(0, 4, 1)), tempDir.resolve("absent"));

        RunSummary summary = pipeline(config(""), pool).run(job, ExecutionMode.LOCAL);

        assertThat(summary.referenceFrames).isZero();
        assertThat(summary.completedFrames).isEqualTo(4);
        Dataset4D dataset = DatasetReader.read(Path.of(summary.path)).dataset();
        assertThat(dataset.missingCount(MeasurementColumns.STRAIN)).isEqualTo(dataset.cellCount());
    }

    @Test
    void emptySelectionIsAConfigurationError() {
        ScriptedPool pool = new ScriptedPool(1, task -> fitted(task, "local"));

        assertThatThrownBy(() -> pipeline(config(""), pool).run(job(new FrameRange(50, 60, 1)), ExecutionMode.LOCAL))
            .isInstanceOf(JobSpecificationException.class)
            .satisfies(e -> assertThat(((JobSpecificationException) e).getField()).isEqualTo("images_path"));
        assertThat(pool.submitted()).isEmpty();
    }

    @Test
    void datasetTooLargeForOneArrayIsAConfigurationError() {
        // 5 peaks, 200000 frames, 360 bins and 7 columns: about 2.5e9 values
        assertThatThrownBy(() -> ProcessingPipeline.requireDatasetFits(5, 200_000, 360, 7))
            .isInstanceOf(JobSpecificationException.class)
            .hasMessageContaining("frame_end")
            .hasMessageContaining("200000 frames");

        ProcessingPipeline.requireDatasetFits(5, 100_000, 360, 7);
    }

    /**
     * Answers every task synchronously from a script; a {@code null} answer leaves the task pending forever.
     */
    private static final class ScriptedPool implements IWorkerPool {

        private final int workers;
        private final Function<FrameTask, FrameOutcome> script;
        private final List<FrameTask> submitted = Collections.synchronizedList(new ArrayList<>());

        ScriptedPool(int workers, Function<FrameTask, FrameOutcome> script) {
            this.workers = workers;
            this.script = script;
        }

        @Override
        public CompletableFuture<FrameOutcome> submit(FrameTask task) {
            submitted.add(task);
            FrameOutcome outcome = script.apply(task);
            return outcome == null ? new CompletableFuture<>() : CompletableFuture.completedFuture(outcome);
        }

        @Override
        public int workerCount() {
            return workers;
        }

        @Override
        public String describe() {
            return "scripted (" + workers + " workers)";
        }

        List<FrameTask> submitted() {
            synchronized (submitted) {
                return new ArrayList<>(submitted);
            }
        }

        @Override
        public void close() {
        }
    }
}
