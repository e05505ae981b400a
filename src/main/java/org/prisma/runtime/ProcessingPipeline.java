package org.prisma.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntConsumer;

import org.prisma.datapipeline.api.frames.FrameDescriptor;
import org.prisma.datapipeline.api.frames.IFrameEnumerator;
import org.prisma.datapipeline.api.job.FrameRange;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.api.job.PeakDefinition;
import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameFailure;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.api.results.MeasurementColumns;
import org.prisma.datapipeline.job.JobSpecificationException;
import org.prisma.datapipeline.resources.frames.DirectoryFrameEnumerator;
import org.prisma.datapipeline.resources.frames.FrameOrderingValidator;
import org.prisma.datapipeline.resources.storage.ChunkLayout;
import org.prisma.datapipeline.resources.storage.DatasetIdentity;
import org.prisma.datapipeline.resources.storage.DatasetLocator;
import org.prisma.datapipeline.resources.storage.DatasetMetadata;
import org.prisma.datapipeline.resources.storage.DatasetReader;
import org.prisma.datapipeline.resources.storage.DatasetWriter;
import org.prisma.datapipeline.resources.storage.StoredDataset;
import org.prisma.datapipeline.services.ResultReducer;
import org.prisma.datapipeline.services.StrainPostProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Runs one job end to end on a worker pool.
 * <p>
 * Steps:
 * <ol>
 *   <li>enumerate the requested frames and resolve an open frame end;</li>
 *   <li>seed frames already stored in an earlier dataset with the same resume key;</li>
 *   <li>submit every remaining frame, retrying infrastructure failures up to
 *       {@code prisma.execution.maxRetries} times;</li>
 *   <li>checkpoint each frame-chunk row as soon as all of its frames are resolved;</li>
 *   <li>process the reference frames, if any, through the same pool;</li>
 *   <li>derive strain, finalize the dataset and write the run summary.</li>
 * </ol>
 * The dataset is allocated with its final columns up front, so the chunk grid used by
 * checkpoints is the grid of the finalized dataset.
 * <p>
 * <b>Thread safety:</b> one run at a time per instance. Results are reduced on the threads
 * that complete the pool's futures.
 */
public class ProcessingPipeline {

    private static final Logger log = LoggerFactory.getLogger(ProcessingPipeline.class);

    private final IWorkerPool pool;
    private final IFrameEnumerator enumerator;
    private final Clock clock;
    private final Config storage;
    private final StrainPostProcessor postProcessor;
    private final int maxRetries;
    private final Duration runTimeout;
    private final long targetChunkBytes;
    private final boolean resume;

    /**
     * @param config application configuration.
     * @param pool   where frames are processed; not closed by the pipeline.
     */
    public ProcessingPipeline(Config config, IWorkerPool pool) {
        this(config, pool, new DirectoryFrameEnumerator(section(config, "prisma.frames")), Clock.systemDefaultZone());
    }

    /**
     * @param config     application configuration.
     * @param pool       where frames are processed; not closed by the pipeline.
     * @param enumerator frame source.
     * @param clock      clock deciding the dated output directory.
     */
    public ProcessingPipeline(Config config, IWorkerPool pool, IFrameEnumerator enumerator, Clock clock) {
        this.pool = pool;
        this.enumerator = enumerator;
        this.clock = clock;
        Config execution = section(config, "prisma.execution");
        this.storage = section(config, "prisma.storage");
        this.postProcessor = new StrainPostProcessor(section(config, "prisma.postprocessing"));
        this.maxRetries = execution.hasPath("maxRetries") ? execution.getInt("maxRetries") : 2;
        this.runTimeout = execution.hasPath("runTimeout") ? execution.getDuration("runTimeout") : Duration.ZERO;
        this.targetChunkBytes = storage.hasPath("targetChunkBytes") ? storage.getLong("targetChunkBytes")
            : 100L * 1024 * 1024;
        this.resume = !storage.hasPath("resume") || storage.getBoolean("resume");
    }

    /**
     * Rejects a frame selection whose dataset would not fit in memory as one array.
     *
     * @throws JobSpecificationException naming {@code frame_end} if the dataset is too large.
     */
    static void requireDatasetFits(int peaks, int frames, int azimuths, int columns) {
        try {
            Dataset4D.requireCapacity(peaks, frames, azimuths, columns);
        } catch (IllegalArgumentException e) {
            throw new JobSpecificationException("frame_end", e.getMessage() + "; process a smaller frame range", e);
        }
    }

    private static Config section(Config config, String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    /**
     * Processes a job and writes its dataset.
     *
     * @param job  the job.
     * @param mode how the pool executes frames, recorded in the summary.
     * @return the run summary, also written as {@code summary.json} in the dataset directory.
     * @throws JobSpecificationException if the image source cannot be read or selects no frames.
     * @throws IOException               if the dataset cannot be finalized.
     * @throws InterruptedException      if interrupted while waiting for frames.
     */
    public RunSummary run(JobSpecification job, ExecutionMode mode) throws IOException, InterruptedException {
        long started = System.nanoTime();
        long deadline = runTimeout.isZero() || runTimeout.isNegative() ? 0L : started + runTimeout.toNanos();

        List<FrameDescriptor> frames = enumerate(job.imagesPath(), job.frames(), "images_path");
        FrameRange requested = job.frames();
        JobSpecification resolved = job.withFrames(requested.resolve(frames.get(frames.size() - 1).globalIndex() + 1));
        FrameOrderingValidator.Result ordering = FrameOrderingValidator.validate(frames);

        IntArrayList numbers = new IntArrayList(frames.size());
        for (FrameDescriptor frame : frames) {
            numbers.add(frame.globalIndex());
        }
        int[] frameNumbers = numbers.toIntArray();
        List<String> columns = new ArrayList<>(MeasurementColumns.BASE);
        columns.addAll(postProcessor.derivedColumns());
        requireDatasetFits(job.peakCount(), frameNumbers.length, job.binning().binCount(), columns.size());
        Dataset4D dataset = new Dataset4D(job.peakCount(), frameNumbers, job.binning().binCenters(), columns);
        ChunkLayout layout = ChunkLayout.plan(job.peakCount(), frameNumbers.length, job.binning().binCount(),
            columns.size(), targetChunkBytes);

        String resumeKey = DatasetIdentity.resumeKey(resolved);
        String paramString = DatasetIdentity.paramString(resolved, requested);
        log.info("Processing {}: {} frames, {} peaks, {} azimuth bins, {} chunks, {}", job.sample(),
            frameNumbers.length, job.peakCount(), job.binning().binCount(), layout.chunkCount(), pool.describe());

        StoredDataset earlier = resume ? findEarlier(resolved, resumeKey, frameNumbers) : null;
        Path zarrRoot = DatasetLocator.zarrRoot(job.homeDirectory(), LocalDate.now(clock), job.sample());
        DatasetWriter writer = new DatasetWriter(zarrRoot, resumeKey, layout, storage);

        ResultReducer reducer = new ResultReducer(dataset);
        Checkpointer checkpointer = new Checkpointer(writer, reducer, layout, resolved, resumeKey, paramString,
            clock);
        Assembly assembly = new Assembly(frames, reducer, checkpointer::onResolved);

        int seeded = 0;
        if (earlier != null) {
            seeded = seed(reducer, earlier);
            writer.linkFrom(earlier);
            log.info("Reusing {} of {} frames from {}", seeded, frameNumbers.length, earlier.directory());
            for (int fc = 0; fc < layout.frameChunkCount(); fc++) {
                checkpointer.onResolved(layout.frameStart(fc));
            }
        }

        boolean timedOut = runRounds(assembly, deadline);
        Dataset4D assembled = assembly.close();
        if (timedOut) {
            markTimedOut(reducer, "no result before the run timeout of " + runTimeout);
        }

        Dataset4D reference = null;
        int referenceFrames = 0;
        if (job.reference().isPresent()) {
            reference = processReference(job.forReference(), deadline);
            referenceFrames = reference == null ? 0 : reference.frames();
        }

        StrainPostProcessor.Result strained = postProcessor.apply(assembled, reference);
        DatasetMetadata metadata = checkpointer.metadata();
        metadata.identity = DatasetIdentity.identity(resolved);
        metadata.referenceValues = strained.referenceValues();
        metadata.referenceDataset = reference == null ? null : job.referencePath().toString();
        Path directory = writer.finalizeDataset(strained.dataset(), metadata, paramString + "-" + metadata.identity);

        RunSummary summary = new RunSummary();
        summary.sample = job.sample();
        summary.identity = metadata.identity;
        summary.path = directory.toString();
        summary.mode = mode.name().toLowerCase(Locale.ROOT);
        summary.requestedFrames = reducer.requestedCount();
        summary.completedFrames = reducer.completedCount();
        for (Map.Entry<Integer, FrameFailure> entry : reducer.missingFrames().entrySet()) {
            FrameFailure failure = entry.getValue();
            summary.missingFrames.put(frameNumbers[entry.getKey()], failure.kind() + ": " + failure.message());
        }
        summary.cellFailures = reducer.cellFailures();
        summary.missingChunks = writer.missingChunks();
        summary.orderingVerified = ordering.verified();
        summary.orderingDisagreements = ordering.disagreements();
        summary.seededFrames = seeded;
        summary.duplicatesDropped = reducer.duplicatesDropped();
        summary.timedOut = timedOut;
        summary.referenceFrames = referenceFrames;
        summary.durationMillis = (System.nanoTime() - started) / 1_000_000;
        DatasetWriter.writeJson(directory.resolve(DatasetWriter.SUMMARY_FILE), summary);

        if (summary.isComplete()) {
            log.info("{}", summary.toLogLine());
        } else {
            log.warn("{}", summary.toLogLine());
        }
        return summary;
    }

    // ===== frames =====

    private List<FrameDescriptor> enumerate(Path source, FrameRange range, String field) {
        List<FrameDescriptor> frames;
        try {
            frames = enumerator.enumerate(source, range);
        } catch (IOException e) {
            throw new JobSpecificationException(field, "cannot read frames from " + source + ": " + e.getMessage(), e);
        }
        if (frames.isEmpty()) {
            throw new JobSpecificationException(field, "frame range " + range.start() + ".."
                + (range.isOpenEnded() ? "end" : range.end()) + " step " + range.step() + " selects no frames in "
                + source);
        }
        return frames;
    }

    /**
     * Submits every unresolved position and resubmits retryable failures until all positions
     * are resolved or the deadline passes.
     *
     * @return true if the deadline passed first.
     */
    private boolean runRounds(Assembly assembly, long deadline) throws InterruptedException {
        ResultReducer reducer = assembly.reducer;
        List<FrameTask> round = new ArrayList<>();
        for (int position = 0; position < assembly.frames.size(); position++) {
            if (!reducer.isComplete(position)) {
                round.add(FrameTask.first(position, assembly.frames.get(position)));
            }
        }
        while (!round.isEmpty()) {
            List<CompletableFuture<FrameOutcome>> futures = new ArrayList<>(round.size());
            for (FrameTask task : round) {
                futures.add(pool.submit(task).thenApply(outcome -> {
                    assembly.accept(outcome);
                    return outcome;
                }));
            }
            Duration wait = null;
            if (deadline != 0L) {
                wait = Duration.ofNanos(Math.max(1_000_000L, deadline - System.nanoTime()));
            }
            List<FrameOutcome> outcomes = pool.gatherAll(futures, wait);
            if (outcomes.size() < futures.size()) {
                return true;
            }

            List<FrameTask> next = new ArrayList<>();
            for (int i = 0; i < outcomes.size(); i++) {
                FrameOutcome outcome = outcomes.get(i);
                if (outcome.isSuccess()) {
                    continue;
                }
                FrameTask task = round.get(i);
                if (reducer.isComplete(task.position())) {
                    continue;
                }
                if (task.attempt() < maxRetries) {
                    log.warn("Retrying {} after {} on {}", task.frame(), outcome.failure().kind(), outcome.workerId());
                    next.add(task.retry(pool.workerCount() > 1 ? outcome.workerId() : null));
                } else {
                    log.warn("Giving up on {} after {} attempts: {}", task.frame(), task.attempt() + 1,
                        outcome.failure().message());
                    reducer.markMissing(task.position(), outcome.failure());
                    assembly.onResolved.accept(task.position());
                }
            }
            round = next;
        }
        return false;
    }

    private static void markTimedOut(ResultReducer reducer, String message) {
        int marked = 0;
        for (int position = 0; position < reducer.requestedCount(); position++) {
            if (!reducer.isResolved(position)) {
                reducer.markMissing(position, new FrameFailure(FailureKind.TRANSPORT, message));
                marked++;
            }
        }
        log.warn("Run timed out, {} frames left unresolved", marked);
    }

    private Dataset4D processReference(JobSpecification referenceJob, long deadline) throws InterruptedException {
        List<FrameDescriptor> frames;
        try {
            frames = enumerate(referenceJob.imagesPath(), referenceJob.frames(), "refs_path");
        } catch (JobSpecificationException e) {
            log.warn("Reference frames unavailable, strain will be empty: {}", e.getMessage());
            return null;
        }
        int[] numbers = new int[frames.size()];
        for (int i = 0; i < numbers.length; i++) {
            numbers[i] = frames.get(i).globalIndex();
        }
        Dataset4D dataset = new Dataset4D(referenceJob.peakCount(), numbers, referenceJob.binning().binCenters(),
            MeasurementColumns.BASE);
        ResultReducer reducer = new ResultReducer(dataset);
        Assembly assembly = new Assembly(frames, reducer, position -> { });
        log.info("Processing {} reference frames from {}", frames.size(), referenceJob.imagesPath());
        boolean timedOut = runRounds(assembly, deadline);
        Dataset4D reference = assembly.close();
        if (timedOut) {
            markTimedOut(reducer, "no reference result before the run timeout");
        }
        if (reducer.completedCount() < reducer.requestedCount()) {
            log.warn("Reference incomplete: {} of {} frames", reducer.completedCount(), reducer.requestedCount());
        }
        return reference;
    }

    // ===== resume =====

    private StoredDataset findEarlier(JobSpecification job, String resumeKey, int[] frameNumbers) {
        IntOpenHashSet wanted = new IntOpenHashSet(frameNumbers);
        DatasetLocator.Candidate best = null;
        int bestOverlap = 0;
        for (DatasetLocator.Candidate candidate : DatasetLocator.findByResumeKey(job.homeDirectory(), job.sample(),
                resumeKey)) {
            int overlap = 0;
            for (Integer frame : candidate.metadata().completedFrames) {
                if (wanted.contains(frame.intValue())) {
                    overlap++;
                }
            }
            if (overlap > bestOverlap) {
                best = candidate;
                bestOverlap = overlap;
            }
        }
        if (best == null) {
            return null;
        }
        try {
            return DatasetReader.read(best.directory());
        } catch (IOException e) {
            log.warn("Cannot reuse earlier dataset {}, processing all frames: {}", best.directory(), e.getMessage());
            return null;
        }
    }

    private static int seed(ResultReducer reducer, StoredDataset earlier) {
        Dataset4D source = earlier.dataset();
        int[] sourceFrames = source.frameNumbers();
        Int2IntOpenHashMap sourcePosition = new Int2IntOpenHashMap(sourceFrames.length);
        sourcePosition.defaultReturnValue(-1);
        for (int i = 0; i < sourceFrames.length; i++) {
            sourcePosition.put(sourceFrames[i], i);
        }
        IntOpenHashSet completed = new IntOpenHashSet();
        for (Integer frame : earlier.metadata().completedFrames) {
            completed.add(frame.intValue());
        }
        int[] frameNumbers = reducer.view().frameNumbers();
        int positionColumn = source.columnIndex(MeasurementColumns.POSITION);
        int seeded = 0;
        for (int position = 0; position < frameNumbers.length; position++) {
            int sourceFrame = sourcePosition.get(frameNumbers[position]);
            if (sourceFrame < 0 || !completed.contains(frameNumbers[position])) {
                continue;
            }
            int failedCells = 0;
            for (int p = 0; p < source.peaks(); p++) {
                for (int a = 0; a < source.azimuths(); a++) {
                    if (Float.isNaN(source.get(p, sourceFrame, a, positionColumn))) {
                        failedCells++;
                    }
                }
            }
            if (reducer.seed(position, source, sourceFrame, failedCells)) {
                seeded++;
            }
        }
        return seeded;
    }

    // ===== helpers =====

    /**
     * Reduces outcomes until closed. Outcomes arriving after {@link #close()} are dropped, so
     * the materialized dataset is never written to again.
     */
    private static final class Assembly {

        private final List<FrameDescriptor> frames;
        private final ResultReducer reducer;
        private final IntConsumer onResolved;
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private boolean closed;

        Assembly(List<FrameDescriptor> frames, ResultReducer reducer, IntConsumer onResolved) {
            this.frames = frames;
            this.reducer = reducer;
            this.onResolved = onResolved;
        }

        void accept(FrameOutcome outcome) {
            lock.readLock().lock();
            try {
                if (closed) {
                    log.debug("Dropping {} received after the run was closed", outcome);
                    return;
                }
                if (reducer.accept(outcome)) {
                    onResolved.accept(outcome.position());
                }
            } catch (RuntimeException e) {
                log.warn("Cannot apply {}: {}", outcome, e.getMessage());
                log.debug("Exception details:", e);
            } finally {
                lock.readLock().unlock();
            }
        }

        Dataset4D close() {
            lock.writeLock().lock();
            try {
                closed = true;
                return reducer.materialize();
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    /**
     * Writes a frame-chunk row once every frame in it is resolved.
     */
    private static final class Checkpointer {

        private final DatasetWriter writer;
        private final ResultReducer reducer;
        private final ChunkLayout layout;
        private final JobSpecification job;
        private final String resumeKey;
        private final String paramString;
        private final Clock clock;
        private final BitSet flushed;

        Checkpointer(DatasetWriter writer, ResultReducer reducer, ChunkLayout layout, JobSpecification job,
                     String resumeKey, String paramString, Clock clock) {
            this.writer = writer;
            this.reducer = reducer;
            this.layout = layout;
            this.job = job;
            this.resumeKey = resumeKey;
            this.paramString = paramString;
            this.clock = clock;
            this.flushed = new BitSet(layout.frameChunkCount());
        }

        void onResolved(int position) {
            int frameChunk = layout.frameChunkOf(position);
            for (int p = layout.frameStart(frameChunk); p < layout.frameEnd(frameChunk); p++) {
                if (!reducer.isResolved(p)) {
                    return;
                }
            }
            synchronized (flushed) {
                if (flushed.get(frameChunk)) {
                    return;
                }
                flushed.set(frameChunk);
                try {
                    writer.checkpoint(reducer.view(), frameChunk, metadata());
                } catch (IOException e) {
                    log.warn("Checkpoint of frame chunk {} failed, it will be written at finalize: {}", frameChunk,
                        e.getMessage());
                }
            }
        }

        DatasetMetadata metadata() {
            DatasetMetadata metadata = new DatasetMetadata();
            metadata.resumeKey = resumeKey;
            metadata.paramString = paramString;
            metadata.createdAt = clock.instant().toString();
            for (PeakDefinition peak : job.activePeaks()) {
                metadata.peakNames.add(peak.name());
                metadata.millerIndices.add(peak.millerIndex());
                metadata.peakPositions.add(peak.position());
            }
            List<String> columns = reducer.view().columns();
            metadata.measurements = new ArrayList<>(columns);
            for (int i = 0; i < columns.size(); i++) {
                metadata.colIdx.put(columns.get(i), i);
            }
            int[] frameNumbers = reducer.view().frameNumbers();
            BitSet completed = reducer.completed();
            for (int position = completed.nextSetBit(0); position >= 0; position = completed.nextSetBit(position + 1)) {
                metadata.completedFrames.add(frameNumbers[position]);
            }
            metadata.parameters = DatasetIdentity.normalizedParameters(job);
            return metadata;
        }
    }
}
