package org.prisma.datapipeline.services;

import java.util.BitSet;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicLong;

import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.api.results.FrameFailure;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles frame outcomes into the 4D dataset.
 * <p>
 * Every outcome carries the frame's position in the requested sequence, and that position alone
 * decides where its values land. Arrival order is irrelevant.
 * <p>
 * Per position a small state machine guards the write:
 * <pre>
 *   EMPTY --claim--&gt; WRITING --publish--&gt; DONE
 * </pre>
 * Claiming is a compare-and-set, so exactly one success is ever written per position; later
 * duplicates (for example from a retried task whose first attempt also finished) are dropped.
 * A failure arriving for a position that is already DONE is logged and ignored.
 * <p>
 * <b>Thread safety:</b> {@link #accept(FrameOutcome)} may be called concurrently. Writes to
 * different positions touch disjoint parts of the array, so no lock is needed. Snapshots taken
 * with {@link #materialize()} see every position published before the call.
 */
public class ResultReducer {

    private static final Logger log = LoggerFactory.getLogger(ResultReducer.class);

    private static final int EMPTY = 0;
    private static final int WRITING = 1;
    private static final int DONE = 2;

    private final Dataset4D dataset;
    private final int[] frameNumbers;
    private final AtomicIntegerArray states;
    private final AtomicLong cellFailures = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final Map<Integer, FrameFailure> missing = new ConcurrentHashMap<>();

    /**
     * @param dataset the NaN-initialized dataset to fill; owned by the reducer from now on.
     */
    public ResultReducer(Dataset4D dataset) {
        this.dataset = dataset;
        this.frameNumbers = dataset.frameNumbers();
        this.states = new AtomicIntegerArray(dataset.frames());
    }

    /**
     * Applies one outcome.
     *
     * @param outcome a worker outcome.
     * @return true if the outcome changed the dataset.
     */
    public boolean accept(FrameOutcome outcome) {
        int position = outcome.position();
        checkPosition(position);
        if (!outcome.isSuccess()) {
            if (states.get(position) == DONE) {
                log.warn("Ignoring late failure for frame {} which already completed: {}", outcome.globalIndex(),
                    outcome.failure().message());
            }
            return false;
        }
        if (frameNumbers[position] != outcome.globalIndex()) {
            throw new IllegalArgumentException("Outcome for frame " + outcome.globalIndex() + " tagged with position "
                + position + ", which holds frame " + frameNumbers[position]);
        }
        if (!states.compareAndSet(position, EMPTY, WRITING)) {
            duplicates.incrementAndGet();
            log.debug("Dropping duplicate result for frame {} (attempt {})", outcome.globalIndex(), outcome.attempt());
            return false;
        }
        FrameResult result = outcome.result();
        dataset.putFrame(position, result);
        cellFailures.addAndGet(result.failedCells());
        missing.remove(position);
        states.set(position, DONE);
        return true;
    }

    /**
     * Fills a position from a previously written dataset instead of recomputing it.
     *
     * @param position     position in this run.
     * @param source       dataset holding the frame.
     * @param sourceFrame  position of the frame in {@code source}.
     * @param failedCells  number of cells of that frame that carry no data.
     * @return true if the position was empty and is now filled.
     */
    public boolean seed(int position, Dataset4D source, int sourceFrame, int failedCells) {
        checkPosition(position);
        if (!states.compareAndSet(position, EMPTY, WRITING)) {
            return false;
        }
        dataset.copyFrame(position, source, sourceFrame);
        cellFailures.addAndGet(failedCells);
        states.set(position, DONE);
        return true;
    }

    /**
     * Records that a position will not be filled in this run.
     *
     * @param position position in the requested sequence.
     * @param failure  the last failure seen for it.
     */
    public void markMissing(int position, FrameFailure failure) {
        checkPosition(position);
        if (states.get(position) != DONE) {
            missing.put(position, failure);
        }
    }

    public boolean isComplete(int position) {
        return states.get(position) == DONE;
    }

    /**
     * @param position position in the requested sequence.
     * @return true if the position is complete or has been given up on.
     */
    public boolean isResolved(int position) {
        return isComplete(position) || missing.containsKey(position);
    }

    /**
     * @return one bit per requested frame, set where the frame is complete.
     */
    public BitSet completed() {
        BitSet bits = new BitSet(states.length());
        for (int i = 0; i < states.length(); i++) {
            if (states.get(i) == DONE) {
                bits.set(i);
            }
        }
        return bits;
    }

    public int completedCount() {
        return completed().cardinality();
    }

    public int requestedCount() {
        return states.length();
    }

    /**
     * @return fraction of requested frames that are complete, 1.0 for an empty request.
     */
    public double completeness() {
        return states.length() == 0 ? 1.0 : (double) completedCount() / states.length();
    }

    public long cellFailures() {
        return cellFailures.get();
    }

    public long duplicatesDropped() {
        return duplicates.get();
    }

    /**
     * @return failures of positions given up on, keyed by position.
     */
    public Map<Integer, FrameFailure> missingFrames() {
        return Collections.unmodifiableMap(new TreeMap<>(missing));
    }

    /**
     * @return a copy of the dataset in its current, possibly partial state.
     */
    public Dataset4D materialize() {
        return dataset.copy();
    }

    /**
     * Returns the live dataset without copying. Only positions for which {@link #isResolved(int)}
     * returns true may be read; they are never written again.
     *
     * @return the dataset being assembled.
     */
    public Dataset4D view() {
        return dataset;
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= states.length()) {
            throw new IndexOutOfBoundsException("Frame position " + position + " outside [0, " + states.length() + ")");
        }
    }
}
