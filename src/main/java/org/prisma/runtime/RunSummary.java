package org.prisma.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one processing run, written next to the dataset as {@code summary.json}.
 */
public class RunSummary {

    public String sample;

    /** Dataset identity; null if the run did not reach finalization. */
    public String identity;

    /** Final dataset directory. */
    public String path;

    /** {@code local} or {@code distributed}. */
    public String mode;

    public int requestedFrames;

    public int completedFrames;

    /** Frames that never produced a result, global index to {@code KIND: message}. */
    public Map<Integer, String> missingFrames = new LinkedHashMap<>();

    /** Number of (frame, azimuth, peak) fits that did not converge. */
    public long cellFailures;

    public List<String> missingChunks = new ArrayList<>();

    /** True if every frame carried a timestamp and the timestamps were non-decreasing. */
    public boolean orderingVerified;

    public int orderingDisagreements;

    /** Frames taken over from an earlier dataset instead of being recomputed. */
    public int seededFrames;

    public long duplicatesDropped;

    /** True if the run timeout expired before every frame was resolved. */
    public boolean timedOut;

    public int referenceFrames;

    public long durationMillis;

    public boolean isComplete() {
        return completedFrames == requestedFrames && missingChunks.isEmpty();
    }

    /**
     * @return a single-line rendering for the log.
     */
    public String toLogLine() {
        return String.format("%s: %d/%d frames (%d reused), %d missing, %d failed cells, %d missing chunks, "
                + "ordering %s, %s mode, %d ms -> %s",
            sample, completedFrames, requestedFrames, seededFrames, missingFrames.size(), cellFailures,
            missingChunks.size(), orderingVerified ? "verified" : "unverified", mode, durationMillis,
            path == null ? "(not written)" : path);
    }
}
