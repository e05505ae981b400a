package org.prisma.datapipeline.resources.frames;

import java.util.List;

import org.prisma.datapipeline.api.frames.FrameDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks enumerated frames against their acquisition timestamps.
 * <p>
 * The global index is authoritative for ordering. Timestamps only confirm it: when every frame
 * carries one and they never decrease, ordering is verified. Missing timestamps leave ordering
 * unverified; decreasing timestamps additionally log a warning. Neither case is fatal.
 */
public final class FrameOrderingValidator {

    private static final Logger log = LoggerFactory.getLogger(FrameOrderingValidator.class);

    private FrameOrderingValidator() {
    }

    /**
     * Outcome of an ordering check.
     *
     * @param verified      true if timestamps confirm the index order
     * @param disagreements number of adjacent pairs whose timestamps decrease
     */
    public record Result(boolean verified, int disagreements) {}

    /**
     * @param frames frames in enumeration order.
     * @return the ordering result.
     * @throws IllegalStateException if global indices are not strictly increasing.
     */
    public static Result validate(List<FrameDescriptor> frames) {
        boolean allTimestamped = true;
        int disagreements = 0;
        FrameDescriptor previous = null;
        for (FrameDescriptor frame : frames) {
            if (previous != null && frame.globalIndex() <= previous.globalIndex()) {
                throw new IllegalStateException("Global frame indices not strictly increasing at " + frame);
            }
            if (frame.timestampMillis() == null) {
                allTimestamped = false;
            } else if (previous != null && previous.timestampMillis() != null
                    && frame.timestampMillis() < previous.timestampMillis()) {
                disagreements++;
                if (disagreements == 1) {
                    log.warn("Acquisition timestamp of {} precedes {}; keeping file order", frame, previous);
                }
            }
            previous = frame;
        }
        if (disagreements > 1) {
            log.warn("{} frames have timestamps that disagree with file order; ordering is unverified", disagreements);
        } else if (!allTimestamped && !frames.isEmpty()) {
            log.debug("Not all frames carry timestamps; ordering is unverified");
        }
        return new Result(allTimestamped && disagreements == 0 && !frames.isEmpty(), disagreements);
    }
}
