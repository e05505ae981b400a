package org.prisma.datapipeline.api.job;

/**
 * Requested frames as a half-open range of global frame indices with a stride.
 *
 * @param start first global frame index
 * @param end   exclusive end, or {@link #ALL} for every frame the source provides
 * @param step  stride between selected frames (at least 1)
 */
public record FrameRange(int start, int end, int step) {

    /** Marker for "up to the last frame of the source". */
    public static final int ALL = -1;

    public boolean isOpenEnded() {
        return end == ALL;
    }

    /**
     * @param globalIndex a global frame index.
     * @return true if this range selects the frame.
     */
    public boolean selects(int globalIndex) {
        if (globalIndex < start) {
            return false;
        }
        if (!isOpenEnded() && globalIndex >= end) {
            return false;
        }
        return (globalIndex - start) % step == 0;
    }

    /**
     * @return the number of frames this range selects, or -1 when open-ended.
     */
    public int expectedCount() {
        if (isOpenEnded()) {
            return -1;
        }
        return Math.max(0, (end - start + step - 1) / step);
    }

    /**
     * Returns a copy with a concrete end, used once the frame source has been enumerated.
     *
     * @param resolvedEnd exclusive end index.
     * @return the resolved range.
     */
    public FrameRange resolve(int resolvedEnd) {
        return isOpenEnded() ? new FrameRange(start, resolvedEnd, step) : this;
    }
}
