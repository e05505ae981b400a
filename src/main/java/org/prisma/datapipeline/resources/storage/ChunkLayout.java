package org.prisma.datapipeline.resources.storage;

/**
 * Chunk grid of a 4D dataset.
 * <p>
 * Only the frame and azimuth axes are split; every chunk holds all peaks and all measurement
 * columns. Chunks at the end of an axis are trimmed to the axis length.
 *
 * @param peaks         peak-axis length
 * @param frames        frame-axis length
 * @param azimuths      azimuth-axis length
 * @param measurements  measurement-axis length
 * @param frameChunk    nominal chunk extent along the frame axis
 * @param azimuthChunk  nominal chunk extent along the azimuth axis
 */
public record ChunkLayout(int peaks, int frames, int azimuths, int measurements, int frameChunk, int azimuthChunk) {

    /** Size of one stored element (float32). */
    public static final int ELEMENT_BYTES = Float.BYTES;

    /**
     * Plans the chunk grid for a target uncompressed chunk size.
     * <p>
     * The azimuth axis is kept whole when one frame's worth of data fits into the target, and
     * frames are then added until the target is reached. Otherwise the azimuth axis is split and
     * a chunk holds a single frame. The frame extent depends only on the other axes, so the grid
     * of an existing dataset is unchanged when its frame axis grows.
     *
     * @param peaks        peak-axis length.
     * @param frames       frame-axis length.
     * @param azimuths     azimuth-axis length.
     * @param measurements measurement-axis length.
     * @param targetBytes  target uncompressed chunk size.
     * @return the layout.
     */
    public static ChunkLayout plan(int peaks, int frames, int azimuths, int measurements, long targetBytes) {
        if (targetBytes <= 0) {
            throw new IllegalArgumentException("targetChunkBytes must be positive: " + targetBytes);
        }
        long cellBytes = (long) peaks * measurements * ELEMENT_BYTES;
        long rowBytes = cellBytes * Math.max(1, azimuths);
        int frameChunk;
        int azimuthChunk;
        if (rowBytes <= targetBytes) {
            azimuthChunk = Math.max(1, azimuths);
            frameChunk = (int) Math.min(Integer.MAX_VALUE, Math.max(1, targetBytes / rowBytes));
        } else {
            azimuthChunk = (int) Math.max(1, targetBytes / Math.max(1, cellBytes));
            frameChunk = 1;
        }
        return new ChunkLayout(peaks, frames, azimuths, measurements, frameChunk, azimuthChunk);
    }

    public int frameChunkCount() {
        return ceilDiv(frames, frameChunk);
    }

    public int azimuthChunkCount() {
        return ceilDiv(azimuths, azimuthChunk);
    }

    public int chunkCount() {
        return frameChunkCount() * azimuthChunkCount();
    }

    public int frameStart(int frameChunkIndex) {
        return frameChunkIndex * frameChunk;
    }

    /**
     * @param frameChunkIndex chunk index along the frame axis.
     * @return exclusive end of the chunk along the frame axis, trimmed to the axis length.
     */
    public int frameEnd(int frameChunkIndex) {
        return Math.min(frames, frameStart(frameChunkIndex) + frameChunk);
    }

    public int azimuthStart(int azimuthChunkIndex) {
        return azimuthChunkIndex * azimuthChunk;
    }

    public int azimuthEnd(int azimuthChunkIndex) {
        return Math.min(azimuths, azimuthStart(azimuthChunkIndex) + azimuthChunk);
    }

    /**
     * @param position frame-axis position.
     * @return index of the frame chunk row holding it.
     */
    public int frameChunkOf(int position) {
        return position / frameChunk;
    }

    /**
     * @return uncompressed size of one chunk in bytes, after trimming.
     */
    public long chunkBytes(int frameChunkIndex, int azimuthChunkIndex) {
        return (long) peaks * (frameEnd(frameChunkIndex) - frameStart(frameChunkIndex))
            * (azimuthEnd(azimuthChunkIndex) - azimuthStart(azimuthChunkIndex)) * measurements * ELEMENT_BYTES;
    }

    /**
     * @return nominal chunk shape in (peak, frame, azimuth, measurement) order.
     */
    public int[] chunkShape() {
        return new int[] {peaks, frameChunk, azimuthChunk, measurements};
    }

    public int[] shape() {
        return new int[] {peaks, frames, azimuths, measurements};
    }

    /**
     * @return true if both layouts split a dataset at the same places.
     */
    public boolean sameGrid(ChunkLayout other) {
        return other != null && peaks == other.peaks && azimuths == other.azimuths
            && measurements == other.measurements && frameChunk == other.frameChunk
            && azimuthChunk == other.azimuthChunk;
    }

    public static String chunkKey(int frameChunkIndex, int azimuthChunkIndex) {
        return "c." + frameChunkIndex + "." + azimuthChunkIndex;
    }

    private static int ceilDiv(int value, int divisor) {
        return value <= 0 ? 0 : (value + divisor - 1) / divisor;
    }
}
