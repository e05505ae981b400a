package org.prisma.datapipeline.api.frames;

import java.util.Locale;

/**
 * On-disk layout of the file a frame comes from.
 */
public enum FrameFormat {
    /** A TIFF file holding exactly one frame. */
    TIFF,
    /** A multi-page TIFF; each page is one frame. */
    TIFF_STACK,
    /** A GE detector file: fixed-size header followed by raw little-endian uint16 frames. */
    GE_RAW;

    /**
     * @return true if frames of this format are packed into a shared container file.
     */
    public boolean isContainer() {
        return this != TIFF;
    }

    /**
     * Classifies a file name by extension. Multi-page TIFFs are only recognised after the page
     * count is known, so this returns {@link #TIFF} for every TIFF.
     *
     * @param fileName the file name.
     * @return the format, or {@code null} if the file does not hold frames.
     */
    public static FrameFormat fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tif") || lower.endsWith(".tiff")) {
            return TIFF;
        }
        if (lower.matches(".*\\.ge[1-5]$")) {
            return GE_RAW;
        }
        return null;
    }
}
