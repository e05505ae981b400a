package org.prisma.datapipeline.api.frames;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.prisma.datapipeline.api.job.FrameRange;

/**
 * Resolves a frame source into an ordered sequence of frame descriptors.
 * <p>
 * Implementations must be deterministic: the same source and range always yield the same
 * sequence, in ascending global index.
 */
public interface IFrameEnumerator {

    /**
     * @param source the frame source (typically a directory of image files).
     * @param range  the frames to select.
     * @return the selected frames in ascending global index.
     * @throws IOException if the source cannot be read.
     */
    List<FrameDescriptor> enumerate(Path source, FrameRange range) throws IOException;
}
