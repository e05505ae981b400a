package org.prisma.datapipeline.api.frames;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Optional;

/**
 * Locates one frame.
 * <p>
 * The global index is dense and zero-based across all files of a source, in acquisition order.
 * Descriptors travel inside distributed task messages, so the source is kept as a string and
 * the timestamp as epoch milliseconds.
 *
 * @param globalIndex   global frame index
 * @param source        absolute path of the file holding the frame
 * @param offset        frame number inside the file (0 for single-frame files)
 * @param format        layout of the source file
 * @param timestampMillis acquisition time in epoch milliseconds, or {@code null} if unknown
 */
public record FrameDescriptor(int globalIndex, String source, int offset, FrameFormat format, Long timestampMillis) {

    public Path sourcePath() {
        return Paths.get(source);
    }

    public Optional<Instant> timestamp() {
        return timestampMillis == null ? Optional.empty() : Optional.of(Instant.ofEpochMilli(timestampMillis));
    }

    @Override
    public String toString() {
        return "frame " + globalIndex + " (" + sourcePath().getFileName() + (format.isContainer() ? "#" + offset : "") + ")";
    }
}
