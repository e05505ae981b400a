package org.prisma.datapipeline.api.frames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A decoded frame: row-major intensities plus the temporary file, if any, that decoding
 * needed. Closing the frame deletes that file; closing twice is harmless. A file that cannot be
 * deleted is logged and left behind, it never fails the frame.
 */
public final class DecodedFrame implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DecodedFrame.class);

    private final FrameDescriptor descriptor;
    private final int width;
    private final int height;
    private final float[] intensities;
    private final Path artifact;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param descriptor  the frame this data belongs to.
     * @param width       number of columns.
     * @param height      number of rows.
     * @param intensities row-major pixel intensities, {@code width * height} long.
     * @param artifact    temporary file to delete on close, or {@code null}.
     */
    public DecodedFrame(FrameDescriptor descriptor, int width, int height, float[] intensities, Path artifact) {
        if (intensities.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " pixels, got " + intensities.length);
        }
        this.descriptor = descriptor;
        this.width = width;
        this.height = height;
        this.intensities = intensities;
        this.artifact = artifact;
    }

    public FrameDescriptor descriptor() {
        return descriptor;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float intensity(int x, int y) {
        return intensities[y * width + x];
    }

    /**
     * @return the backing row-major array; callers must not modify it.
     */
    public float[] intensities() {
        return intensities;
    }

    public Optional<Path> artifact() {
        return Optional.ofNullable(artifact);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || artifact == null) {
            return;
        }
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            log.warn("Failed to delete decode artifact {}: {}", artifact, e.toString());
        }
    }
}
