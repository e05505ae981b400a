package org.prisma.datapipeline.resources.frames;

import java.awt.image.Raster;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.prisma.datapipeline.api.frames.DecodedFrame;
import org.prisma.datapipeline.api.frames.FrameDecodeException;
import org.prisma.datapipeline.api.frames.FrameDescriptor;
import org.prisma.datapipeline.api.frames.FrameFormat;
import org.prisma.datapipeline.api.frames.IFrameDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Decodes TIFF and GE detector frames.
 * <p>
 * Single-frame TIFFs are read in place. Frames packed into a container (a page of a
 * multi-page TIFF, a frame of a GE file) are first extracted into a temporary raw file,
 * {@code prisma-frame-<index>-*.raw}, holding little-endian float32 intensities. The returned
 * {@link DecodedFrame} owns that file and deletes it on close. If decoding fails for any reason,
 * errors included, the file is deleted before the throwable leaves this class.
 * <p>
 * <b>Thread safety:</b> stateless after construction; each call uses its own readers and channels.
 */
public class ImageFrameDecoder implements IFrameDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageFrameDecoder.class);

    private final GeGeometry geGeometry;
    private final Path tempDirectory;

    /**
     * @param options the {@code prisma.frames} configuration block.
     */
    public ImageFrameDecoder(Config options) {
        this.geGeometry = GeGeometry.fromConfig(options);
        String temp = options.hasPath("tempDirectory") ? options.getString("tempDirectory") : "";
        this.tempDirectory = temp.isBlank() ? Paths.get(System.getProperty("java.io.tmpdir")) : Paths.get(temp);
    }

    @Override
    public DecodedFrame decode(FrameDescriptor frame) throws FrameDecodeException {
        Path source = frame.sourcePath();
        if (!Files.isReadable(source)) {
            throw new FrameDecodeException("Frame source not readable: " + source);
        }
        return switch (frame.format()) {
            case TIFF -> decodeTiff(frame);
            case TIFF_STACK, GE_RAW -> decodeContainerFrame(frame);
        };
    }

    // ===== single-frame TIFF =====

    private DecodedFrame decodeTiff(FrameDescriptor frame) throws FrameDecodeException {
        try {
            Raster raster = readTiffPage(frame.sourcePath(), 0);
            return new DecodedFrame(frame, raster.getWidth(), raster.getHeight(), toFloats(raster), null);
        } catch (IOException | RuntimeException e) {
            throw new FrameDecodeException("Cannot decode " + frame + ": " + e.getMessage(), e);
        }
    }

    // ===== container frames =====

    private DecodedFrame decodeContainerFrame(FrameDescriptor frame) throws FrameDecodeException {
        Path artifact;
        try {
            artifact = Files.createTempFile(tempDirectory, "prisma-frame-" + frame.globalIndex() + "-", ".raw");
        } catch (IOException e) {
            throw new FrameDecodeException("Cannot create decode buffer for " + frame + ": " + e.getMessage(), e);
        }
        boolean handedOff = false;
        try {
            int width;
            int height;
            if (frame.format() == FrameFormat.TIFF_STACK) {
                Raster raster = readTiffPage(frame.sourcePath(), frame.offset());
                width = raster.getWidth();
                height = raster.getHeight();
                writeFloats(artifact, toFloats(raster));
            } else {
                width = geGeometry.columns();
                height = geGeometry.rows();
                extractGeFrame(frame, artifact);
            }
            float[] intensities = readFloats(artifact, width * height);
            DecodedFrame decoded = new DecodedFrame(frame, width, height, intensities, artifact);
            handedOff = true;
            return decoded;
        } catch (IOException | RuntimeException e) {
            throw new FrameDecodeException("Cannot decode " + frame + ": " + e.getMessage(), e);
        } finally {
            // errors such as OutOfMemoryError pass through here too
            if (!handedOff) {
                deleteQuietly(artifact);
            }
        }
    }

    private void extractGeFrame(FrameDescriptor frame, Path artifact) throws IOException {
        long frameBytes = geGeometry.frameBytes();
        long offset = geGeometry.frameOffset(frame.offset());
        ByteBuffer raw = ByteBuffer.allocate(Math.toIntExact(frameBytes)).order(ByteOrder.LITTLE_ENDIAN);
        try (FileChannel in = FileChannel.open(frame.sourcePath(), StandardOpenOption.READ)) {
            if (in.size() < offset + frameBytes) {
                throw new IOException("GE file truncated before frame " + frame.offset());
            }
            while (raw.hasRemaining()) {
                if (in.read(raw, offset + raw.position()) < 0) {
                    throw new IOException("Unexpected end of GE file");
                }
            }
        }
        raw.flip();
        float[] intensities = new float[geGeometry.rows() * geGeometry.columns()];
        for (int i = 0; i < intensities.length; i++) {
            intensities[i] = Short.toUnsignedInt(raw.getShort());
        }
        writeFloats(artifact, intensities);
    }

    // ===== helpers =====

    private static Raster readTiffPage(Path file, int page) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                throw new IOException("Cannot open " + file);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new IOException("No image reader for " + file.getFileName());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, false, true);
                return reader.canReadRaster() ? reader.readRaster(page, null) : reader.read(page).getRaster();
            } finally {
                reader.dispose();
            }
        }
    }

    private static float[] toFloats(Raster raster) {
        return raster.getSamples(raster.getMinX(), raster.getMinY(), raster.getWidth(), raster.getHeight(), 0,
            (float[]) null);
    }

    private static void writeFloats(Path target, float[] values) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(values);
        Files.write(target, buffer.array());
    }

    private static float[] readFloats(Path source, int count) throws IOException {
        float[] values = new float[count];
        try (InputStream in = Files.newInputStream(source)) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length != count * Float.BYTES) {
                throw new IOException("Decode buffer holds " + bytes.length + " bytes, expected " + count * Float.BYTES);
            }
            ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(values);
        }
        return values;
    }

    private static void deleteQuietly(Path artifact) {
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            log.warn("Failed to delete decode buffer {}: {}", artifact, e.getMessage());
        }
    }
}
