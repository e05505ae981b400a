package org.prisma.datapipeline.resources.storage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.utils.compression.ByteShuffle;
import org.prisma.datapipeline.utils.compression.ICompressionCodec;

/**
 * Converts between dataset regions and stored bytes.
 * <p>
 * Stored form: little-endian values, byte-shuffled with the element size as type size, then
 * compressed with the dataset codec.
 */
final class ChunkSerializer {

    private final ICompressionCodec codec;
    private final int blockBytes;

    ChunkSerializer(ICompressionCodec codec, int blockBytes) {
        this.codec = codec;
        this.blockBytes = blockBytes;
    }

    ICompressionCodec codec() {
        return codec;
    }

    int blockBytes() {
        return blockBytes;
    }

    /**
     * Copies one chunk out of the dataset as little-endian float32 in
     * (peak, frame, azimuth, measurement) C-order.
     */
    static byte[] extract(Dataset4D dataset, ChunkLayout layout, int frameChunk, int azimuthChunk) {
        int f0 = layout.frameStart(frameChunk);
        int f1 = layout.frameEnd(frameChunk);
        int a0 = layout.azimuthStart(azimuthChunk);
        int a1 = layout.azimuthEnd(azimuthChunk);
        int run = (a1 - a0) * dataset.measurements();
        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(layout.chunkBytes(frameChunk, azimuthChunk)))
            .order(ByteOrder.LITTLE_ENDIAN);
        float[] data = dataset.data();
        for (int p = 0; p < dataset.peaks(); p++) {
            for (int f = f0; f < f1; f++) {
                int offset = dataset.index(p, f, a0, 0);
                for (int i = 0; i < run; i++) {
                    buffer.putFloat(data[offset + i]);
                }
            }
        }
        return buffer.array();
    }

    /**
     * Inverse of {@link #extract(Dataset4D, ChunkLayout, int, int)}.
     */
    static void insert(Dataset4D dataset, ChunkLayout layout, int frameChunk, int azimuthChunk, byte[] raw) {
        int f0 = layout.frameStart(frameChunk);
        int f1 = layout.frameEnd(frameChunk);
        int a0 = layout.azimuthStart(azimuthChunk);
        int a1 = layout.azimuthEnd(azimuthChunk);
        int run = (a1 - a0) * dataset.measurements();
        ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        float[] data = dataset.data();
        for (int p = 0; p < dataset.peaks(); p++) {
            for (int f = f0; f < f1; f++) {
                int offset = dataset.index(p, f, a0, 0);
                for (int i = 0; i < run; i++) {
                    data[offset + i] = buffer.getFloat();
                }
            }
        }
    }

    static byte[] toBytes(int[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int v : values) {
            buffer.putInt(v);
        }
        return buffer.array();
    }

    static byte[] toBytes(double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : values) {
            buffer.putDouble(v);
        }
        return buffer.array();
    }

    static int[] toInts(byte[] raw) {
        ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        int[] values = new int[raw.length / Integer.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getInt();
        }
        return values;
    }

    static double[] toDoubles(byte[] raw) {
        ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        double[] values = new double[raw.length / Double.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getDouble();
        }
        return values;
    }

    /**
     * Shuffles and compresses raw bytes.
     */
    byte[] encode(byte[] raw, int typeSize) throws IOException {
        byte[] shuffled = ByteShuffle.shuffle(raw, typeSize, blockBytes);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
        try (OutputStream out = codec.wrapOutputStream(bytes)) {
            out.write(shuffled);
        }
        return bytes.toByteArray();
    }

    /**
     * Decompresses and unshuffles stored bytes.
     *
     * @param stored        bytes as read from disk.
     * @param typeSize      element size used when encoding.
     * @param expectedBytes exact raw size, or -1 if unknown.
     * @param name          chunk name for error messages.
     * @throws ChunkCorruptedException if the bytes cannot be decoded or have the wrong size.
     */
    byte[] decode(byte[] stored, int typeSize, long expectedBytes, String name) throws ChunkCorruptedException {
        byte[] shuffled;
        try (InputStream in = codec.wrapInputStream(new ByteArrayInputStream(stored))) {
            shuffled = in.readAllBytes();
        } catch (IOException | RuntimeException e) {
            throw new ChunkCorruptedException("Cannot decompress " + name + ": " + e.getMessage(), e);
        }
        if (expectedBytes >= 0 && shuffled.length != expectedBytes) {
            throw new ChunkCorruptedException(name + " holds " + shuffled.length + " bytes, expected " + expectedBytes);
        }
        return ByteShuffle.unshuffle(shuffled, typeSize, blockBytes);
    }

    static String sha256(byte[] raw) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(raw));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
