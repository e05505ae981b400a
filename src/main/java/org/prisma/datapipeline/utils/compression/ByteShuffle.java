package org.prisma.datapipeline.utils.compression;

/**
 * Byte-shuffle filter for fixed-width numeric data.
 * <p>
 * Within each block, byte {@code k} of every element is gathered into lane {@code k}, so the
 * slowly varying high-order bytes of neighbouring floats end up next to each other, which
 * general-purpose compressors exploit. Block sizes are rounded down to a multiple of the
 * element size; a trailing partial element is copied unchanged.
 */
public final class ByteShuffle {

    private ByteShuffle() {
    }

    /**
     * @param data      input bytes.
     * @param typeSize  element size in bytes.
     * @param blockSize requested block size in bytes.
     * @return shuffled bytes of the same length.
     */
    public static byte[] shuffle(byte[] data, int typeSize, int blockSize) {
        return transform(data, typeSize, blockSize, true);
    }

    /**
     * Inverse of {@link #shuffle(byte[], int, int)} for the same type and block size.
     *
     * @param data      shuffled bytes.
     * @param typeSize  element size in bytes.
     * @param blockSize requested block size in bytes.
     * @return the original bytes.
     */
    public static byte[] unshuffle(byte[] data, int typeSize, int blockSize) {
        return transform(data, typeSize, blockSize, false);
    }

    /**
     * @param blockSize requested block size in bytes.
     * @param typeSize  element size in bytes.
     * @return the effective block size: a positive multiple of the element size.
     */
    public static int effectiveBlockSize(int blockSize, int typeSize) {
        return Math.max(typeSize, blockSize - blockSize % typeSize);
    }

    private static byte[] transform(byte[] data, int typeSize, int blockSize, boolean forward) {
        if (typeSize <= 1) {
            return data.clone();
        }
        int block = effectiveBlockSize(blockSize, typeSize);
        byte[] out = new byte[data.length];
        int offset = 0;
        while (offset < data.length) {
            int length = Math.min(block, data.length - offset);
            int elements = length / typeSize;
            for (int e = 0; e < elements; e++) {
                for (int b = 0; b < typeSize; b++) {
                    int plain = offset + e * typeSize + b;
                    int lane = offset + b * elements + e;
                    if (forward) {
                        out[lane] = data[plain];
                    } else {
                        out[plain] = data[lane];
                    }
                }
            }
            int tail = elements * typeSize;
            System.arraycopy(data, offset + tail, out, offset + tail, length - tail);
            offset += length;
        }
        return out;
    }
}
