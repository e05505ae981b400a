package org.prisma.datapipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Compression codec applied to every persisted chunk and side array.
 * <p>
 * Implementations must be deterministic: the same input and settings always yield the same
 * bytes, because chunk files are compared across runs.
 */
public interface ICompressionCodec {

    /**
     * @return the codec name recorded in dataset metadata (e.g. "zstd", "none").
     */
    String getName();

    /**
     * @return the compression level, 0 for codecs without levels.
     */
    int getLevel();

    /**
     * @return the file extension including the dot (e.g. ".zst"), or "" for no compression.
     */
    String getFileExtension();

    /**
     * @param out the stream receiving compressed bytes; closed when the returned stream is closed.
     * @return a stream accepting uncompressed bytes.
     * @throws IOException if the codec cannot be initialized.
     */
    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    /**
     * @param in the stream providing compressed bytes; closed when the returned stream is closed.
     * @return a stream yielding uncompressed bytes.
     * @throws IOException if the codec cannot be initialized.
     */
    InputStream wrapInputStream(InputStream in) throws IOException;
}
