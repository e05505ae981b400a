package org.prisma.datapipeline.resources.storage;

import java.io.IOException;

/**
 * A stored chunk could not be decompressed or has an unexpected size.
 */
public class ChunkCorruptedException extends IOException {

    public ChunkCorruptedException(String message) {
        super(message);
    }

    public ChunkCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
