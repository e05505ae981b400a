package org.prisma.datapipeline.utils.compression;

/**
 * Thrown when a codec is misconfigured or unknown.
 */
public class CompressionException extends RuntimeException {

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
