package org.prisma.datapipeline.api.frames;

/**
 * Thrown when a frame's image data cannot be read or decoded.
 * <p>
 * This is a frame-level infrastructure error: the frame worker reports it as a failed frame,
 * which the pipeline may retry.
 */
public class FrameDecodeException extends Exception {

    public FrameDecodeException(String message) {
        super(message);
    }

    public FrameDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
