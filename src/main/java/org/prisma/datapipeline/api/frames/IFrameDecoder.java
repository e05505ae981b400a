package org.prisma.datapipeline.api.frames;

/**
 * Turns a frame descriptor into a 2D intensity array.
 * <p>
 * Implementations must be safe for concurrent use by multiple frame workers.
 */
public interface IFrameDecoder {

    /**
     * Decodes one frame. The caller owns the returned frame and must close it, which releases
     * any temporary artifact created while decoding.
     *
     * @param frame the frame to decode.
     * @return the decoded frame.
     * @throws FrameDecodeException if the frame cannot be read or decoded.
     */
    DecodedFrame decode(FrameDescriptor frame) throws FrameDecodeException;
}
