package org.prisma.datapipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import com.typesafe.config.Config;

/**
 * Zstandard compression via zstd-jni.
 */
public class ZstdCodec implements ICompressionCodec {

    public static final String NAME = "zstd";
    private static final int DEFAULT_LEVEL = 3;

    private final int level;

    /**
     * @param options the compression block; {@code level} defaults to 3.
     * @throws CompressionException if the level is outside the range zstd supports.
     */
    public ZstdCodec(Config options) {
        this.level = options.hasPath("level") ? options.getInt("level") : DEFAULT_LEVEL;
        if (level < Zstd.minCompressionLevel() || level > Zstd.maxCompressionLevel()) {
            throw new CompressionException("zstd level " + level + " outside [" + Zstd.minCompressionLevel() + ", "
                + Zstd.maxCompressionLevel() + "]");
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getLevel() {
        return level;
    }

    @Override
    public String getFileExtension() {
        return ".zst";
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }
}
