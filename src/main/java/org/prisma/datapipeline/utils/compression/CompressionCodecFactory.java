package org.prisma.datapipeline.utils.compression;

import java.util.Locale;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Creates codecs from configuration and recognises them from stored names.
 */
public final class CompressionCodecFactory {

    private CompressionCodecFactory() {
    }

    /**
     * @param options the {@code compression} block ({@code codec}, {@code level}); may be empty.
     * @return the configured codec, zstd when none is named.
     * @throws CompressionException if the codec name is unknown or its settings are invalid.
     */
    public static ICompressionCodec create(Config options) {
        Config effective = options == null ? ConfigFactory.empty() : options;
        String name = effective.hasPath("codec") ? effective.getString("codec") : ZstdCodec.NAME;
        return create(name, effective);
    }

    /**
     * Recreates the codec a dataset was written with.
     *
     * @param name  codec name from dataset metadata.
     * @param level level from dataset metadata.
     * @return the codec.
     */
    public static ICompressionCodec forStored(String name, int level) {
        return create(name, ConfigFactory.parseString("level = " + level));
    }

    private static ICompressionCodec create(String name, Config options) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case ZstdCodec.NAME -> new ZstdCodec(options);
            case NoneCodec.NAME -> new NoneCodec();
            default -> throw new CompressionException("Unknown compression codec '" + name + "'");
        };
    }
}
