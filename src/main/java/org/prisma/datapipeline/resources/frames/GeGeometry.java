package org.prisma.datapipeline.resources.frames;

import com.typesafe.config.Config;

/**
 * Layout of GE detector files: a fixed header followed by {@code rows * columns} little-endian
 * unsigned 16-bit pixels per frame.
 *
 * @param headerBytes bytes before the first frame
 * @param rows        rows per frame
 * @param columns     columns per frame
 */
record GeGeometry(int headerBytes, int rows, int columns) {

    static GeGeometry fromConfig(Config options) {
        int header = options.hasPath("ge.headerBytes") ? options.getInt("ge.headerBytes") : 8192;
        int rows = options.hasPath("ge.rows") ? options.getInt("ge.rows") : 2048;
        int columns = options.hasPath("ge.columns") ? options.getInt("ge.columns") : 2048;
        return new GeGeometry(header, rows, columns);
    }

    long frameBytes() {
        return (long) rows * columns * 2;
    }

    long frameOffset(int frame) {
        return headerBytes + frame * frameBytes();
    }

    int frameCount(long fileSize) {
        if (fileSize <= headerBytes) {
            return 0;
        }
        return (int) ((fileSize - headerBytes) / frameBytes());
    }
}
