package org.prisma.datapipeline.resources.frames;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prisma.datapipeline.api.frames.FrameDescriptor;
import org.prisma.datapipeline.api.frames.FrameFormat;
import org.prisma.datapipeline.api.job.FrameRange;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class DirectoryFrameEnumeratorTest {

    // 16-byte header, 2x3 pixels of 2 bytes
    private static final int HEADER = 16;
    private static final int FRAME_BYTES = 12;

    @TempDir
    Path images;

    private DirectoryFrameEnumerator enumerator;

    @BeforeEach
    void setUp() throws IOException {
        enumerator = new DirectoryFrameEnumerator(ConfigFactory.parseMap(Map.of(
            "ge.headerBytes", HEADER, "ge.rows", 2, "ge.columns", 3)));
        writeGe("a.ge2", 3);
        writeGe("b.ge2", 2);
        ImageIO.write(new BufferedImage(3, 2, BufferedImage.TYPE_USHORT_GRAY), "tiff", images.resolve("c.tif").toFile());
        Files.writeString(images.resolve("notes.txt"), "not a frame");
    }

    @Test
    void indicesCountAcrossFilesInNameOrder() throws IOException {
        List<FrameDescriptor> frames = enumerator.enumerate(images, new FrameRange(0, FrameRange.ALL, 1));

        assertThat(frames)
            .extracting(FrameDescriptor::globalIndex, f -> f.sourcePath().getFileName().toString(),
                FrameDescriptor::offset, FrameDescriptor::format)
            .containsExactly(
                tuple(0, "a.ge2", 0, FrameFormat.GE_RAW),
                tuple(1, "a.ge2", 1, FrameFormat.GE_RAW),
                tuple(2, "a.ge2", 2, FrameFormat.GE_RAW),
                tuple(3, "b.ge2", 0, FrameFormat.GE_RAW),
                tuple(4, "b.ge2", 1, FrameFormat.GE_RAW),
                tuple(5, "c.tif", 0, FrameFormat.TIFF));
        assertThat(frames).allMatch(f -> f.timestampMillis() == null);
    }

    @Test
    void stepIsAppliedToGlobalIndices() throws IOException {
        List<FrameDescriptor> frames = enumerator.enumerate(images, new FrameRange(1, FrameRange.ALL, 2));

        assertThat(frames).extracting(FrameDescriptor::globalIndex).containsExactly(1, 3, 5);
    }

    @Test
    void endIsExclusive() throws IOException {
        List<FrameDescriptor> frames = enumerator.enumerate(images, new FrameRange(2, 4, 1));

        assertThat(frames).extracting(FrameDescriptor::globalIndex).containsExactly(2, 3);
    }

    @Test
    void truncatedGeFrameIsNotCounted() throws IOException {
        Files.write(images.resolve("a.ge2"), new byte[HEADER + 3 * FRAME_BYTES - 1]);

        List<FrameDescriptor> frames = enumerator.enumerate(images, new FrameRange(0, FrameRange.ALL, 1));

        assertThat(frames).hasSize(5);
        assertThat(frames.get(2).sourcePath().getFileName().toString()).isEqualTo("b.ge2");
    }

    @Test
    void missingDirectoryIsAnError() {
        assertThatThrownBy(() -> enumerator.enumerate(images.resolve("absent"), new FrameRange(0, FrameRange.ALL, 1)))
            .isInstanceOf(IOException.class);
    }

    private void writeGe(String name, int frames) throws IOException {
        Files.write(images.resolve(name), new byte[HEADER + frames * FRAME_BYTES]);
    }
}
