package org.prisma.datapipeline.resources.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ChunkLayoutTest {

    private static final long ONE_MIB = 1L << 20;

    @Test
    void chunksStayBelowTarget() {
        ChunkLayout layout = ChunkLayout.plan(8, 1000, 72, 7, ONE_MIB);

        assertThat(layout.azimuthChunk()).isEqualTo(72);
        assertThat(layout.chunkBytes(0, 0)).isLessThanOrEqualTo(ONE_MIB);
        assertThat(layout.frameChunk()).isEqualTo((int) (ONE_MIB / (8L * 72 * 7 * 4)));
    }

    @Test
    void lastChunkIsTrimmed() {
        ChunkLayout layout = new ChunkLayout(2, 10, 4, 5, 4, 4);

        assertThat(layout.frameChunkCount()).isEqualTo(3);
        assertThat(layout.frameEnd(2)).isEqualTo(10);
        assertThat(layout.chunkBytes(2, 0)).isEqualTo(2L * 2 * 4 * 5 * 4);
        assertThat(layout.frameChunkOf(9)).isEqualTo(2);
        assertThat(ChunkLayout.chunkKey(2, 0)).isEqualTo("c.2.0");
    }

    @Test
    void wideRowsSplitTheAzimuthAxis() {
        ChunkLayout layout = ChunkLayout.plan(10, 50, 1000, 7, 10 * 7 * 4 * 100);

        assertThat(layout.frameChunk()).isEqualTo(1);
        assertThat(layout.azimuthChunk()).isEqualTo(100);
        assertThat(layout.azimuthChunkCount()).isEqualTo(10);
        assertThat(layout.chunkCount()).isEqualTo(500);
    }

    @Test
    void gridDoesNotDependOnFrameCount() {
        ChunkLayout small = ChunkLayout.plan(3, 10, 36, 7, 64 * 1024);
        ChunkLayout large = ChunkLayout.plan(3, 5000, 36, 7, 64 * 1024);

        assertThat(small.sameGrid(large)).isTrue();
        assertThat(small.sameGrid(ChunkLayout.plan(3, 10, 36, 8, 64 * 1024))).isFalse();
    }

    @Test
    void emptyFrameAxisHasNoChunks() {
        assertThat(ChunkLayout.plan(1, 0, 4, 5, 1024).chunkCount()).isZero();
    }

    @Test
    void rejectsNonPositiveTarget() {
        assertThatThrownBy(() -> ChunkLayout.plan(1, 1, 1, 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
