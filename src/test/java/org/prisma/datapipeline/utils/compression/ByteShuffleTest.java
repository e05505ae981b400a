package org.prisma.datapipeline.utils.compression;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ByteShuffleTest {

    @Test
    void groupsBytesIntoLanes() {
        byte[] data = {1, 2, 3, 4, 5, 6, 7, 8};

        byte[] shuffled = ByteShuffle.shuffle(data, 4, 8);

        assertThat(shuffled).containsExactly(1, 5, 2, 6, 3, 7, 4, 8);
        assertThat(ByteShuffle.unshuffle(shuffled, 4, 8)).containsExactly(data);
    }

    @Test
    void partialBlocksAndTrailingBytesAreRestored() {
        byte[] data = new byte[4 * 10 + 3];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i * 31);
        }

        byte[] shuffled = ByteShuffle.shuffle(data, 4, 18);

        assertThat(shuffled).hasSameSizeAs(data);
        assertThat(shuffled).endsWith(data[40], data[41], data[42]);
        assertThat(ByteShuffle.unshuffle(shuffled, 4, 18)).containsExactly(data);
    }

    @Test
    void blockSizeIsRoundedToWholeElements() {
        assertThat(ByteShuffle.effectiveBlockSize(18, 4)).isEqualTo(16);
        assertThat(ByteShuffle.effectiveBlockSize(2, 4)).isEqualTo(4);
    }
}
