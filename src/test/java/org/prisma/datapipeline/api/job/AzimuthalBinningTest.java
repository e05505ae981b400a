package org.prisma.datapipeline.api.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class AzimuthalBinningTest {

    @Test
    void binCentresLieHalfABinInside() {
        AzimuthalBinning binning = new AzimuthalBinning(-90, 90, 5);

        assertThat(binning.binCount()).isEqualTo(36);
        assertThat(binning.binCenters()[0]).isCloseTo(-87.5, within(1e-9));
        assertThat(binning.binCenters()[35]).isCloseTo(87.5, within(1e-9));
    }

    @Test
    void detectsFractionalBins() {
        assertThat(new AzimuthalBinning(0, 360, 5).isWholeNumberOfBins()).isTrue();
        assertThat(new AzimuthalBinning(0, 360, 7).isWholeNumberOfBins()).isFalse();
        assertThat(new AzimuthalBinning(0, 2, 5).isWholeNumberOfBins()).isFalse();
    }
}
