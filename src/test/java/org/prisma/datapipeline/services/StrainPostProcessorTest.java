package org.prisma.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.api.results.MeasurementColumns;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class StrainPostProcessorTest {

    private static Dataset4D datasetWithD(int peaks, int frames, int azimuths, float d) {
        int[] numbers = new int[frames];
        for (int f = 0; f < frames; f++) {
            numbers[f] = f;
        }
        Dataset4D dataset = new Dataset4D(peaks, numbers, new double[azimuths], MeasurementColumns.BASE);
        int column = dataset.columnIndex(MeasurementColumns.D_SPACING);
        for (int p = 0; p < peaks; p++) {
            for (int f = 0; f < frames; f++) {
                for (int a = 0; a < azimuths; a++) {
                    dataset.set(p, f, a, column, d);
                    dataset.set(p, f, a, 0, 8.0f + f);
                }
            }
        }
        return dataset;
    }

    @Test
    @DisplayName("Without a reference both strain columns are NaN everywhere, never zero")
    void noReferenceLeavesStrainEmpty() {
        StrainPostProcessor processor = new StrainPostProcessor(ConfigFactory.empty());

        StrainPostProcessor.Result result = processor.apply(datasetWithD(2, 3, 4, 1.17f), null);

        Dataset4D dataset = result.dataset();
        assertThat(dataset.columns()).endsWith(MeasurementColumns.STRAIN, MeasurementColumns.ABS_STRAIN);
        for (float value : dataset.column(MeasurementColumns.STRAIN)) {
            assertThat(value).isNaN();
        }
        for (float value : dataset.column(MeasurementColumns.ABS_STRAIN)) {
            assertThat(value).isNaN();
        }
        assertThat(result.referenceValues()).isEmpty();
    }

    @Test
    @DisplayName("Strain is relative to the mean reference d of the same cell")
    void strainAgainstReference() {
        Dataset4D reference = datasetWithD(1, 2, 2, 2.0f);
        reference.set(0, 1, 1, reference.columnIndex(MeasurementColumns.D_SPACING), Float.NaN);
        Dataset4D dataset = datasetWithD(1, 1, 2, 2.02f);
        StrainPostProcessor processor = new StrainPostProcessor(ConfigFactory.empty());

        StrainPostProcessor.Result result = processor.apply(dataset, reference);

        Dataset4D strained = result.dataset();
        int strain = strained.columnIndex(MeasurementColumns.STRAIN);
        int absStrain = strained.columnIndex(MeasurementColumns.ABS_STRAIN);
        assertThat(strained.get(0, 0, 0, strain)).isCloseTo(0.01f, offset(1e-5f));
        assertThat(strained.get(0, 0, 1, strain)).isCloseTo(0.01f, offset(1e-5f));
        assertThat(strained.get(0, 0, 1, absStrain)).isEqualTo(Math.abs(strained.get(0, 0, 1, strain)));
        assertThat(result.referenceValues()).containsKey(MeasurementColumns.D_SPACING);
        assertThat(result.referenceValues().get(MeasurementColumns.D_SPACING)).isCloseTo(2.0,
            offset(1e-6));
    }

    @Test
    @DisplayName("A cell without reference data or with a zero reference has NaN strain")
    void undefinedStrain() {
        assertThat(StrainPostProcessor.strain(1.0f, Double.NaN)).isNaN();
        assertThat(StrainPostProcessor.strain(1.0f, 0.0)).isNaN();
        assertThat(StrainPostProcessor.strain(Float.NaN, 1.0)).isNaN();
        assertThat(StrainPostProcessor.strain(1.1f, 1.0)).isCloseTo(0.1f, offset(1e-6f));
    }

    @Test
    @DisplayName("Delta columns hold the difference to the previous frame")
    void deltaColumns() {
        StrainPostProcessor processor = new StrainPostProcessor(
            ConfigFactory.parseString("deltaColumns = [pos, unknown]"));
        assertThat(processor.derivedColumns()).containsExactly(MeasurementColumns.STRAIN,
            MeasurementColumns.ABS_STRAIN, "delta pos", "delta unknown");

        Dataset4D result = processor.apply(datasetWithD(1, 3, 1, 1.0f), null).dataset();

        int delta = result.columnIndex("delta pos");
        assertThat(result.get(0, 0, 0, delta)).isNaN();
        assertThat(result.get(0, 1, 0, delta)).isEqualTo(1.0f);
        assertThat(result.get(0, 2, 0, delta)).isEqualTo(1.0f);
        assertThat(result.hasColumn("delta unknown")).isFalse();
    }

    @Test
    @DisplayName("Existing strain columns are replaced, not duplicated")
    void rerunReplacesColumns() {
        StrainPostProcessor processor = new StrainPostProcessor(ConfigFactory.empty());
        Dataset4D once = processor.apply(datasetWithD(1, 2, 2, 1.0f), datasetWithD(1, 2, 2, 1.0f)).dataset();

        Dataset4D twice = processor.apply(once, null).dataset();

        assertThat(twice.columns()).isEqualTo(once.columns());
        assertThat(twice.columns()).hasSize(MeasurementColumns.BASE.size() + 2);
        assertThat(twice.get(0, 0, 0, twice.columnIndex(MeasurementColumns.STRAIN))).isNaN();
        assertThat(once.get(0, 0, 0, once.columnIndex(MeasurementColumns.STRAIN))).isEqualTo(0.0f);
    }

    @Test
    @DisplayName("A reference with different axes is rejected")
    void mismatchedReference() {
        StrainPostProcessor processor = new StrainPostProcessor(ConfigFactory.empty());

        assertThatThrownBy(() -> processor.apply(datasetWithD(1, 2, 2, 1.0f), datasetWithD(2, 2, 2, 1.0f)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
