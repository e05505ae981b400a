package org.prisma.datapipeline.services;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.api.results.MeasurementColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Derives strain from d-spacing against a reference dataset.
 * <p>
 * The reference d of every (peak, azimuth) cell is the mean of the reference's {@code d} over
 * all its frames, ignoring {@code NaN}. Strain is {@code (d - ref) / ref} where both are finite
 * and {@code ref != 0}, otherwise {@code NaN}. Without a reference both strain columns are
 * entirely {@code NaN}.
 * <p>
 * Optionally appends {@code delta <column>} columns holding the difference to the previous
 * frame position; the first position has no predecessor and holds {@code NaN}.
 */
public class StrainPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(StrainPostProcessor.class);

    private final List<String> deltaColumns;

    /**
     * @param options the {@code prisma.postprocessing} block; {@code deltaColumns} defaults to none.
     */
    public StrainPostProcessor(Config options) {
        this.deltaColumns = options.hasPath("deltaColumns") ? List.copyOf(options.getStringList("deltaColumns"))
            : List.of();
    }

    /**
     * Output of one post-processing pass.
     *
     * @param dataset         the dataset with strain (and delta) columns
     * @param referenceValues mean of every reference column; empty without a reference
     */
    public record Result(Dataset4D dataset, Map<String, Double> referenceValues) {}

    /**
     * @param dataset   the dataset holding a {@code d} column.
     * @param reference the reference dataset, or {@code null}.
     * @return the extended dataset; the input is not modified.
     * @throws IllegalArgumentException if the reference has a different peak or azimuth axis.
     */
    public Result apply(Dataset4D dataset, Dataset4D reference) {
        int peaks = dataset.peaks();
        int frames = dataset.frames();
        int azimuths = dataset.azimuths();
        float[] strain = new float[dataset.cellCount()];
        Arrays.fill(strain, Float.NaN);
        Map<String, Double> referenceValues = new LinkedHashMap<>();

        if (reference != null) {
            if (reference.peaks() != peaks || reference.azimuths() != azimuths) {
                throw new IllegalArgumentException("Reference has " + reference.peaks() + " peaks x "
                    + reference.azimuths() + " azimuths, dataset has " + peaks + " x " + azimuths);
            }
            double[] refD = referenceD(reference);
            float[] d = dataset.column(MeasurementColumns.D_SPACING);
            for (int p = 0; p < peaks; p++) {
                for (int f = 0; f < frames; f++) {
                    for (int a = 0; a < azimuths; a++) {
                        int cell = (p * frames + f) * azimuths + a;
                        strain[cell] = strain(d[cell], refD[p * azimuths + a]);
                    }
                }
            }
            for (String column : reference.columns()) {
                referenceValues.put(column, nanMean(reference.column(column)));
            }
        } else {
            log.info("No reference dataset, strain columns are left empty");
        }

        float[] absStrain = new float[strain.length];
        for (int i = 0; i < strain.length; i++) {
            absStrain[i] = Math.abs(strain[i]);
        }
        Dataset4D result = dataset.withMeasurement(MeasurementColumns.STRAIN, strain)
            .withMeasurement(MeasurementColumns.ABS_STRAIN, absStrain);

        for (String column : deltaColumns) {
            if (!result.hasColumn(column)) {
                log.warn("Cannot derive delta for unknown column '{}'", column);
                continue;
            }
            result = result.withMeasurement(MeasurementColumns.delta(column), delta(result, column));
        }
        return new Result(result, referenceValues);
    }

    /**
     * @return the columns this processor appends, in order.
     */
    public List<String> derivedColumns() {
        List<String> columns = new ArrayList<>(List.of(MeasurementColumns.STRAIN, MeasurementColumns.ABS_STRAIN));
        for (String column : deltaColumns) {
            columns.add(MeasurementColumns.delta(column));
        }
        return columns;
    }

    /**
     * @return mean reference d per (peak, azimuth), peak-major.
     */
    static double[] referenceD(Dataset4D reference) {
        int peaks = reference.peaks();
        int frames = reference.frames();
        int azimuths = reference.azimuths();
        float[] d = reference.column(MeasurementColumns.D_SPACING);
        double[] means = new double[peaks * azimuths];
        for (int p = 0; p < peaks; p++) {
            for (int a = 0; a < azimuths; a++) {
                double sum = 0;
                int n = 0;
                for (int f = 0; f < frames; f++) {
                    float v = d[(p * frames + f) * azimuths + a];
                    if (Float.isFinite(v)) {
                        sum += v;
                        n++;
                    }
                }
                means[p * azimuths + a] = n == 0 ? Double.NaN : sum / n;
            }
        }
        return means;
    }

    static float strain(float d, double reference) {
        if (!Float.isFinite(d) || !Double.isFinite(reference) || reference == 0.0) {
            return Float.NaN;
        }
        return (float) ((d - reference) / reference);
    }

    private static float[] delta(Dataset4D dataset, String column) {
        int frames = dataset.frames();
        int azimuths = dataset.azimuths();
        float[] values = dataset.column(column);
        float[] delta = new float[values.length];
        for (int p = 0; p < dataset.peaks(); p++) {
            for (int f = 0; f < frames; f++) {
                for (int a = 0; a < azimuths; a++) {
                    int cell = (p * frames + f) * azimuths + a;
                    delta[cell] = f == 0 ? Float.NaN : values[cell] - values[cell - azimuths];
                }
            }
        }
        return delta;
    }

    private static double nanMean(float[] values) {
        double sum = 0;
        int n = 0;
        for (float v : values) {
            if (Float.isFinite(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }
}
