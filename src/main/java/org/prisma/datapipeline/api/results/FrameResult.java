package org.prisma.datapipeline.api.results;

import java.util.BitSet;

/**
 * Measurements of one frame, laid out azimuth-major: {@code [azimuth][peak][measurement]}.
 * <p>
 * A cell whose fit failed holds {@code NaN} in every measurement and a cleared bit in
 * {@link #fitted()}.
 */
public final class FrameResult {

    private final int azimuths;
    private final int peaks;
    private final int measurements;
    private final float[] values;
    private final BitSet fitted;

    /**
     * @param azimuths     number of azimuth bins.
     * @param peaks        number of peaks.
     * @param measurements number of measurement columns.
     * @param values       azimuth-major values, {@code azimuths * peaks * measurements} long.
     * @param fitted       one bit per {@code azimuth * peaks + peak} cell, set when the fit succeeded.
     */
    public FrameResult(int azimuths, int peaks, int measurements, float[] values, BitSet fitted) {
        if (values.length != azimuths * peaks * measurements) {
            throw new IllegalArgumentException("Block size " + values.length + " does not match "
                + azimuths + "x" + peaks + "x" + measurements);
        }
        this.azimuths = azimuths;
        this.peaks = peaks;
        this.measurements = measurements;
        this.values = values;
        this.fitted = fitted;
    }

    public int azimuths() {
        return azimuths;
    }

    public int peaks() {
        return peaks;
    }

    public int measurements() {
        return measurements;
    }

    public float value(int azimuth, int peak, int measurement) {
        return values[(azimuth * peaks + peak) * measurements + measurement];
    }

    public boolean isFitted(int azimuth, int peak) {
        return fitted.get(azimuth * peaks + peak);
    }

    public int failedCells() {
        return azimuths * peaks - fitted.cardinality();
    }

    /**
     * @return the backing azimuth-major array; callers must not modify it.
     */
    public float[] values() {
        return values;
    }

    /**
     * @return a copy of the per-cell success bitmap.
     */
    public BitSet fitted() {
        return (BitSet) fitted.clone();
    }
}
