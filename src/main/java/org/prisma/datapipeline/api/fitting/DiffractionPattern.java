package org.prisma.datapipeline.api.fitting;

import java.util.Arrays;

/**
 * One azimuthal slice: intensity against 2-theta, tagged with the frame and bin it came from.
 * <p>
 * Channels that received no pixels hold {@code NaN} intensity. Arrays are owned by the pattern
 * and must not be modified by callers.
 */
public final class DiffractionPattern {

    private final int frameIndex;
    private final int azimuthBin;
    private final double[] twoTheta;
    private final double[] intensity;

    /**
     * @param frameIndex global frame index.
     * @param azimuthBin azimuth bin index.
     * @param twoTheta   channel centres in degrees, ascending.
     * @param intensity  mean intensity per channel, {@code NaN} where empty.
     */
    public DiffractionPattern(int frameIndex, int azimuthBin, double[] twoTheta, double[] intensity) {
        if (twoTheta.length != intensity.length) {
            throw new IllegalArgumentException("twoTheta and intensity lengths differ: "
                + twoTheta.length + " vs " + intensity.length);
        }
        this.frameIndex = frameIndex;
        this.azimuthBin = azimuthBin;
        this.twoTheta = twoTheta;
        this.intensity = intensity;
    }

    public int frameIndex() {
        return frameIndex;
    }

    public int azimuthBin() {
        return azimuthBin;
    }

    public int size() {
        return twoTheta.length;
    }

    public double twoTheta(int channel) {
        return twoTheta[channel];
    }

    public double intensity(int channel) {
        return intensity[channel];
    }

    /**
     * Restricts the pattern to a fit window, dropping empty channels.
     *
     * @param window the window.
     * @return a new pattern holding only populated channels inside the window.
     */
    public DiffractionPattern restrictTo(FitWindow window) {
        double[] x = new double[twoTheta.length];
        double[] y = new double[twoTheta.length];
        int n = 0;
        for (int i = 0; i < twoTheta.length; i++) {
            if (window.contains(twoTheta[i]) && !Double.isNaN(intensity[i])) {
                x[n] = twoTheta[i];
                y[n] = intensity[i];
                n++;
            }
        }
        return new DiffractionPattern(frameIndex, azimuthBin, Arrays.copyOf(x, n), Arrays.copyOf(y, n));
    }
}
