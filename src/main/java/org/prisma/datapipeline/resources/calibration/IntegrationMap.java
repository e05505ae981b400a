package org.prisma.datapipeline.resources.calibration;

import org.prisma.datapipeline.api.fitting.DiffractionPattern;
import org.prisma.datapipeline.api.frames.DecodedFrame;
import org.prisma.datapipeline.api.job.AzimuthalBinning;

/**
 * Precomputed assignment of every detector pixel to an (azimuth bin, 2-theta channel) slot.
 * <p>
 * The map depends only on calibration, pixel mask and image shape, so one instance serves every
 * frame of a run. Intensity thresholds depend on the frame and are applied during
 * {@link #integrate(DecodedFrame, DetectorMask)}.
 * <p>
 * <b>Thread safety:</b> immutable after construction; {@code integrate} allocates per call.
 */
public final class IntegrationMap {

    private static final int UNASSIGNED = -1;

    private final int width;
    private final int height;
    private final int bins;
    private final int channels;
    private final int[] slotOfPixel;
    private final double[] channelCenters;

    private IntegrationMap(int width, int height, int bins, int channels, int[] slotOfPixel, double[] channelCenters) {
        this.width = width;
        this.height = height;
        this.bins = bins;
        this.channels = channels;
        this.slotOfPixel = slotOfPixel;
        this.channelCenters = channelCenters;
    }

    /**
     * @param calibration detector geometry.
     * @param mask        mask whose pixel part is baked into the map.
     * @param width       image width.
     * @param height      image height.
     * @param binning     azimuthal binning.
     * @param lower       lowest 2-theta in degrees.
     * @param upper       highest 2-theta in degrees.
     * @param channels    number of 2-theta channels.
     * @return the map.
     */
    public static IntegrationMap build(Calibration calibration, DetectorMask mask, int width, int height,
                                       AzimuthalBinning binning, double lower, double upper, int channels) {
        if (channels < 1 || !(upper > lower)) {
            throw new IllegalArgumentException("Invalid 2-theta range [" + lower + ", " + upper + "] with "
                + channels + " channels");
        }
        mask.checkShape(width, height);
        int bins = binning.binCount();
        double channelWidth = (upper - lower) / channels;
        int[] slots = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                slots[y * width + x] = mask.isPixelMasked(x, y)
                    ? UNASSIGNED
                    : slotOf(calibration, binning, bins, lower, channelWidth, channels, x, y);
            }
        }
        double[] centers = new double[channels];
        for (int c = 0; c < channels; c++) {
            centers[c] = lower + (c + 0.5) * channelWidth;
        }
        return new IntegrationMap(width, height, bins, channels, slots, centers);
    }

    private static int slotOf(Calibration calibration, AzimuthalBinning binning, int bins, double lower,
                              double channelWidth, int channels, int x, int y) {
        double twoTheta = calibration.twoTheta(x, y);
        int channel = (int) Math.floor((twoTheta - lower) / channelWidth);
        if (channel < 0 || channel >= channels) {
            return UNASSIGNED;
        }
        double relative = calibration.azimuth(x, y) - binning.start();
        relative = ((relative % 360.0) + 360.0) % 360.0;
        int bin = (int) Math.floor(relative / binning.spacing());
        if (bin < 0 || bin >= bins) {
            return UNASSIGNED;
        }
        return bin * channels + channel;
    }

    /**
     * Averages pixel intensities per slot.
     *
     * @param frame the decoded frame; must match the map's shape.
     * @param mask  the mask whose thresholds are applied.
     * @return one pattern per azimuth bin, in bin order.
     */
    public DiffractionPattern[] integrate(DecodedFrame frame, DetectorMask mask) {
        if (frame.width() != width || frame.height() != height) {
            throw new IllegalArgumentException("Frame is " + frame.width() + "x" + frame.height()
                + " but integration map is " + width + "x" + height);
        }
        double[] sums = new double[bins * channels];
        int[] counts = new int[bins * channels];
        float[] pixels = frame.intensities();
        for (int i = 0; i < pixels.length; i++) {
            int slot = slotOfPixel[i];
            float value = pixels[i];
            if (slot == UNASSIGNED || Float.isNaN(value) || mask.isOutsideThresholds(value)) {
                continue;
            }
            sums[slot] += value;
            counts[slot]++;
        }
        int frameIndex = frame.descriptor().globalIndex();
        DiffractionPattern[] patterns = new DiffractionPattern[bins];
        for (int b = 0; b < bins; b++) {
            double[] intensity = new double[channels];
            for (int c = 0; c < channels; c++) {
                int slot = b * channels + c;
                intensity[c] = counts[slot] == 0 ? Double.NaN : sums[slot] / counts[slot];
            }
            patterns[b] = new DiffractionPattern(frameIndex, b, channelCenters.clone(), intensity);
        }
        return patterns;
    }

    public int bins() {
        return bins;
    }

    public int channels() {
        return channels;
    }

    /**
     * @param bin azimuth bin.
     * @return how many pixels feed the bin.
     */
    public int pixelsInBin(int bin) {
        int count = 0;
        for (int slot : slotOfPixel) {
            if (slot != UNASSIGNED && slot / channels == bin) {
                count++;
            }
        }
        return count;
    }
}
