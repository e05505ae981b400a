package org.prisma.datapipeline.api.job;

/**
 * Azimuthal range and bin width in degrees.
 * <p>
 * The spacing always divides the span into a whole number of bins; this is checked when the
 * job specification is loaded.
 *
 * @param start   first azimuth in degrees
 * @param end     last azimuth in degrees (exclusive bin edge)
 * @param spacing bin width in degrees
 */
public record AzimuthalBinning(double start, double end, double spacing) {

    private static final double TOLERANCE = 1e-6;

    public double span() {
        return end - start;
    }

    public int binCount() {
        return (int) Math.round(span() / spacing);
    }

    /**
     * @return true if the spacing divides the span into a whole number of bins.
     */
    public boolean isWholeNumberOfBins() {
        double bins = span() / spacing;
        return Math.abs(bins - Math.rint(bins)) < TOLERANCE && Math.rint(bins) >= 1;
    }

    /**
     * @param bin bin index.
     * @return the centre of the given bin in degrees.
     */
    public double binCenter(int bin) {
        return start + (bin + 0.5) * spacing;
    }

    /**
     * @return the centres of all bins, in bin order.
     */
    public double[] binCenters() {
        double[] centers = new double[binCount()];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = binCenter(i);
        }
        return centers;
    }
}
