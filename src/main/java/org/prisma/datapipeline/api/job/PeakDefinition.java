package org.prisma.datapipeline.api.job;

/**
 * One crystallographic peak to be fitted in every azimuthal slice.
 *
 * @param name         human-readable label (e.g. "Martensite 110")
 * @param millerIndex  Miller index, written as a single integer (110, 200, ...)
 * @param position     nominal 2-theta position in degrees
 * @param lowerLimit   lower edge of the fit window in degrees
 * @param upperLimit   upper edge of the fit window in degrees
 */
public record PeakDefinition(String name, int millerIndex, double position, double lowerLimit, double upperLimit) {

    /**
     * @return the width of the fit window in degrees.
     */
    public double windowWidth() {
        return upperLimit - lowerLimit;
    }

    /**
     * @param twoTheta a 2-theta value in degrees.
     * @return true if the value lies inside the fit window (inclusive).
     */
    public boolean windowContains(double twoTheta) {
        return twoTheta >= lowerLimit && twoTheta <= upperLimit;
    }
}
