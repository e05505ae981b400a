package org.prisma.datapipeline.api.fitting;

import org.prisma.datapipeline.api.job.PeakDefinition;

/**
 * Closed 2-theta interval a peak is fitted in.
 *
 * @param lower lower edge in degrees
 * @param upper upper edge in degrees
 */
public record FitWindow(double lower, double upper) {

    public static FitWindow of(PeakDefinition peak) {
        return new FitWindow(peak.lowerLimit(), peak.upperLimit());
    }

    public boolean contains(double twoTheta) {
        return twoTheta >= lower && twoTheta <= upper;
    }
}
