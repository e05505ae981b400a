package org.prisma.datapipeline.api.fitting;

/**
 * Fitted parameters of one peak in one azimuthal slice.
 *
 * @param position fitted 2-theta centre in degrees
 * @param area     integrated net intensity
 * @param sigma    Gaussian width in degrees
 * @param gamma    Lorentzian width in degrees
 */
public record PeakFit(double position, double area, double sigma, double gamma) {

    public boolean isFinite() {
        return Double.isFinite(position) && Double.isFinite(area) && Double.isFinite(sigma) && Double.isFinite(gamma);
    }
}
