package org.prisma.datapipeline.resources.calibration;

/**
 * Detector geometry from a calibration control file.
 *
 * @param centerX         beam centre x in millimetres from the detector origin
 * @param centerY         beam centre y in millimetres from the detector origin
 * @param distance        sample-to-detector distance in millimetres
 * @param wavelength      X-ray wavelength in Angstrom
 * @param pixelSizeX      pixel pitch along x in micrometres
 * @param pixelSizeY      pixel pitch along y in micrometres
 * @param azimuthOffset   degrees added to every computed azimuth
 */
public record Calibration(double centerX, double centerY, double distance, double wavelength,
                          double pixelSizeX, double pixelSizeY, double azimuthOffset) {

    /**
     * @param x pixel column.
     * @param y pixel row.
     * @return 2-theta of the pixel centre in degrees.
     */
    public double twoTheta(int x, int y) {
        double dx = (x + 0.5) * pixelSizeX / 1000.0 - centerX;
        double dy = (y + 0.5) * pixelSizeY / 1000.0 - centerY;
        return Math.toDegrees(Math.atan2(Math.hypot(dx, dy), distance));
    }

    /**
     * @param x pixel column.
     * @param y pixel row.
     * @return azimuth of the pixel centre in degrees, in (-180, 180] plus the offset.
     */
    public double azimuth(int x, int y) {
        double dx = (x + 0.5) * pixelSizeX / 1000.0 - centerX;
        double dy = (y + 0.5) * pixelSizeY / 1000.0 - centerY;
        return Math.toDegrees(Math.atan2(dy, dx)) + azimuthOffset;
    }

    /**
     * Bragg's law at first order.
     *
     * @param twoTheta peak position in degrees.
     * @return the d-spacing in Angstrom, or {@code NaN} for non-positive angles.
     */
    public double dSpacing(double twoTheta) {
        if (!(twoTheta > 0)) {
            return Double.NaN;
        }
        return wavelength / (2.0 * Math.sin(Math.toRadians(twoTheta / 2.0)));
    }
}
