package org.prisma.datapipeline.api.job;

/**
 * Detector description from the recipe, used where the calibration file is silent.
 *
 * @param pixelSizeX   pixel pitch along x in micrometres
 * @param pixelSizeY   pixel pitch along y in micrometres
 * @param wavelength   X-ray wavelength in Angstrom
 * @param columns      detector width in pixels
 * @param rows         detector height in pixels
 */
public record DetectorParameters(double pixelSizeX, double pixelSizeY, double wavelength, int columns, int rows) {

    public static final DetectorParameters DEFAULT = new DetectorParameters(172.0, 172.0, 0.240, 1475, 1679);
}
