package org.prisma.datapipeline.resources.calibration;

import java.awt.image.Raster;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.prisma.datapipeline.job.JobSpecificationException;

/**
 * Pixels excluded from integration.
 * <p>
 * Two sources are supported: a TIFF image whose non-zero pixels are masked, and a text
 * {@code .immask} file with a {@code Thresholds:[lo, hi]} line, which masks pixels whose
 * intensity falls outside the range. Both may not be combined; an absent mask masks nothing.
 * <p>
 * <b>Thread safety:</b> immutable.
 */
public final class DetectorMask {

    public static final DetectorMask NONE = new DetectorMask(null, 0, 0, Double.NEGATIVE_INFINITY,
        Double.POSITIVE_INFINITY, "none");

    private final boolean[] masked;
    private final int width;
    private final int height;
    private final double lowerThreshold;
    private final double upperThreshold;
    private final String label;

    private DetectorMask(boolean[] masked, int width, int height, double lowerThreshold, double upperThreshold,
                         String label) {
        this.masked = masked;
        this.width = width;
        this.height = height;
        this.lowerThreshold = lowerThreshold;
        this.upperThreshold = upperThreshold;
        this.label = label;
    }

    /**
     * @param pixels row-major mask, {@code true} where excluded.
     * @param width  mask width.
     * @param height mask height.
     * @return a pixel mask.
     */
    public static DetectorMask ofPixels(boolean[] pixels, int width, int height) {
        return new DetectorMask(pixels.clone(), width, height, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
            "pixels:" + width + "x" + height);
    }

    /**
     * @param lower lowest accepted intensity.
     * @param upper highest accepted intensity.
     * @return an intensity-threshold mask.
     */
    public static DetectorMask ofThresholds(double lower, double upper) {
        return new DetectorMask(null, 0, 0, lower, upper, "thresholds:" + lower + ".." + upper);
    }

    /**
     * @param maskFile TIFF or text mask, or {@code null}.
     * @return the loaded mask, {@link #NONE} when no file is given.
     * @throws IOException if the file cannot be read.
     */
    public static DetectorMask load(Path maskFile) throws IOException {
        if (maskFile == null) {
            return NONE;
        }
        String name = maskFile.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".tif") || name.endsWith(".tiff")) {
            return loadTiff(maskFile);
        }
        return loadThresholds(maskFile);
    }

    private static DetectorMask loadTiff(Path maskFile) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(maskFile.toFile())) {
            var readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new IOException("No image reader for mask " + maskFile);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                Raster raster = reader.read(0).getRaster();
                int w = raster.getWidth();
                int h = raster.getHeight();
                boolean[] pixels = new boolean[w * h];
                for (int y = 0; y < h; y++) {
                    for (int x = 0; x < w; x++) {
                        pixels[y * w + x] = raster.getSampleDouble(x, y, 0) != 0.0;
                    }
                }
                return new DetectorMask(pixels, w, h, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                    maskFile.toAbsolutePath().toString());
            } finally {
                reader.dispose();
            }
        }
    }

    private static DetectorMask loadThresholds(Path maskFile) throws IOException {
        for (String line : Files.readAllLines(maskFile, StandardCharsets.UTF_8)) {
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase("Thresholds")) {
                String[] parts = line.substring(colon + 1).replaceAll("[\\[\\]()]", " ").split(",");
                if (parts.length >= 2) {
                    try {
                        double lower = Double.parseDouble(parts[parts.length - 2].trim());
                        double upper = Double.parseDouble(parts[parts.length - 1].trim());
                        return new DetectorMask(null, 0, 0, lower, upper, maskFile.toAbsolutePath().toString());
                    } catch (NumberFormatException e) {
                        throw new JobSpecificationException("mask_file", "unreadable Thresholds in " + maskFile, e);
                    }
                }
            }
        }
        throw new JobSpecificationException("mask_file", "no Thresholds entry in " + maskFile);
    }

    /**
     * @return true if this mask excludes fixed pixel positions.
     */
    public boolean hasPixelMask() {
        return masked != null;
    }

    /**
     * @param x pixel column.
     * @param y pixel row.
     * @return true if the pixel is excluded regardless of its intensity.
     */
    public boolean isPixelMasked(int x, int y) {
        return masked != null && x < width && y < height && masked[y * width + x];
    }

    /**
     * @param intensity a pixel intensity.
     * @return true if the intensity lies outside the accepted thresholds.
     */
    public boolean isOutsideThresholds(double intensity) {
        return intensity < lowerThreshold || intensity > upperThreshold;
    }

    /**
     * Checks that a pixel mask matches the image it is applied to.
     *
     * @param imageWidth  image width.
     * @param imageHeight image height.
     * @throws IllegalArgumentException if a pixel mask has a different shape.
     */
    public void checkShape(int imageWidth, int imageHeight) {
        if (masked != null && (imageWidth != width || imageHeight != height)) {
            throw new IllegalArgumentException("Mask is " + width + "x" + height + " but image is "
                + imageWidth + "x" + imageHeight);
        }
    }

    /**
     * @return a stable description used as part of cache keys.
     */
    public String label() {
        return label;
    }
}
