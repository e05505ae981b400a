package org.prisma.datapipeline.resources.calibration;

import org.prisma.datapipeline.api.fitting.DiffractionPattern;
import org.prisma.datapipeline.api.frames.DecodedFrame;
import org.prisma.datapipeline.api.job.AzimuthalBinning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.typesafe.config.Config;

/**
 * Reduces a 2D frame into one 1D pattern per azimuth bin.
 * <p>
 * The calibration and mask are read-only and shared by every worker. Pixel maps are built on
 * first use per image shape and kept in a bounded Caffeine cache, so frames after the first
 * only pay for the accumulation pass.
 * <p>
 * <b>Thread safety:</b> safe for concurrent use.
 */
public class AzimuthalIntegrator {

    private static final Logger log = LoggerFactory.getLogger(AzimuthalIntegrator.class);

    private final Calibration calibration;
    private final DetectorMask mask;
    private final AzimuthalBinning binning;
    private final double lower;
    private final double upper;
    private final int channels;
    private final Cache<Shape, IntegrationMap> maps;

    private record Shape(int width, int height) {}

    /**
     * @param calibration detector geometry.
     * @param mask        detector mask.
     * @param binning     azimuthal binning of the job.
     * @param tthLower    lowest fitted 2-theta in degrees.
     * @param tthUpper    highest fitted 2-theta in degrees.
     * @param options     the {@code prisma.integration} configuration block.
     */
    public AzimuthalIntegrator(Calibration calibration, DetectorMask mask, AzimuthalBinning binning,
                               double tthLower, double tthUpper, Config options) {
        double padding = options.hasPath("tthPadding") ? options.getDouble("tthPadding") : 1.0;
        this.calibration = calibration;
        this.mask = mask;
        this.binning = binning;
        this.lower = Math.max(0.0, tthLower - padding);
        this.upper = tthUpper + padding;
        this.channels = options.hasPath("outChannels") ? options.getInt("outChannels") : 2500;
        long cacheSize = options.hasPath("cacheSize") ? options.getLong("cacheSize") : 8;
        this.maps = Caffeine.newBuilder().maximumSize(cacheSize).build();
    }

    /**
     * @param frame the decoded frame.
     * @return one pattern per azimuth bin, in bin order.
     */
    public DiffractionPattern[] integrate(DecodedFrame frame) {
        IntegrationMap map = maps.get(new Shape(frame.width(), frame.height()), shape -> {
            log.debug("Building integration map for {}x{} image, {} bins x {} channels over {}..{} deg",
                shape.width(), shape.height(), binning.binCount(), channels, lower, upper);
            return IntegrationMap.build(calibration, mask, shape.width(), shape.height(), binning, lower, upper,
                channels);
        });
        return map.integrate(frame, mask);
    }

    public Calibration calibration() {
        return calibration;
    }
}
