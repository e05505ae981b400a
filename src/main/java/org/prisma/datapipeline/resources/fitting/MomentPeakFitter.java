package org.prisma.datapipeline.resources.fitting;

import org.prisma.datapipeline.api.fitting.DiffractionPattern;
import org.prisma.datapipeline.api.fitting.FitConvergenceException;
import org.prisma.datapipeline.api.fitting.FitWindow;
import org.prisma.datapipeline.api.fitting.IPeakFitter;
import org.prisma.datapipeline.api.fitting.PeakFit;
import org.prisma.datapipeline.api.job.PeakDefinition;

import com.typesafe.config.Config;

/**
 * Non-iterative peak fitter based on moments of the background-subtracted profile.
 * <p>
 * Inside the window a straight background is drawn through the mean of the outermost channels
 * on each side. On the net profile:
 * <ul>
 *   <li>area is the trapezoidal integral</li>
 *   <li>position is the intensity-weighted centroid</li>
 *   <li>sigma is the square root of the second central moment</li>
 *   <li>gamma is half the full width at half maximum</li>
 * </ul>
 * The fit fails when the window holds too few populated channels, the net area is not positive,
 * or the centroid falls outside the window.
 */
public class MomentPeakFitter implements IPeakFitter {

    private static final int EDGE_CHANNELS = 2;

    private final int minChannels;

    /**
     * @param options the {@code prisma.fitting} configuration block.
     */
    public MomentPeakFitter(Config options) {
        this.minChannels = options.hasPath("minChannels") ? Math.max(3, options.getInt("minChannels")) : 5;
    }

    @Override
    public PeakFit fit(DiffractionPattern pattern, FitWindow window, PeakDefinition peak) throws FitConvergenceException {
        DiffractionPattern slice = pattern.restrictTo(window);
        int n = slice.size();
        if (n < minChannels) {
            throw new FitConvergenceException("Only " + n + " populated channels in window for " + peak.name());
        }

        int edge = Math.min(EDGE_CHANNELS, n / 3);
        double leftX = 0;
        double leftY = 0;
        double rightX = 0;
        double rightY = 0;
        for (int i = 0; i < edge; i++) {
            leftX += slice.twoTheta(i);
            leftY += slice.intensity(i);
            rightX += slice.twoTheta(n - 1 - i);
            rightY += slice.intensity(n - 1 - i);
        }
        leftX /= edge;
        leftY /= edge;
        rightX /= edge;
        rightY /= edge;
        double slope = rightX > leftX ? (rightY - leftY) / (rightX - leftX) : 0.0;

        double[] x = new double[n];
        double[] net = new double[n];
        double maxNet = Double.NEGATIVE_INFINITY;
        int maxIndex = 0;
        for (int i = 0; i < n; i++) {
            x[i] = slice.twoTheta(i);
            net[i] = slice.intensity(i) - (leftY + slope * (x[i] - leftX));
            if (net[i] > maxNet) {
                maxNet = net[i];
                maxIndex = i;
            }
        }

        double area = 0;
        double weighted = 0;
        double weights = 0;
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                area += 0.5 * (net[i] + net[i - 1]) * (x[i] - x[i - 1]);
            }
            double w = Math.max(0.0, net[i]);
            weighted += w * x[i];
            weights += w;
        }
        if (!(area > 0) || !(weights > 0)) {
            throw new FitConvergenceException("No net intensity above background for " + peak.name());
        }
        double position = weighted / weights;
        if (!window.contains(position)) {
            throw new FitConvergenceException("Centroid " + position + " outside window for " + peak.name());
        }

        double variance = 0;
        for (int i = 0; i < n; i++) {
            double w = Math.max(0.0, net[i]);
            variance += w * (x[i] - position) * (x[i] - position);
        }
        double sigma = Math.sqrt(variance / weights);
        double gamma = halfWidthAtHalfMaximum(x, net, maxIndex, maxNet);

        PeakFit fit = new PeakFit(position, area, sigma, gamma);
        if (!fit.isFinite()) {
            throw new FitConvergenceException("Non-finite fit parameters for " + peak.name());
        }
        return fit;
    }

    private static double halfWidthAtHalfMaximum(double[] x, double[] net, int peakIndex, double peakValue) {
        double half = peakValue / 2.0;
        double left = x[0];
        for (int i = peakIndex; i > 0; i--) {
            if (net[i - 1] <= half) {
                left = interpolate(x[i - 1], net[i - 1], x[i], net[i], half);
                break;
            }
        }
        double right = x[x.length - 1];
        for (int i = peakIndex; i < x.length - 1; i++) {
            if (net[i + 1] <= half) {
                right = interpolate(x[i], net[i], x[i + 1], net[i + 1], half);
                break;
            }
        }
        return (right - left) / 2.0;
    }

    private static double interpolate(double x0, double y0, double x1, double y1, double y) {
        if (y1 == y0) {
            return (x0 + x1) / 2.0;
        }
        return x0 + (y - y0) * (x1 - x0) / (y1 - y0);
    }
}
