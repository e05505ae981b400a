package org.prisma.datapipeline.services;

import java.io.IOException;
import java.util.BitSet;
import java.util.List;

import org.prisma.datapipeline.api.fitting.DiffractionPattern;
import org.prisma.datapipeline.api.fitting.FitConvergenceException;
import org.prisma.datapipeline.api.fitting.FitWindow;
import org.prisma.datapipeline.api.fitting.IPeakFitter;
import org.prisma.datapipeline.api.fitting.PeakFit;
import org.prisma.datapipeline.api.frames.DecodedFrame;
import org.prisma.datapipeline.api.frames.FrameDecodeException;
import org.prisma.datapipeline.api.frames.IFrameDecoder;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.api.job.PeakDefinition;
import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameResult;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.api.results.MeasurementColumns;
import org.prisma.datapipeline.resources.calibration.AzimuthalIntegrator;
import org.prisma.datapipeline.resources.calibration.Calibration;
import org.prisma.datapipeline.resources.calibration.CalibrationLoader;
import org.prisma.datapipeline.resources.calibration.DetectorMask;
import org.prisma.datapipeline.resources.fitting.MomentPeakFitter;
import org.prisma.datapipeline.resources.frames.ImageFrameDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Processes exactly one frame end-to-end: decode, integrate into azimuthal slices, fit every
 * configured peak in every slice.
 * <p>
 * <strong>Failure policy:</strong>
 * <ul>
 *   <li>A fit that does not converge marks only that (azimuth, peak) cell as {@code NaN}.</li>
 *   <li>A decode failure, an unexpected exception or memory exhaustion fails the whole frame;
 *       the outcome says which, so the pipeline can retry it.</li>
 * </ul>
 * The decoded frame, and any temporary file it owns, is released on every exit path.
 * <p>
 * <b>Thread safety:</b> stateless; one instance is shared by all local worker threads.
 */
public class FrameWorker {

    private static final Logger log = LoggerFactory.getLogger(FrameWorker.class);

    private static final int MEASUREMENTS = MeasurementColumns.BASE.size();

    private final IFrameDecoder decoder;
    private final AzimuthalIntegrator integrator;
    private final IPeakFitter fitter;
    private final List<PeakDefinition> peaks;
    private final int azimuths;

    /**
     * @param decoder    image decoding capability.
     * @param integrator azimuthal integrator for the job's calibration.
     * @param fitter     peak fitting capability.
     * @param peaks      peaks in dataset order.
     * @param azimuths   number of azimuth bins.
     */
    public FrameWorker(IFrameDecoder decoder, AzimuthalIntegrator integrator, IPeakFitter fitter,
                       List<PeakDefinition> peaks, int azimuths) {
        this.decoder = decoder;
        this.integrator = integrator;
        this.fitter = fitter;
        this.peaks = List.copyOf(peaks);
        this.azimuths = azimuths;
    }

    /**
     * Builds a worker with the default decoder and fitter for a job.
     *
     * @param job    the job specification.
     * @param config the application configuration (the {@code prisma} block is read).
     * @return the worker.
     * @throws IOException if the calibration or mask cannot be read.
     */
    public static FrameWorker forJob(JobSpecification job, Config config) throws IOException {
        Config prisma = config.hasPath("prisma") ? config.getConfig("prisma") : ConfigFactory.empty();
        Calibration calibration = CalibrationLoader.load(job.controlFile(), job.detector());
        DetectorMask mask = DetectorMask.load(job.maskFile());
        AzimuthalIntegrator integrator = new AzimuthalIntegrator(calibration, mask, job.binning(),
            job.twoThetaLower(), job.twoThetaUpper(), section(prisma, "integration"));
        return new FrameWorker(new ImageFrameDecoder(section(prisma, "frames")), integrator,
            new MomentPeakFitter(section(prisma, "fitting")), job.activePeaks(), job.binning().binCount());
    }

    private static Config section(Config prisma, String name) {
        return prisma.hasPath(name) ? prisma.getConfig(name) : ConfigFactory.empty();
    }

    /**
     * Processes one task. Never throws; every problem is reported in the outcome.
     *
     * @param task     the task.
     * @param workerId identifier of the slot running the task, reported back for retries.
     * @return the frame's result or its failure.
     */
    public FrameOutcome process(FrameTask task, String workerId) {
        try (DecodedFrame frame = decoder.decode(task.frame())) {
            DiffractionPattern[] patterns = integrator.integrate(frame);
            if (patterns.length != azimuths) {
                throw new IllegalStateException("Integrator produced " + patterns.length + " slices, expected " + azimuths);
            }
            return FrameOutcome.success(task, workerId, fitAll(patterns));
        } catch (FrameDecodeException e) {
            log.warn("Decode failed for {} (attempt {}): {}", task.frame(), task.attempt() + 1, e.getMessage());
            return FrameOutcome.failure(task, workerId, FailureKind.DECODE, e.getMessage());
        } catch (OutOfMemoryError e) {
            log.warn("Out of memory while processing {} (attempt {})", task.frame(), task.attempt() + 1);
            return FrameOutcome.failure(task, workerId, FailureKind.RESOURCE_EXHAUSTED, "out of memory");
        } catch (RuntimeException e) {
            log.warn("Worker {} failed on {} (attempt {}): {}", workerId, task.frame(), task.attempt() + 1,
                e.toString());
            log.debug("Exception details:", e);
            return FrameOutcome.failure(task, workerId, FailureKind.WORKER_CRASH, e.toString());
        }
    }

    private FrameResult fitAll(DiffractionPattern[] patterns) {
        int peakCount = peaks.size();
        float[] values = new float[azimuths * peakCount * MEASUREMENTS];
        BitSet fitted = new BitSet(azimuths * peakCount);
        Calibration calibration = integrator.calibration();
        for (int a = 0; a < azimuths; a++) {
            for (int p = 0; p < peakCount; p++) {
                int base = (a * peakCount + p) * MEASUREMENTS;
                PeakDefinition peak = peaks.get(p);
                try {
                    PeakFit fit = fitter.fit(patterns[a], FitWindow.of(peak), peak);
                    values[base] = (float) fit.position();
                    values[base + 1] = (float) fit.area();
                    values[base + 2] = (float) fit.sigma();
                    values[base + 3] = (float) fit.gamma();
                    values[base + 4] = (float) calibration.dSpacing(fit.position());
                    fitted.set(a * peakCount + p);
                } catch (FitConvergenceException e) {
                    markMissing(values, base);
                    log.debug("Fit failed for {} in frame {} bin {}: {}", peak.name(), patterns[a].frameIndex(), a,
                        e.getMessage());
                } catch (RuntimeException e) {
                    markMissing(values, base);
                    log.debug("Fitter error for {} in frame {} bin {}: {}", peak.name(), patterns[a].frameIndex(), a,
                        e.toString());
                }
            }
        }
        return new FrameResult(azimuths, peakCount, MEASUREMENTS, values, fitted);
    }

    private static void markMissing(float[] values, int base) {
        for (int m = 0; m < MEASUREMENTS; m++) {
            values[base + m] = Float.NaN;
        }
    }
}
