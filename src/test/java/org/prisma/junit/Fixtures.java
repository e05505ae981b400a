package org.prisma.junit;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import org.prisma.datapipeline.api.frames.FrameDescriptor;
import org.prisma.datapipeline.api.frames.FrameFormat;
import org.prisma.datapipeline.api.job.AzimuthalBinning;
import org.prisma.datapipeline.api.job.DetectorParameters;
import org.prisma.datapipeline.api.job.FrameRange;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.api.job.PeakDefinition;
import org.prisma.datapipeline.api.job.Stage;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameResult;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.api.results.MeasurementColumns;

/**
 * Shared builders for jobs, frames and synthetic worker results.
 */
public final class Fixtures {

    public static final int MEASUREMENTS = MeasurementColumns.BASE.size();

    private Fixtures() {
    }

    /**
     * A job over {@code peaks} synthetic peaks and an azimuth range split into {@code bins} bins.
     */
    public static JobSpecification job(Path home, Path images, FrameRange frames, int peaks, int bins) {
        List<PeakDefinition> active = new ArrayList<>();
        for (int p = 0; p < peaks; p++) {
            double position = 5.0 + p;
            active.add(new PeakDefinition("peak " + p, 100 + p, position, position - 0.3, position + 0.3));
        }
        return new JobSpecification("S1", "Standard", Stage.CONT, home, images, null, home.resolve("control.imctrl"),
            null, "019", "", active, List.of(), new AzimuthalBinning(0, 10.0 * bins, 10.0), frames,
            DetectorParameters.DEFAULT);
    }

    public static JobSpecification withReference(JobSpecification job, Path referencePath) {
        return new JobSpecification(job.sample(), job.setting(), job.stage(), job.homeDirectory(), job.imagesPath(),
            referencePath, job.controlFile(), job.maskFile(), job.exposure(), job.notes(), job.activePeaks(),
            job.availablePeaks(), job.binning(), job.frames(), job.detector());
    }

    public static FrameDescriptor frame(int globalIndex) {
        return new FrameDescriptor(globalIndex, "/data/frame_" + globalIndex + ".tif", 0, FrameFormat.TIFF, null);
    }

    public static List<FrameDescriptor> frames(FrameRange range, int available) {
        List<FrameDescriptor> frames = new ArrayList<>();
        for (int i = 0; i < available; i++) {
            if (range.selects(i)) {
                frames.add(frame(i));
            }
        }
        return frames;
    }

    /**
     * Value stored for a cell; unique per (frame, azimuth, peak, measurement).
     */
    public static float value(int globalIndex, int azimuth, int peak, int measurement) {
        return globalIndex * 1000f + azimuth * 10f + peak + measurement * 0.125f;
    }

    /**
     * A fully fitted result whose values follow {@link #value(int, int, int, int)}.
     */
    public static FrameResult result(int globalIndex, int azimuths, int peaks) {
        float[] values = new float[azimuths * peaks * MEASUREMENTS];
        BitSet fitted = new BitSet(azimuths * peaks);
        for (int a = 0; a < azimuths; a++) {
            for (int p = 0; p < peaks; p++) {
                for (int m = 0; m < MEASUREMENTS; m++) {
                    values[(a * peaks + p) * MEASUREMENTS + m] = value(globalIndex, a, p, m);
                }
                fitted.set(a * peaks + p);
            }
        }
        return new FrameResult(azimuths, peaks, MEASUREMENTS, values, fitted);
    }

    /**
     * Same as {@link #result(int, int, int)} but with one cell left unfitted ({@code NaN}).
     */
    public static FrameResult resultWithFailedCell(int globalIndex, int azimuths, int peaks, int failedAzimuth,
                                                   int failedPeak) {
        FrameResult full = result(globalIndex, azimuths, peaks);
        float[] values = full.values().clone();
        BitSet fitted = full.fitted();
        for (int m = 0; m < MEASUREMENTS; m++) {
            values[(failedAzimuth * peaks + failedPeak) * MEASUREMENTS + m] = Float.NaN;
        }
        fitted.clear(failedAzimuth * peaks + failedPeak);
        return new FrameResult(azimuths, peaks, MEASUREMENTS, values, fitted);
    }

    public static FrameOutcome success(int position, int globalIndex, int azimuths, int peaks) {
        return FrameOutcome.success(FrameTask.first(position, frame(globalIndex)), "test",
            result(globalIndex, azimuths, peaks));
    }
}
