package org.prisma.datapipeline.api.job;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validated, immutable description of one processing run.
 * <p>
 * Instances are produced by {@code JobSpecificationLoader}, which enforces all invariants
 * (whole number of azimuthal bins, non-empty frame range, well-formed peak windows) before
 * any frame is processed. Every other component only reads from it.
 *
 * @param sample          sample identifier, used as a path segment
 * @param setting         detector setting label
 * @param stage           experiment stage
 * @param homeDirectory   output root; datasets go below {@code Processed/}
 * @param imagesPath      directory containing the frames to process
 * @param referencePath   directory containing reference frames, or {@code null}
 * @param controlFile     calibration control file
 * @param maskFile        detector mask file, or {@code null}
 * @param exposure        exposure label
 * @param notes           free-form notes carried into the metadata
 * @param activePeaks     peaks to fit, in dataset peak-axis order
 * @param availablePeaks  additional known peaks, candidates for background modelling
 * @param binning         azimuthal range and bin width
 * @param frames          requested frame range
 * @param detector        detector description
 */
public record JobSpecification(
        String sample,
        String setting,
        Stage stage,
        Path homeDirectory,
        Path imagesPath,
        Path referencePath,
        Path controlFile,
        Path maskFile,
        String exposure,
        String notes,
        List<PeakDefinition> activePeaks,
        List<PeakDefinition> availablePeaks,
        AzimuthalBinning binning,
        FrameRange frames,
        DetectorParameters detector) {

    public JobSpecification {
        activePeaks = List.copyOf(activePeaks);
        availablePeaks = List.copyOf(availablePeaks);
    }

    public Optional<Path> reference() {
        return Optional.ofNullable(referencePath);
    }

    public Optional<Path> mask() {
        return Optional.ofNullable(maskFile);
    }

    public int peakCount() {
        return activePeaks.size();
    }

    /**
     * @return the lowest lower limit across all active peaks.
     */
    public double twoThetaLower() {
        return activePeaks.stream().mapToDouble(PeakDefinition::lowerLimit).min().orElseThrow();
    }

    /**
     * @return the highest upper limit across all active peaks.
     */
    public double twoThetaUpper() {
        return activePeaks.stream().mapToDouble(PeakDefinition::upperLimit).max().orElseThrow();
    }

    /**
     * Available peaks that are not fitted but fall inside the combined 2-theta window.
     *
     * @return background candidates in declaration order.
     */
    public List<PeakDefinition> backgroundCandidates() {
        double lower = twoThetaLower();
        double upper = twoThetaUpper();
        List<PeakDefinition> candidates = new ArrayList<>();
        for (PeakDefinition available : availablePeaks) {
            boolean active = activePeaks.stream().anyMatch(p -> Math.abs(p.position() - available.position()) < 1e-9);
            if (!active && available.position() >= lower && available.position() <= upper) {
                candidates.add(available);
            }
        }
        return candidates;
    }

    /**
     * @param resolvedFrames the frame range with a concrete end.
     * @return a copy with the given frame range.
     */
    public JobSpecification withFrames(FrameRange resolvedFrames) {
        return new JobSpecification(sample, setting, stage, homeDirectory, imagesPath, referencePath, controlFile,
            maskFile, exposure, notes, activePeaks, availablePeaks, binning, resolvedFrames, detector);
    }

    /**
     * Derives the job that processes the reference frames: every reference frame, same
     * calibration, peaks and binning, and no reference of its own.
     *
     * @return the reference job.
     * @throws IllegalStateException if this job has no reference path.
     */
    public JobSpecification forReference() {
        if (referencePath == null) {
            throw new IllegalStateException("Job for sample '" + sample + "' has no reference path");
        }
        return new JobSpecification(sample, setting, stage, homeDirectory, referencePath, null, controlFile,
            maskFile, exposure, notes, activePeaks, availablePeaks, binning, new FrameRange(0, FrameRange.ALL, 1),
            detector);
    }
}
