package org.prisma.datapipeline.resources.storage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.prisma.datapipeline.api.job.FrameRange;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.api.job.PeakDefinition;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Deterministic names for datasets.
 * <p>
 * The identity is the SHA-256 of the canonical JSON of the normalized parameters (keys sorted
 * at every level), truncated to {@value #LENGTH} hex characters. The resume key is computed the
 * same way without the frame range, so datasets that differ only in their frames share it.
 */
public final class DatasetIdentity {

    public static final int LENGTH = 12;

    private static final Gson CANONICAL = new GsonBuilder().disableHtmlEscaping().create();

    private DatasetIdentity() {
    }

    /**
     * @param job job whose frame end has been resolved.
     * @return the 12-character identity.
     * @throws IllegalArgumentException if the frame end is still open.
     */
    public static String identity(JobSpecification job) {
        if (job.frames().isOpenEnded()) {
            throw new IllegalArgumentException("Identity requires a resolved frame end");
        }
        return hash(identityParameters(job, true));
    }

    public static String resumeKey(JobSpecification job) {
        return hash(identityParameters(job, false));
    }

    /**
     * @param job the job, with the frame end as requested ({@code -1} renders as {@code allfr}).
     * @return the directory label, e.g. {@code 360deg-72bins-0sf-100efr-8.2l2t_8.8u2t-3peaks-2bkg}.
     */
    public static String paramString(JobSpecification job, FrameRange requested) {
        String end = requested.isOpenEnded() ? "allfr" : requested.end() + "efr";
        return String.format(Locale.ROOT, "%sdeg-%dbins-%dsf-%s-%.1fl2t_%.1fu2t-%dpeaks-%dbkg",
            number(job.binning().span()), job.binning().binCount(), requested.start(), end,
            job.twoThetaLower(), job.twoThetaUpper(), job.peakCount(), job.backgroundCandidates().size());
    }

    /**
     * Every job parameter in normalized form, for the dataset metadata.
     */
    public static Map<String, Object> normalizedParameters(JobSpecification job) {
        Map<String, Object> params = identityParameters(job, true);
        params.put("home_dir", job.homeDirectory().toString());
        params.put("images_path", job.imagesPath().toString());
        params.put("refs_path", job.reference().map(Object::toString).orElse(""));
        params.put("control_file", job.controlFile().toString());
        params.put("mask_file", job.mask().map(Object::toString).orElse(""));
        params.put("exposure", job.exposure());
        params.put("notes", job.notes());
        List<Object> peaks = new ArrayList<>();
        for (PeakDefinition peak : job.activePeaks()) {
            Map<String, Object> p = new TreeMap<>();
            p.put("name", peak.name());
            p.put("miller_index", peak.millerIndex());
            p.put("position", peak.position());
            p.put("limits", List.of(peak.lowerLimit(), peak.upperLimit()));
            peaks.add(p);
        }
        params.put("active_peaks", peaks);
        Map<String, Object> detector = new TreeMap<>();
        detector.put("pixel_size", List.of(job.detector().pixelSizeX(), job.detector().pixelSizeY()));
        detector.put("wavelength", job.detector().wavelength());
        detector.put("detector_size", List.of(job.detector().columns(), job.detector().rows()));
        params.put("detector_params", detector);
        return params;
    }

    static Map<String, Object> identityParameters(JobSpecification job, boolean includeFrames) {
        Map<String, Object> params = new TreeMap<>();
        params.put("sample", job.sample());
        params.put("setting", job.setting());
        params.put("stage", job.stage().name());
        params.put("az_start", job.binning().start());
        params.put("az_end", job.binning().end());
        params.put("az_bins", job.binning().binCount());
        if (includeFrames) {
            params.put("frame_start", job.frames().start());
            params.put("frame_end", job.frames().end());
            params.put("step", job.frames().step());
        }
        params.put("tth_lower", job.twoThetaLower());
        params.put("tth_upper", job.twoThetaUpper());
        params.put("peak_count", job.peakCount());
        params.put("background_count", job.backgroundCandidates().size());
        List<Double> positions = new ArrayList<>();
        List<Integer> miller = new ArrayList<>();
        for (PeakDefinition peak : job.activePeaks()) {
            positions.add(peak.position());
            miller.add(peak.millerIndex());
        }
        params.put("peak_positions", positions);
        params.put("miller_indices", miller);
        return params;
    }

    static String hash(Map<String, Object> params) {
        byte[] canonical = CANONICAL.toJson(params).getBytes(StandardCharsets.UTF_8);
        return ChunkSerializer.sha256(canonical).substring(0, LENGTH);
    }

    private static String number(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
