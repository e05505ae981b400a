package org.prisma.datapipeline.job;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.prisma.datapipeline.api.job.AzimuthalBinning;
import org.prisma.datapipeline.api.job.DetectorParameters;
import org.prisma.datapipeline.api.job.FrameRange;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.api.job.PeakDefinition;
import org.prisma.datapipeline.api.job.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

/**
 * Reads recipe documents (JSON) into validated {@link JobSpecification}s.
 * <p>
 * Every problem is reported as a {@link JobSpecificationException} naming the recipe key,
 * and all checks run before the caller gets a specification back, so a bad recipe never
 * reaches frame processing.
 * <p>
 * Relative paths in the recipe are resolved against the directory containing the recipe.
 */
public final class JobSpecificationLoader {

    private static final Logger log = LoggerFactory.getLogger(JobSpecificationLoader.class);

    private static final double DEFAULT_BACKGROUND_HALF_WIDTH = 0.2;
    private static final String DEFAULT_EXPOSURE = "019";

    private JobSpecificationLoader() {
    }

    /**
     * Loads a recipe file and verifies that the referenced inputs exist.
     *
     * @param recipeFile path to the JSON recipe.
     * @return the validated job specification.
     * @throws JobSpecificationException if the recipe is unreadable, malformed or references missing inputs.
     */
    public static JobSpecification load(Path recipeFile) {
        if (!Files.isRegularFile(recipeFile)) {
            throw new JobSpecificationException("recipe", "file not found: " + recipeFile.toAbsolutePath());
        }
        Config recipe;
        try {
            recipe = ConfigFactory.parseFile(recipeFile.toFile(),
                ConfigParseOptions.defaults().setSyntax(ConfigSyntax.JSON).setAllowMissing(false));
        } catch (ConfigException e) {
            throw new JobSpecificationException("recipe", "not a valid JSON document: " + e.getMessage(), e);
        }
        Path baseDirectory = recipeFile.toAbsolutePath().getParent();
        JobSpecification spec = parse(recipe, baseDirectory);
        verifyInputsExist(spec);
        log.debug("Loaded job specification for sample '{}' from {}", spec.sample(), recipeFile);
        return spec;
    }

    /**
     * Parses and validates an already-loaded recipe document without touching the filesystem.
     *
     * @param recipe        the recipe document.
     * @param baseDirectory directory against which relative paths are resolved.
     * @return the validated job specification.
     * @throws JobSpecificationException if any field is missing, mistyped or inconsistent.
     */
    public static JobSpecification parse(Config recipe, Path baseDirectory) {
        String sample = requireString(recipe, "sample");
        if (sample.isBlank() || sample.contains("/") || sample.contains("\\")) {
            throw new JobSpecificationException("sample", "must be a non-empty name without path separators");
        }
        String setting = requireString(recipe, "setting");
        Stage stage = parseStage(recipe);

        Path home = resolvePath(baseDirectory, requireString(recipe, "home_dir"));
        String imagesKey = recipe.hasPath("images_path") ? "images_path" : "image_folder";
        if (!recipe.hasPath(imagesKey)) {
            throw new JobSpecificationException("images_path", "required field is missing");
        }
        Path images = resolvePath(baseDirectory, requireString(recipe, imagesKey));
        Path references = optionalPath(recipe, "refs_path", baseDirectory);
        Path control = resolvePath(baseDirectory, requireString(recipe, "control_file"));
        Path mask = optionalPath(recipe, "mask_file", baseDirectory);

        String exposure = recipe.hasPath("exposure") ? requireString(recipe, "exposure") : DEFAULT_EXPOSURE;
        String notes = recipe.hasPath("notes") ? requireString(recipe, "notes") : "";

        List<PeakDefinition> activePeaks = parseActivePeaks(recipe);
        List<PeakDefinition> availablePeaks = parseAvailablePeaks(recipe);
        AzimuthalBinning binning = parseBinning(recipe);
        FrameRange frames = parseFrames(recipe);
        DetectorParameters detector = parseDetector(recipe);

        return new JobSpecification(sample, setting, stage, home, images, references, control, mask, exposure, notes,
            activePeaks, availablePeaks, binning, frames, detector);
    }

    // ===== field parsing =====

    private static Stage parseStage(Config recipe) {
        String value = requireString(recipe, "stage");
        try {
            return Stage.parse(value);
        } catch (IllegalArgumentException e) {
            throw new JobSpecificationException("stage", "unknown stage '" + value + "', expected one of "
                + List.of(Stage.values()), e);
        }
    }

    private static List<PeakDefinition> parseActivePeaks(Config recipe) {
        List<? extends Config> entries;
        try {
            entries = recipe.getConfigList("active_peaks");
        } catch (ConfigException.Missing e) {
            throw new JobSpecificationException("active_peaks", "required field is missing", e);
        } catch (ConfigException.WrongType e) {
            throw new JobSpecificationException("active_peaks", "must be a list of peak objects", e);
        }
        if (entries.isEmpty()) {
            throw new JobSpecificationException("active_peaks", "at least one peak is required");
        }
        List<PeakDefinition> peaks = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            String prefix = "active_peaks[" + i + "].";
            Config entry = entries.get(i);
            String name = requireString(entry, "name", prefix);
            int miller = requireInt(entry, "miller_index", prefix);
            double position = requireDouble(entry, "position", prefix);
            List<Double> limits;
            try {
                limits = entry.getDoubleList("limits");
            } catch (ConfigException.Missing e) {
                throw new JobSpecificationException(prefix + "limits", "required field is missing", e);
            } catch (ConfigException.WrongType e) {
                throw new JobSpecificationException(prefix + "limits", "must be a list of two numbers", e);
            }
            if (limits.size() != 2) {
                throw new JobSpecificationException(prefix + "limits", "must contain exactly two values");
            }
            double lower = limits.get(0);
            double upper = limits.get(1);
            if (lower >= upper) {
                throw new JobSpecificationException(prefix + "limits", "lower limit must be below upper limit");
            }
            if (position < lower || position > upper) {
                throw new JobSpecificationException(prefix + "position", "position " + position
                    + " lies outside its limits [" + lower + ", " + upper + "]");
            }
            peaks.add(new PeakDefinition(name, miller, position, lower, upper));
        }
        return peaks;
    }

    private static List<PeakDefinition> parseAvailablePeaks(Config recipe) {
        String key = recipe.hasPath("AVAILABLE_PEAKS") ? "AVAILABLE_PEAKS" : "available_peaks";
        if (!recipe.hasPath(key)) {
            return List.of();
        }
        ConfigObject object;
        try {
            object = recipe.getObject(key);
        } catch (ConfigException.WrongType e) {
            throw new JobSpecificationException(key, "must map peak names to positions", e);
        }
        List<PeakDefinition> peaks = new ArrayList<>();
        for (Map.Entry<String, ConfigValue> entry : object.entrySet()) {
            String name = entry.getKey();
            String field = key + "." + name;
            ConfigValue value = entry.getValue();
            if (value.valueType() == ConfigValueType.NUMBER) {
                double position = ((Number) value.unwrapped()).doubleValue();
                peaks.add(new PeakDefinition(name, 0, position,
                    position - DEFAULT_BACKGROUND_HALF_WIDTH, position + DEFAULT_BACKGROUND_HALF_WIDTH));
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                Config peak = ((ConfigObject) value).toConfig();
                double position = requireDouble(peak, "position", field + ".");
                int miller = peak.hasPath("miller_index") ? requireInt(peak, "miller_index", field + ".") : 0;
                double lower = position - DEFAULT_BACKGROUND_HALF_WIDTH;
                double upper = position + DEFAULT_BACKGROUND_HALF_WIDTH;
                if (peak.hasPath("limits")) {
                    List<Double> limits = peak.getDoubleList("limits");
                    if (limits.size() == 2) {
                        lower = limits.get(0);
                        upper = limits.get(1);
                    }
                }
                peaks.add(new PeakDefinition(name, miller, position, lower, upper));
            } else {
                throw new JobSpecificationException(field, "must be a number or a peak object");
            }
        }
        peaks.sort((a, b) -> Double.compare(a.position(), b.position()));
        return peaks;
    }

    private static AzimuthalBinning parseBinning(Config recipe) {
        double start = requireDouble(recipe, "az_start");
        double end = requireDouble(recipe, "az_end");
        double spacing = requireDouble(recipe, "spacing");
        if (spacing <= 0) {
            throw new JobSpecificationException("spacing", "must be positive");
        }
        if (end <= start) {
            throw new JobSpecificationException("az_end", "must be greater than az_start");
        }
        if (end - start > 360.0) {
            throw new JobSpecificationException("az_end", "azimuthal span cannot exceed 360 degrees");
        }
        AzimuthalBinning binning = new AzimuthalBinning(start, end, spacing);
        if (!binning.isWholeNumberOfBins()) {
            throw new JobSpecificationException("spacing", "spacing " + spacing
                + " does not divide the azimuthal span " + binning.span() + " into whole bins");
        }
        return binning;
    }

    private static FrameRange parseFrames(Config recipe) {
        int start = recipe.hasPath("frame_start") ? requireInt(recipe, "frame_start") : 0;
        int end = recipe.hasPath("frame_end") ? requireInt(recipe, "frame_end") : FrameRange.ALL;
        int step = recipe.hasPath("step") ? requireInt(recipe, "step") : 1;
        if (start < 0) {
            throw new JobSpecificationException("frame_start", "must not be negative");
        }
        if (step < 1) {
            throw new JobSpecificationException("step", "must be at least 1");
        }
        if (end != FrameRange.ALL && end <= start) {
            throw new JobSpecificationException("frame_end", "frame range [" + start + ", " + end
                + ") selects no frames; use -1 for all frames");
        }
        return new FrameRange(start, end, step);
    }

    private static DetectorParameters parseDetector(Config recipe) {
        if (!recipe.hasPath("detector_params")) {
            return DetectorParameters.DEFAULT;
        }
        Config detector = recipe.getConfig("detector_params");
        DetectorParameters defaults = DetectorParameters.DEFAULT;
        double pixelX = defaults.pixelSizeX();
        double pixelY = defaults.pixelSizeY();
        int columns = defaults.columns();
        int rows = defaults.rows();
        if (detector.hasPath("pixel_size")) {
            List<Double> pixel = requirePair(detector, "detector_params.pixel_size", "pixel_size");
            pixelX = pixel.get(0);
            pixelY = pixel.get(1);
        }
        if (detector.hasPath("detector_size")) {
            List<Double> size = requirePair(detector, "detector_params.detector_size", "detector_size");
            columns = size.get(0).intValue();
            rows = size.get(1).intValue();
        }
        double wavelength = detector.hasPath("wavelength")
            ? requireDouble(detector, "wavelength", "detector_params.")
            : defaults.wavelength();
        if (wavelength <= 0) {
            throw new JobSpecificationException("detector_params.wavelength", "must be positive");
        }
        return new DetectorParameters(pixelX, pixelY, wavelength, columns, rows);
    }

    private static void verifyInputsExist(JobSpecification spec) {
        if (!Files.isDirectory(spec.imagesPath())) {
            throw new JobSpecificationException("images_path", "directory not found: " + spec.imagesPath());
        }
        if (spec.referencePath() != null && !Files.isDirectory(spec.referencePath())) {
            throw new JobSpecificationException("refs_path", "directory not found: " + spec.referencePath());
        }
        if (!Files.isRegularFile(spec.controlFile())) {
            throw new JobSpecificationException("control_file", "file not found: " + spec.controlFile());
        }
        if (spec.maskFile() != null && !Files.isRegularFile(spec.maskFile())) {
            throw new JobSpecificationException("mask_file", "file not found: " + spec.maskFile());
        }
    }

    // ===== typed accessors with field-level errors =====

    private static String requireString(Config config, String key) {
        return requireString(config, key, "");
    }

    private static String requireString(Config config, String key, String prefix) {
        String path = ConfigUtil.quoteString(key);
        try {
            return config.getString(path);
        } catch (ConfigException.Missing e) {
            throw new JobSpecificationException(prefix + key, "required field is missing", e);
        } catch (ConfigException.WrongType e) {
            throw new JobSpecificationException(prefix + key, "must be a string", e);
        }
    }

    private static int requireInt(Config config, String key) {
        return requireInt(config, key, "");
    }

    private static int requireInt(Config config, String key, String prefix) {
        try {
            return config.getInt(ConfigUtil.quoteString(key));
        } catch (ConfigException.Missing e) {
            throw new JobSpecificationException(prefix + key, "required field is missing", e);
        } catch (ConfigException.WrongType e) {
            throw new JobSpecificationException(prefix + key, "must be an integer", e);
        }
    }

    private static double requireDouble(Config config, String key) {
        return requireDouble(config, key, "");
    }

    private static double requireDouble(Config config, String key, String prefix) {
        try {
            double value = config.getDouble(ConfigUtil.quoteString(key));
            if (!Double.isFinite(value)) {
                throw new JobSpecificationException(prefix + key, "must be a finite number");
            }
            return value;
        } catch (ConfigException.Missing e) {
            throw new JobSpecificationException(prefix + key, "required field is missing", e);
        } catch (ConfigException.WrongType e) {
            throw new JobSpecificationException(prefix + key, "must be a number", e);
        }
    }

    private static List<Double> requirePair(Config config, String field, String key) {
        try {
            List<Double> values = config.getDoubleList(key);
            if (values.size() != 2) {
                throw new JobSpecificationException(field, "must contain exactly two values");
            }
            return values;
        } catch (ConfigException.WrongType e) {
            throw new JobSpecificationException(field, "must be a list of two numbers", e);
        }
    }

    private static Path optionalPath(Config recipe, String key, Path baseDirectory) {
        if (!recipe.hasPath(key)) {
            return null;
        }
        String value = requireString(recipe, key);
        return value.isBlank() ? null : resolvePath(baseDirectory, value);
    }

    private static Path resolvePath(Path baseDirectory, String value) {
        Path path = new File(value).toPath();
        if (path.isAbsolute() || baseDirectory == null) {
            return path.normalize();
        }
        return baseDirectory.resolve(path).normalize();
    }
}
