package org.prisma.datapipeline.resources.calibration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.prisma.datapipeline.api.job.DetectorParameters;
import org.prisma.datapipeline.job.JobSpecificationException;

/**
 * Reads calibration control files of the {@code .imctrl} style: one {@code key:value} pair per
 * line, list values written as {@code [a, b]}. Recognised keys:
 * <ul>
 *   <li>{@code center} - beam centre {@code [x, y]} in mm (required)</li>
 *   <li>{@code distance} - detector distance in mm (required)</li>
 *   <li>{@code wavelength} - in Angstrom (falls back to the recipe)</li>
 *   <li>{@code pixelSize} - {@code [x, y]} in micrometres (falls back to the recipe)</li>
 *   <li>{@code azmthOff} - azimuth offset in degrees (default 0)</li>
 * </ul>
 * Unknown keys are ignored, so complete GSAS-II control files load unchanged.
 */
public final class CalibrationLoader {

    private CalibrationLoader() {
    }

    /**
     * @param controlFile the control file.
     * @param detector    recipe detector parameters used where the file is silent.
     * @return the calibration.
     * @throws IOException               if the file cannot be read.
     * @throws JobSpecificationException if required keys are missing or malformed.
     */
    public static Calibration load(Path controlFile, DetectorParameters detector) throws IOException {
        Map<String, String> entries = new HashMap<>();
        for (String line : Files.readAllLines(controlFile, StandardCharsets.UTF_8)) {
            int colon = line.indexOf(':');
            if (colon <= 0 || line.startsWith("#")) {
                continue;
            }
            entries.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
        }

        List<Double> center = numbers(entries, "center");
        if (center.size() != 2) {
            throw new JobSpecificationException("control_file", "'center' must be [x, y] in " + controlFile);
        }
        double distance = single(entries, "distance", Double.NaN);
        if (!(distance > 0)) {
            throw new JobSpecificationException("control_file", "'distance' must be a positive number in " + controlFile);
        }
        double wavelength = single(entries, "wavelength", detector.wavelength());
        if (!(wavelength > 0)) {
            throw new JobSpecificationException("control_file", "'wavelength' must be positive in " + controlFile);
        }
        double pixelX = detector.pixelSizeX();
        double pixelY = detector.pixelSizeY();
        if (entries.containsKey("pixelSize")) {
            List<Double> pixel = numbers(entries, "pixelSize");
            if (pixel.size() != 2) {
                throw new JobSpecificationException("control_file", "'pixelSize' must be [x, y] in " + controlFile);
            }
            pixelX = pixel.get(0);
            pixelY = pixel.get(1);
        }
        double azimuthOffset = single(entries, "azmthOff", 0.0);
        return new Calibration(center.get(0), center.get(1), distance, wavelength, pixelX, pixelY, azimuthOffset);
    }

    private static double single(Map<String, String> entries, String key, double fallback) {
        if (!entries.containsKey(key)) {
            return fallback;
        }
        List<Double> values = numbers(entries, key);
        if (values.size() != 1) {
            throw new JobSpecificationException("control_file", "'" + key + "' must be a single number");
        }
        return values.get(0);
    }

    private static List<Double> numbers(Map<String, String> entries, String key) {
        String raw = entries.get(key);
        if (raw == null) {
            throw new JobSpecificationException("control_file", "required key '" + key + "' is missing");
        }
        String stripped = raw.replace("[", "").replace("]", "").replace("(", "").replace(")", "");
        List<Double> values = new ArrayList<>();
        for (String token : stripped.split(",")) {
            if (token.isBlank()) {
                continue;
            }
            try {
                values.add(Double.parseDouble(token.trim()));
            } catch (NumberFormatException e) {
                throw new JobSpecificationException("control_file", "'" + key + "' is not numeric: " + raw, e);
            }
        }
        return values;
    }
}
