package org.prisma.datapipeline.resources.storage;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves dataset locations below a home directory and finds earlier datasets that a run can
 * extend.
 * <p>
 * Layout: {@code {home}/Processed/{yyyy-MM-dd}/{sample}/Zarr/{paramString}-{identity}/}.
 */
public final class DatasetLocator {

    private static final Logger log = LoggerFactory.getLogger(DatasetLocator.class);

    public static final String PROCESSED_DIR = "Processed";
    public static final String ZARR_DIR = "Zarr";
    public static final String STAGING_PREFIX = ".staging-";

    private DatasetLocator() {
    }

    /**
     * @return the directory holding all datasets of a sample processed on the given day.
     */
    public static Path zarrRoot(Path home, LocalDate date, String sample) {
        return home.resolve(PROCESSED_DIR).resolve(date.format(DateTimeFormatter.ISO_LOCAL_DATE))
            .resolve(sample).resolve(ZARR_DIR);
    }

    public static Path stagingDirectory(Path zarrRoot, String resumeKey) {
        return zarrRoot.resolve(STAGING_PREFIX + resumeKey);
    }

    /**
     * Finds every dataset of a sample, on any day, whose resume key matches. Staging
     * directories left by interrupted runs are included.
     *
     * @param home      home directory.
     * @param sample    sample identifier.
     * @param resumeKey resume key to match.
     * @return matching dataset directories with their metadata.
     */
    public static List<Candidate> findByResumeKey(Path home, String sample, String resumeKey) {
        List<Candidate> candidates = new ArrayList<>();
        Path processed = home.resolve(PROCESSED_DIR);
        if (!Files.isDirectory(processed)) {
            return candidates;
        }
        try (DirectoryStream<Path> days = Files.newDirectoryStream(processed, Files::isDirectory)) {
            for (Path day : days) {
                Path zarr = day.resolve(sample).resolve(ZARR_DIR);
                if (Files.isDirectory(zarr)) {
                    scan(zarr, resumeKey, candidates);
                }
            }
        } catch (IOException e) {
            log.warn("Cannot scan {} for earlier datasets: {}", processed, e.getMessage());
        }
        return candidates;
    }

    private static void scan(Path zarr, String resumeKey, List<Candidate> candidates) throws IOException {
        try (DirectoryStream<Path> datasets = Files.newDirectoryStream(zarr, Files::isDirectory)) {
            for (Path dir : datasets) {
                if (!Files.exists(dir.resolve(DatasetWriter.METADATA_FILE))) {
                    continue;
                }
                try {
                    DatasetMetadata metadata = DatasetReader.readMetadata(dir);
                    if (resumeKey.equals(metadata.resumeKey)) {
                        candidates.add(new Candidate(dir, metadata));
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable dataset {}: {}", dir, e.getMessage());
                }
            }
        }
    }

    /**
     * @param directory dataset directory
     * @param metadata  its metadata
     */
    public record Candidate(Path directory, DatasetMetadata metadata) {}
}
