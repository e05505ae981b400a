package org.prisma.datapipeline.resources.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.gson.annotations.SerializedName;

/**
 * Contents of a dataset's {@code metadata.json}.
 * <p>
 * Written on every checkpoint with {@code finalized = false} and once more at finalize time,
 * when {@code identity} is filled in.
 */
public class DatasetMetadata {

    public static final int FORMAT_VERSION = 1;

    public int formatVersion = FORMAT_VERSION;

    /** Short parameter hash including the frame range; null until finalized. */
    public String identity;

    /** Parameter hash without the frame range; shared by datasets that can extend each other. */
    public String resumeKey;

    /** Human-readable parameter label used in the directory name. */
    public String paramString;

    public boolean finalized;

    /** ISO-8601 creation timestamp. */
    public String createdAt;

    public List<String> dimensions = List.of("peak", "frame", "azimuth", "measurement");

    public String dtype = "<f4";

    public String order = "C";

    /** Array shape in dimension order. */
    public int[] shape;

    /** Nominal chunk shape in dimension order; edge chunks are trimmed. */
    public int[] chunks;

    public String codec;

    public int compressionLevel;

    /** Byte-shuffle block size; the type size is the element size of each array. */
    public int shuffleBlockBytes;

    public int peakCount;

    public int frameCount;

    public int azimuthCount;

    public List<String> peakNames = new ArrayList<>();

    public List<Integer> millerIndices = new ArrayList<>();

    public List<Double> peakPositions = new ArrayList<>();

    public List<String> measurements = new ArrayList<>();

    @SerializedName("col_idx")
    public Map<String, Integer> colIdx = new LinkedHashMap<>();

    /** Global indices of frames whose values are stored. */
    public List<Integer> completedFrames = new ArrayList<>();

    /** Keys of chunks that could not be written. */
    public List<String> missingChunks = new ArrayList<>();

    /** Chunk key to checksum and stored size. */
    public Map<String, ChunkEntry> manifest = new TreeMap<>();

    /** Mean of every measurement column over the reference dataset, when one was used. */
    public Map<String, Double> referenceValues = new LinkedHashMap<>();

    /** Path of the reference dataset used for strain, when one was used. */
    public String referenceDataset;

    /** Normalized job parameters. */
    public Map<String, Object> parameters = new TreeMap<>();

    /**
     * One chunk manifest entry.
     */
    public static class ChunkEntry {

        /** SHA-256 of the uncompressed chunk bytes. */
        public String sha256;

        public long storedBytes;

        public ChunkEntry() {
        }

        public ChunkEntry(String sha256, long storedBytes) {
            this.sha256 = sha256;
            this.storedBytes = storedBytes;
        }
    }

    /**
     * @return the chunk layout described by {@link #shape} and {@link #chunks}.
     */
    public ChunkLayout layout() {
        return new ChunkLayout(shape[0], shape[1], shape[2], shape[3], chunks[1], chunks[2]);
    }
}
