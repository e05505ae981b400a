package org.prisma.datapipeline.resources.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Stream;

import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.resources.storage.DatasetMetadata.ChunkEntry;
import org.prisma.datapipeline.utils.compression.CompressionCodecFactory;
import org.prisma.datapipeline.utils.compression.ICompressionCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Persists one run's dataset as a chunked, compressed array store.
 * <p>
 * All writing happens in a staging directory named after the run's resume key. Checkpoints
 * write the chunks of completed frame-chunk rows together with unfinalized metadata, so an
 * interrupted run leaves a readable partial dataset behind. {@link #finalizeDataset} writes the
 * remaining chunks and moves everything into the final directory.
 * <p>
 * Every file is written to a temporary name and moved into place atomically. A chunk whose
 * uncompressed content matches its manifest checksum is not rewritten, and a chunk that is
 * identical to one of an earlier dataset being extended is hard-linked from it.
 * <p>
 * <b>Thread safety:</b> all public methods are synchronized; checkpoints may be triggered from
 * any worker callback thread.
 */
public class DatasetWriter {

    private static final Logger log = LoggerFactory.getLogger(DatasetWriter.class);

    public static final String DATA_DIR = "data";
    public static final String METADATA_FILE = "metadata.json";
    public static final String SUMMARY_FILE = "summary.json";
    public static final String FRAME_NUMBERS = "frame_numbers";
    public static final String AZIMUTH_ANGLES = "azimuth_angles";

    private final Path zarrRoot;
    private final Path staging;
    private final ChunkLayout layout;
    private final ChunkSerializer serializer;
    private final int writeRetries;

    private final Map<String, ChunkEntry> manifest = new TreeMap<>();
    private final Set<String> missingChunks = new TreeSet<>();
    private StoredDataset prior;
    private boolean sideArraysWritten;

    private int chunksWritten;
    private int chunksSkipped;
    private int chunksLinked;

    /**
     * Opens (or resumes) the staging directory for a run.
     *
     * @param zarrRoot       directory that receives the final dataset directory.
     * @param resumeKey      the run's resume key; names the staging directory.
     * @param layout         chunk layout of the dataset.
     * @param storageOptions the {@code prisma.storage} block.
     * @throws IOException if the staging directory cannot be created.
     */
    public DatasetWriter(Path zarrRoot, String resumeKey, ChunkLayout layout, Config storageOptions) throws IOException {
        this.zarrRoot = zarrRoot;
        this.staging = DatasetLocator.stagingDirectory(zarrRoot, resumeKey);
        this.layout = layout;
        ICompressionCodec codec = CompressionCodecFactory.create(
            storageOptions.hasPath("compression") ? storageOptions.getConfig("compression") : null);
        int blockBytes = storageOptions.hasPath("blockBytes") ? storageOptions.getInt("blockBytes") : 262144;
        this.serializer = new ChunkSerializer(codec, blockBytes);
        this.writeRetries = storageOptions.hasPath("writeRetries") ? storageOptions.getInt("writeRetries") : 3;
        Files.createDirectories(staging.resolve(DATA_DIR));
        adoptStagedChunks();
    }

    private void adoptStagedChunks() throws IOException {
        if (!Files.exists(staging.resolve(METADATA_FILE))) {
            return;
        }
        try {
            DatasetMetadata staged = DatasetReader.readMetadata(staging);
            if (staged.layout().sameGrid(layout) && serializer.codec().getName().equals(staged.codec)
                    && serializer.codec().getLevel() == staged.compressionLevel
                    && serializer.blockBytes() == staged.shuffleBlockBytes) {
                manifest.putAll(staged.manifest);
                log.info("Resuming staging directory {} with {} chunks", staging, manifest.size());
                return;
            }
            log.info("Discarding staging directory {} written with a different layout", staging);
        } catch (IOException e) {
            log.warn("Discarding unreadable staging metadata in {}: {}", staging, e.getMessage());
        }
        deleteChildren(staging.resolve(DATA_DIR));
    }

    /**
     * Registers an earlier dataset with the same resume key; chunks identical to its chunks are
     * linked instead of written.
     *
     * @param earlier the dataset being extended.
     */
    public synchronized void linkFrom(StoredDataset earlier) {
        if (earlier.directory().normalize().equals(staging.normalize())) {
            return;
        }
        this.prior = earlier;
    }

    /**
     * Writes all chunks of one frame-chunk row and refreshes the unfinalized metadata.
     *
     * @param dataset    the dataset; positions of the row must be resolved.
     * @param frameChunk frame chunk row index.
     * @param metadata   metadata to write; storage fields are filled in by the writer.
     * @throws IOException if the metadata cannot be written.
     */
    public synchronized void checkpoint(Dataset4D dataset, int frameChunk, DatasetMetadata metadata)
            throws IOException {
        if (!sideArraysWritten) {
            writeSideArrays(dataset);
        }
        for (int ac = 0; ac < layout.azimuthChunkCount(); ac++) {
            writeChunk(dataset, frameChunk, ac);
        }
        metadata.finalized = false;
        describe(metadata);
        writeJson(staging.resolve(METADATA_FILE), metadata);
        log.debug("Checkpointed frame chunk row {} to {}", frameChunk, staging);
    }

    /**
     * Writes everything still outstanding and moves the dataset into its final directory.
     *
     * @param dataset       the dataset in its final shape.
     * @param metadata      metadata with identity set; storage fields are filled in by the writer.
     * @param directoryName final directory name, {@code {paramString}-{identity}}.
     * @return the final dataset directory.
     * @throws IOException if metadata, side arrays or the move fail.
     */
    public synchronized Path finalizeDataset(Dataset4D dataset, DatasetMetadata metadata, String directoryName)
            throws IOException {
        writeSideArrays(dataset);
        for (int fc = 0; fc < layout.frameChunkCount(); fc++) {
            for (int ac = 0; ac < layout.azimuthChunkCount(); ac++) {
                writeChunk(dataset, fc, ac);
            }
        }
        Set<String> expected = removeStaleChunks();
        metadata.finalized = true;
        describe(metadata);
        writeJson(staging.resolve(METADATA_FILE), metadata);

        Path target = zarrRoot.resolve(directoryName);
        moveInto(target);
        pruneData(target, expected);
        deleteRecursively(staging);
        log.info("Dataset {} finalized: {} chunks written, {} unchanged, {} linked, {} missing", target.getFileName(),
            chunksWritten, chunksSkipped, chunksLinked, missingChunks.size());
        return target;
    }

    /**
     * Fills the storage-related metadata fields.
     */
    public synchronized void describe(DatasetMetadata metadata) {
        metadata.shape = layout.shape();
        metadata.chunks = layout.chunkShape();
        metadata.peakCount = layout.peaks();
        metadata.frameCount = layout.frames();
        metadata.azimuthCount = layout.azimuths();
        metadata.codec = serializer.codec().getName();
        metadata.compressionLevel = serializer.codec().getLevel();
        metadata.shuffleBlockBytes = serializer.blockBytes();
        metadata.manifest = new TreeMap<>(manifest);
        metadata.missingChunks = new ArrayList<>(missingChunks);
    }

    public synchronized List<String> missingChunks() {
        return new ArrayList<>(missingChunks);
    }

    public synchronized int chunksWritten() {
        return chunksWritten;
    }

    public synchronized int chunksSkipped() {
        return chunksSkipped;
    }

    public synchronized int chunksLinked() {
        return chunksLinked;
    }

    public ChunkLayout layout() {
        return layout;
    }

    public Path stagingDirectory() {
        return staging;
    }

    // ===== chunks =====

    private void writeChunk(Dataset4D dataset, int frameChunk, int azimuthChunk) {
        String key = ChunkLayout.chunkKey(frameChunk, azimuthChunk);
        byte[] raw = ChunkSerializer.extract(dataset, layout, frameChunk, azimuthChunk);
        String sha = ChunkSerializer.sha256(raw);
        Path target = chunkPath(staging, key);

        ChunkEntry existing = manifest.get(key);
        if (existing != null && sha.equals(existing.sha256) && Files.exists(target)) {
            chunksSkipped++;
            missingChunks.remove(key);
            return;
        }
        if (linkFromPrior(key, frameChunk, sha, dataset, target)) {
            chunksLinked++;
            missingChunks.remove(key);
            return;
        }

        IOException last = null;
        for (int attempt = 0; attempt <= writeRetries; attempt++) {
            try {
                byte[] stored = serializer.encode(raw, ChunkLayout.ELEMENT_BYTES);
                writeAtomic(target, stored);
                manifest.put(key, new ChunkEntry(sha, stored.length));
                missingChunks.remove(key);
                chunksWritten++;
                return;
            } catch (IOException e) {
                last = e;
                log.debug("Write attempt {} for chunk {} failed: {}", attempt + 1, key, e.getMessage());
            }
        }
        manifest.remove(key);
        missingChunks.add(key);
        log.warn("Chunk {} could not be written after {} attempts, dataset will have a gap: {}", key,
            writeRetries + 1, last.getMessage());
    }

    private boolean linkFromPrior(String key, int frameChunk, String sha, Dataset4D dataset, Path target) {
        if (prior == null) {
            return false;
        }
        DatasetMetadata priorMeta = prior.metadata();
        ChunkEntry entry = priorMeta.manifest.get(key);
        if (entry == null || !sha.equals(entry.sha256) || !priorMeta.layout().sameGrid(layout)
                || !serializer.codec().getName().equals(priorMeta.codec)
                || serializer.codec().getLevel() != priorMeta.compressionLevel
                || serializer.blockBytes() != priorMeta.shuffleBlockBytes) {
            return false;
        }
        int from = layout.frameStart(frameChunk);
        int to = layout.frameEnd(frameChunk);
        int[] priorFrames = prior.dataset().frameNumbers();
        if (to > priorFrames.length
                || !Arrays.equals(priorFrames, from, to, dataset.frameNumbers(), from, to)) {
            return false;
        }
        Path source = chunkPath(prior.directory(), key);
        if (!Files.exists(source)) {
            return false;
        }
        try {
            Files.deleteIfExists(target);
            try {
                Files.createLink(target, source);
            } catch (UnsupportedOperationException | FileSystemException e) {
                log.debug("Hard link for chunk {} not possible, copying: {}", key, e.getMessage());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
            manifest.put(key, new ChunkEntry(sha, entry.storedBytes));
            return true;
        } catch (IOException e) {
            log.debug("Could not reuse chunk {} from {}: {}", key, prior.directory(), e.getMessage());
            return false;
        }
    }

    private Set<String> removeStaleChunks() throws IOException {
        Set<String> expected = new HashSet<>();
        String extension = serializer.codec().getFileExtension();
        for (int fc = 0; fc < layout.frameChunkCount(); fc++) {
            for (int ac = 0; ac < layout.azimuthChunkCount(); ac++) {
                expected.add(ChunkLayout.chunkKey(fc, ac) + extension);
            }
        }
        manifest.keySet().removeIf(key -> !expected.contains(key + extension));
        try (Stream<Path> files = Files.list(staging.resolve(DATA_DIR))) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (!expected.contains(file.getFileName().toString())) {
                    Files.deleteIfExists(file);
                }
            }
        }
        return expected;
    }

    /**
     * Removes chunk files of an earlier grid from a directory that is being overwritten.
     */
    private static void pruneData(Path target, Set<String> expected) throws IOException {
        try (Stream<Path> files = Files.list(target.resolve(DATA_DIR))) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (!expected.contains(file.getFileName().toString())) {
                    log.debug("Removing stale chunk {}", file);
                    Files.deleteIfExists(file);
                }
            }
        }
    }

    private Path chunkPath(Path datasetDirectory, String key) {
        return datasetDirectory.resolve(DATA_DIR).resolve(key + serializer.codec().getFileExtension());
    }

    // ===== side arrays and metadata =====

    private void writeSideArrays(Dataset4D dataset) throws IOException {
        String extension = serializer.codec().getFileExtension();
        writeAtomic(staging.resolve(FRAME_NUMBERS + extension),
            serializer.encode(ChunkSerializer.toBytes(dataset.frameNumbers()), Integer.BYTES));
        writeAtomic(staging.resolve(AZIMUTH_ANGLES + extension),
            serializer.encode(ChunkSerializer.toBytes(dataset.azimuthAngles()), Double.BYTES));
        sideArraysWritten = true;
    }

    /**
     * Serializes a value to pretty-printed JSON and writes it atomically.
     *
     * @param file  target file.
     * @param value value to serialize with Gson.
     * @throws IOException if the file cannot be written.
     */
    public static void writeJson(Path file, Object value) throws IOException {
        writeFileAtomically(file, DatasetReader.GSON.toJson(value).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes bytes to a temporary sibling and moves it into place. Overridable so tests can
     * inject storage failures.
     */
    protected void writeAtomic(Path target, byte[] bytes) throws IOException {
        writeFileAtomically(target, bytes);
    }

    private static void writeFileAtomically(Path target, byte[] bytes) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", temp);
            }
            throw e;
        }
    }

    // ===== directory moves =====

    private void moveInto(Path target) throws IOException {
        Files.createDirectories(target.resolve(DATA_DIR));
        List<Path> files;
        try (Stream<Path> walk = Files.walk(staging)) {
            files = walk.filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString().equals(METADATA_FILE)))
                .toList();
        }
        for (Path source : files) {
            Path destination = target.resolve(staging.relativize(source).toString());
            Files.createDirectories(destination.getParent());
            if (Files.exists(destination) && Files.isSameFile(source, destination)) {
                Files.delete(source);
                continue;
            }
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static void deleteChildren(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Files.deleteIfExists(file);
            }
        }
    }
}
