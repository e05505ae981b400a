package org.prisma.datapipeline.resources.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.utils.compression.CompressionCodecFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Reads datasets written by {@link DatasetWriter}, finalized or still staging.
 */
public final class DatasetReader {

    private static final Logger log = LoggerFactory.getLogger(DatasetReader.class);

    /** Gson used for every JSON file of a dataset. */
    public static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .disableHtmlEscaping()
        .create();

    private DatasetReader() {
    }

    /**
     * @param directory dataset directory.
     * @return its metadata.
     * @throws IOException if the file is missing or not valid metadata.
     */
    public static DatasetMetadata readMetadata(Path directory) throws IOException {
        Path file = directory.resolve(DatasetWriter.METADATA_FILE);
        String json = Files.readString(file, StandardCharsets.UTF_8);
        try {
            DatasetMetadata metadata = GSON.fromJson(json, DatasetMetadata.class);
            if (metadata == null || metadata.shape == null || metadata.chunks == null) {
                throw new IOException("Incomplete metadata in " + file);
            }
            return metadata;
        } catch (JsonParseException e) {
            throw new IOException("Malformed metadata in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads the whole dataset into memory.
     *
     * @param directory dataset directory.
     * @return the stored dataset.
     * @throws ChunkCorruptedException if a present chunk cannot be decoded.
     * @throws IOException             if metadata or side arrays cannot be read.
     */
    public static StoredDataset read(Path directory) throws IOException {
        DatasetMetadata metadata = readMetadata(directory);
        ChunkSerializer serializer = new ChunkSerializer(
            CompressionCodecFactory.forStored(metadata.codec, metadata.compressionLevel), metadata.shuffleBlockBytes);
        ChunkLayout layout = metadata.layout();
        String extension = serializer.codec().getFileExtension();

        int[] frameNumbers = ChunkSerializer.toInts(readSide(directory, DatasetWriter.FRAME_NUMBERS + extension,
            serializer, Integer.BYTES, (long) layout.frames() * Integer.BYTES));
        double[] azimuthAngles = ChunkSerializer.toDoubles(readSide(directory,
            DatasetWriter.AZIMUTH_ANGLES + extension, serializer, Double.BYTES, (long) layout.azimuths() * Double.BYTES));

        Dataset4D dataset = new Dataset4D(layout.peaks(), frameNumbers, azimuthAngles, metadata.measurements);
        int absent = 0;
        for (int fc = 0; fc < layout.frameChunkCount(); fc++) {
            for (int ac = 0; ac < layout.azimuthChunkCount(); ac++) {
                String key = ChunkLayout.chunkKey(fc, ac);
                Path file = directory.resolve(DatasetWriter.DATA_DIR).resolve(key + extension);
                if (!Files.exists(file)) {
                    absent++;
                    continue;
                }
                byte[] raw = serializer.decode(Files.readAllBytes(file), ChunkLayout.ELEMENT_BYTES,
                    layout.chunkBytes(fc, ac), key);
                ChunkSerializer.insert(dataset, layout, fc, ac, raw);
            }
        }
        if (absent > 0) {
            log.debug("{} of {} chunks absent in {}", absent, layout.chunkCount(), directory);
        }
        return new StoredDataset(directory, metadata, dataset);
    }

    private static byte[] readSide(Path directory, String name, ChunkSerializer serializer, int typeSize,
                                   long expected) throws IOException {
        Path file = directory.resolve(name);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return serializer.decode(Files.readAllBytes(file), typeSize, expected, name);
    }
}
