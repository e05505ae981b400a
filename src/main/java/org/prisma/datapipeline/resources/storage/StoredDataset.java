package org.prisma.datapipeline.resources.storage;

import java.nio.file.Path;

import org.prisma.datapipeline.api.results.Dataset4D;

/**
 * A dataset read back from disk.
 *
 * @param directory the dataset directory (final or staging)
 * @param metadata  its metadata
 * @param dataset   its values; chunks that are absent read as {@code NaN}
 */
public record StoredDataset(Path directory, DatasetMetadata metadata, Dataset4D dataset) {}
