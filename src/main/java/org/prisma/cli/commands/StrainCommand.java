package org.prisma.cli.commands;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;

import org.prisma.cli.CommandLineInterface;
import org.prisma.datapipeline.api.results.Dataset4D;
import org.prisma.datapipeline.resources.storage.ChunkLayout;
import org.prisma.datapipeline.resources.storage.DatasetMetadata;
import org.prisma.datapipeline.resources.storage.DatasetReader;
import org.prisma.datapipeline.resources.storage.DatasetWriter;
import org.prisma.datapipeline.resources.storage.StoredDataset;
import org.prisma.datapipeline.services.StrainPostProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Recomputes the strain columns of a stored dataset, optionally against a different reference
 * dataset, and rewrites the dataset in place.
 */
@Command(
    name = "strain",
    description = "Recompute strain of a stored dataset in place"
)
public class StrainCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StrainCommand.class);

    @Option(
        names = {"-d", "--dataset"},
        required = true,
        description = "Dataset directory to update"
    )
    private Path dataset;

    @Option(
        names = {"-r", "--reference"},
        description = "Reference dataset directory; without it the strain columns are cleared"
    )
    private Path reference;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        Config config = parent.getConfig();
        Config storage = config.hasPath("prisma.storage") ? config.getConfig("prisma.storage") : ConfigFactory.empty();
        Config postprocessing = config.hasPath("prisma.postprocessing")
            ? config.getConfig("prisma.postprocessing")
            : ConfigFactory.empty();

        if (!Files.isRegularFile(dataset.resolve(DatasetWriter.METADATA_FILE))) {
            spec.commandLine().getErr().println("Not a dataset directory: " + dataset);
            return CommandLineInterface.EXIT_FAILURE;
        }
        StoredDataset stored = DatasetReader.read(dataset);
        if (!stored.metadata().finalized) {
            spec.commandLine().getErr().println("Dataset is not finalized: " + dataset);
            return CommandLineInterface.EXIT_FAILURE;
        }
        Dataset4D referenceData = null;
        if (reference != null) {
            referenceData = DatasetReader.read(reference).dataset();
            log.info("Using reference dataset {} with {} frames", reference, referenceData.frames());
        }

        StrainPostProcessor.Result result = new StrainPostProcessor(postprocessing).apply(stored.dataset(),
            referenceData);
        Dataset4D updated = result.dataset();

        DatasetMetadata metadata = stored.metadata();
        metadata.measurements = new ArrayList<>(updated.columns());
        metadata.colIdx = new LinkedHashMap<>();
        for (int i = 0; i < updated.columns().size(); i++) {
            metadata.colIdx.put(updated.columns().get(i), i);
        }
        metadata.referenceValues = result.referenceValues();
        metadata.referenceDataset = reference == null ? null : reference.toAbsolutePath().toString();

        long target = storage.hasPath("targetChunkBytes") ? storage.getLong("targetChunkBytes") : 100L * 1024 * 1024;
        ChunkLayout layout = ChunkLayout.plan(updated.peaks(), updated.frames(), updated.azimuths(),
            updated.measurements(), target);
        Path absolute = dataset.toAbsolutePath().normalize();
        DatasetWriter writer = new DatasetWriter(absolute.getParent(), metadata.resumeKey, layout, storage);
        writer.linkFrom(stored);
        Path written = writer.finalizeDataset(updated, metadata, absolute.getFileName().toString());

        spec.commandLine().getOut().printf("Updated %s: %d chunks rewritten, %d unchanged%n", written,
            writer.chunksWritten(), writer.chunksLinked() + writer.chunksSkipped());
        return writer.missingChunks().isEmpty() ? CommandLineInterface.EXIT_OK : CommandLineInterface.EXIT_FAILURE;
    }
}
