package org.prisma.cli.commands;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.Callable;

import org.prisma.cli.CommandLineInterface;
import org.prisma.datapipeline.resources.storage.DatasetMetadata;
import org.prisma.datapipeline.resources.storage.DatasetReader;
import org.prisma.datapipeline.resources.storage.DatasetWriter;
import org.prisma.runtime.RunSummary;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints what a stored dataset contains and how its run went.
 */
@Command(
    name = "inspect",
    description = "Print the metadata and run summary of a stored dataset"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        description = "Dataset directory"
    )
    private Path datasetDirectory;

    @Option(
        names = {"--chunks"},
        description = "List every chunk with its checksum"
    )
    private boolean listChunks;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        if (!Files.isRegularFile(datasetDirectory.resolve(DatasetWriter.METADATA_FILE))) {
            spec.commandLine().getErr().println("Not a dataset directory: " + datasetDirectory);
            return CommandLineInterface.EXIT_FAILURE;
        }
        DatasetMetadata metadata = DatasetReader.readMetadata(datasetDirectory);

        out.printf("Dataset:      %s%n", datasetDirectory.toAbsolutePath());
        out.printf("Identity:     %s%s%n", metadata.identity, metadata.finalized ? "" : " (not finalized)");
        out.printf("Parameters:   %s%n", metadata.paramString);
        out.printf("Shape:        peaks=%d frames=%d azimuths=%d measurements=%d%n", metadata.peakCount,
            metadata.frameCount, metadata.azimuthCount, metadata.measurements.size());
        out.printf("Chunks:       %s, %d stored, %d missing%n", Arrays.toString(metadata.chunks),
            metadata.manifest.size(), metadata.missingChunks.size());
        out.printf("Compression:  %s level %d, shuffle block %d bytes%n", metadata.codec, metadata.compressionLevel,
            metadata.shuffleBlockBytes);
        out.printf("Peaks:        %s%n", metadata.peakNames);
        out.printf("Measurements: %s%n", metadata.measurements);
        out.printf("Completed:    %d of %d frames%n", metadata.completedFrames.size(), metadata.frameCount);
        if (metadata.referenceDataset != null) {
            out.printf("Reference:    %s%n", metadata.referenceDataset);
        }
        if (listChunks) {
            for (Map.Entry<String, DatasetMetadata.ChunkEntry> entry : metadata.manifest.entrySet()) {
                out.printf("  %-12s %s %d bytes%n", entry.getKey(), entry.getValue().sha256,
                    entry.getValue().storedBytes);
            }
        }

        Path summaryFile = datasetDirectory.resolve(DatasetWriter.SUMMARY_FILE);
        if (Files.isRegularFile(summaryFile)) {
            RunSummary summary = DatasetReader.GSON.fromJson(Files.readString(summaryFile, StandardCharsets.UTF_8),
                RunSummary.class);
            out.printf("Run:          %s%n", summary.toLogLine());
            summary.missingFrames.forEach((frame, reason) -> out.printf("  missing frame %d: %s%n", frame, reason));
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
