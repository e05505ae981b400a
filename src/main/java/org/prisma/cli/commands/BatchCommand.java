package org.prisma.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import org.prisma.cli.CommandLineInterface;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.job.JobSpecificationException;
import org.prisma.datapipeline.job.JobSpecificationLoader;
import org.prisma.runtime.ExecutionContext;
import org.prisma.runtime.ExecutionMode;
import org.prisma.runtime.ExecutionModeSelector;
import org.prisma.runtime.JobRunner;
import org.prisma.runtime.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Processes every recipe in a directory, one after the other, in local mode.
 */
@Command(
    name = "batch",
    description = "Process every *.json recipe in a directory"
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    static final String PROCESSED_DIR = "processed";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Option(
        names = {"-d", "--directory"},
        description = "Recipe directory (default: recipes)"
    )
    private Path directory = Path.of("recipes");

    @Option(
        names = {"--move-processed"},
        description = "Move successfully processed recipes to the '" + PROCESSED_DIR + "' subdirectory"
    )
    private boolean moveProcessed;

    @Option(
        names = {"--create-examples"},
        description = "Write example recipes into the recipe directory and exit"
    )
    private boolean createExamples;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        if (createExamples) {
            for (Path file : writeExamples(directory)) {
                out.println("Created " + file);
            }
            out.println("Edit the example recipes with your actual paths and parameters.");
            return CommandLineInterface.EXIT_OK;
        }

        Config config = parent.getConfig();
        List<Path> recipes = listRecipes(directory);
        if (recipes.isEmpty()) {
            out.println("No recipes found in " + directory.toAbsolutePath()
                + " (use --create-examples to generate sample recipes)");
            return CommandLineInterface.EXIT_OK;
        }

        ExecutionContext context = new ExecutionModeSelector(config, Map.of()).select(ExecutionMode.LOCAL);
        JobRunner runner = new JobRunner(config);
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (int i = 0; i < recipes.size(); i++) {
            Path recipe = recipes.get(i);
            String name = recipe.getFileName().toString();
            log.info("Recipe {}/{}: {}", i + 1, recipes.size(), name);
            try {
                JobSpecification job = JobSpecificationLoader.load(recipe);
                RunSummary summary = runner.run(job, context);
                succeeded.add(name + " -> " + summary.path);
                if (moveProcessed) {
                    Path processed = Files.createDirectories(directory.resolve(PROCESSED_DIR));
                    Files.move(recipe, processed.resolve(name), StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (JobSpecificationException e) {
                log.error("Configuration error in {}: {}", name, e.getMessage());
                failed.put(name, e.getMessage());
            } catch (IOException | RuntimeException e) {
                log.error("Processing {} failed: {}", name, e.toString());
                log.debug("Exception details:", e);
                failed.put(name, e.toString());
            }
        }

        out.printf("%n=== Batch summary ===%n");
        out.printf("Succeeded: %d%n", succeeded.size());
        succeeded.forEach(line -> out.println("  " + line));
        out.printf("Failed:    %d%n", failed.size());
        failed.forEach((name, reason) -> out.println("  " + name + ": " + reason));
        return failed.isEmpty() ? CommandLineInterface.EXIT_OK : CommandLineInterface.EXIT_FAILURE;
    }

    static List<Path> listRecipes(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .sorted()
                .toList();
        }
    }

    /**
     * Writes the example recipes.
     *
     * @param directory target directory, created if needed.
     * @return the files written.
     * @throws IOException if a file cannot be written.
     */
    static List<Path> writeExamples(Path directory) throws IOException {
        Files.createDirectories(directory);
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        List<Path> written = new ArrayList<>();

        Map<String, Object> single = exampleRecipe("A1", "Standard", "019", 5, 0, 100, -110, 110,
            List.of(peak("Martensite 211", 211, 8.46, 8.2, 8.8)), "Example A1 single peak");
        Map<String, Object> multi = exampleRecipe("B2", "Speed", "009", 10, 500, 600, -90, 90,
            List.of(peak("Martensite 211", 211, 8.46, 8.2, 8.8), peak("Austenite 110", 110, 7.32, 7.1, 7.5)),
            "Example B2 multi-peak analysis");

        for (Map.Entry<String, Map<String, Object>> example : Map.of(
                "A1_Standard_CONT_211", single, "B2_Speed_CONT_MultiPeak", multi).entrySet()) {
            Path file = directory.resolve(example.getKey() + "_" + timestamp + ".json");
            Files.writeString(file, GSON.toJson(example.getValue()), StandardCharsets.UTF_8);
            written.add(file);
        }
        written.sort(null);
        return written;
    }

    private static Map<String, Object> exampleRecipe(String sample, String setting, String exposure, double spacing,
                                                     int frameStart, int frameEnd, double azStart, double azEnd,
                                                     List<Map<String, Object>> peaks, String notes) {
        Map<String, Object> recipe = new LinkedHashMap<>();
        recipe.put("sample", sample);
        recipe.put("setting", setting);
        recipe.put("stage", "CONT");
        recipe.put("home_dir", "/path/to/home");
        recipe.put("images_path", "/path/to/images");
        recipe.put("control_file", "/path/to/control.imctrl");
        recipe.put("mask_file", "/path/to/mask.immask");
        recipe.put("exposure", exposure);
        recipe.put("step", 1);
        recipe.put("spacing", spacing);
        recipe.put("frame_start", frameStart);
        recipe.put("frame_end", frameEnd);
        recipe.put("az_start", azStart);
        recipe.put("az_end", azEnd);
        recipe.put("active_peaks", peaks);
        recipe.put("notes", notes);
        return recipe;
    }

    private static Map<String, Object> peak(String name, int miller, double position, double lower, double upper) {
        Map<String, Object> peak = new LinkedHashMap<>();
        peak.put("name", name);
        peak.put("miller_index", miller);
        peak.put("position", position);
        peak.put("limits", List.of(lower, upper));
        return peak;
    }
}
