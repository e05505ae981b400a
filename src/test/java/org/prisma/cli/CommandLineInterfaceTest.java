package org.prisma.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prisma.datapipeline.job.JobSpecificationException;

import com.typesafe.config.ConfigException;

import picocli.CommandLine;

@Tag("unit")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        commandLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    @DisplayName("All subcommands are registered")
    void registersSubcommands() {
        assertThat(commandLine.getSubcommands()).containsKeys("process", "batch", "inspect", "strain", "help");
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertThat(commandLine.execute()).isEqualTo(CommandLineInterface.EXIT_OK);
    }

    @Test
    void missingRequiredOptionIsAUsageError() {
        int exitCode = commandLine.execute("process");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_CONFIGURATION);
        assertThat(err.toString()).contains("--job");
    }

    @Test
    @DisplayName("A recipe that does not exist exits with the configuration code")
    void missingRecipeExitsWithConfigurationCode() throws Exception {
        Path conf = Files.writeString(tempDir.resolve("prisma.conf"), "prisma.logging.level = \"WARN\"\n");

        int exitCode = commandLine.execute("-c", conf.toString(), "process", "-j",
            tempDir.resolve("absent.json").toString(), "--mode", "local");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_CONFIGURATION);
    }

    @Test
    void missingConfigFileExitsWithConfigurationCode() {
        int exitCode = commandLine.execute("-c", tempDir.resolve("absent.conf").toString(), "batch",
            "-d", tempDir.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_CONFIGURATION);
    }

    @Test
    void inspectRejectsDirectoryWithoutMetadata() {
        int exitCode = commandLine.execute("inspect", tempDir.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(err.toString()).contains("Not a dataset directory");
    }

    @Test
    void exitCodesByExceptionType() {
        assertThat(CommandLineInterface.exitCodeFor(new JobSpecificationException("sample", "bad")))
            .isEqualTo(CommandLineInterface.EXIT_CONFIGURATION);
        assertThat(CommandLineInterface.exitCodeFor(new ConfigException.Missing("prisma.execution")))
            .isEqualTo(CommandLineInterface.EXIT_CONFIGURATION);
        assertThat(CommandLineInterface.exitCodeFor(new IllegalStateException("boom")))
            .isEqualTo(CommandLineInterface.EXIT_FAILURE);
    }
}
