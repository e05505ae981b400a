package org.prisma.cli;

import java.io.File;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.Callable;

import org.prisma.cli.commands.BatchCommand;
import org.prisma.cli.commands.InspectCommand;
import org.prisma.cli.commands.ProcessCommand;
import org.prisma.cli.commands.StrainCommand;
import org.prisma.cli.config.ConfigLoader;
import org.prisma.datapipeline.job.JobSpecificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "prisma",
    mixinStandardHelpOptions = true,
    version = "PRISMA 0.1",
    description = "PRISMA - parallel XRD batch processing and 4D dataset assembly",
    subcommands = {
        ProcessCommand.class,
        BatchCommand.class,
        InspectCommand.class,
        StrainCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes: 0 success, 1 processing failure, 2 configuration error."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION = 2;

    private static final String APPENDER_PROPERTY = "prisma.logging.appender";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/prisma.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log at DEBUG level"
    )
    private boolean verbose;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("prisma");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> exitCodeFor(ex));
        return commandLine;
    }

    /**
     * Maps an exception escaping a command to an exit code. Configuration problems are
     * reported by message only.
     */
    static int exitCodeFor(Exception e) {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        if (e instanceof JobSpecificationException || e instanceof ConfigException) {
            logger.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted");
            return EXIT_FAILURE;
        }
        logger.error("Failed: {}", e.toString());
        logger.debug("Exception details:", e);
        return EXIT_FAILURE;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new ConfigException.Generic(e.getMessage(), e);
        }

        configureLogging(config);
        initialized = true;
    }

    private void configureLogging(Config config) {
        if (config.hasPath("prisma.logging.format")) {
            final String format = config.getString("prisma.logging.format");
            System.setProperty(APPENDER_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("prisma.logging.level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getString("prisma.logging.level"),
                Level.INFO));
        }
        if (config.hasPath("prisma.logging.levels")) {
            for (Map.Entry<String, Object> entry : config.getObject("prisma.logging.levels").unwrapped().entrySet()) {
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(String.valueOf(entry.getValue()), Level.INFO));
            }
        }
        if (verbose) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
        }
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * @return the resolved configuration, loaded on first use.
     * @throws ConfigException if the configuration cannot be found or parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
