package org.prisma.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Builds the application configuration for every CLI entry point.
 * <p>
 * Layers, highest priority first:
 * <ol>
 *   <li>Java system properties ({@code -Dprisma.execution.maxRetries=5})</li>
 *   <li>environment variables</li>
 *   <li>the selected {@code prisma.conf}</li>
 *   <li>{@code reference.conf} from the classpath</li>
 * </ol>
 * Substitutions are resolved after layering, so an override reaches every value that
 * references it.
 */
public final class ConfigLoader {

    static final String CONFIG_FILE_NAME = "prisma.conf";
    static final String HOME_VARIABLE = "PRISMA_HOME";

    private static final String CONFIG_DIR = "config";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is selected. Called before logging
     * is configured, so the CLI decides how to print them.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    private record Candidate(File file, String origin) {}

    /**
     * Selects the configuration file and loads it. The first match wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file given with {@code -Dconfig.file}</li>
     *   <li>{@code config/prisma.conf} below the working directory</li>
     *   <li>{@code $PRISMA_HOME/config/prisma.conf}</li>
     *   <li>{@code config/prisma.conf} of the installation the running jar belongs to</li>
     * </ol>
     * Without any of them only the built-in defaults apply.
     *
     * @param explicitConfigFile file from {@code --config}, or {@code null}.
     * @param handler            receives resolution messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return load(requireExisting(explicitConfigFile, "--config"), "specified via --config", handler);
        }
        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return load(requireExisting(new File(property).getAbsoluteFile(), "-Dconfig.file"),
                "specified via -Dconfig.file", handler);
        }
        for (Candidate candidate : discoveryCandidates()) {
            if (candidate.file().isFile()) {
                return load(candidate.file(), candidate.origin(), handler);
            }
        }
        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using built-in defaults.");
        return loadDefaults();
    }

    /**
     * @param configFile the user configuration file.
     * @return the file layered between overrides and {@code reference.conf}, resolved.
     */
    static Config loadFromFile(final File configFile) {
        return overrides()
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * @return {@code reference.conf} with system property and environment overrides, resolved.
     */
    public static Config loadDefaults() {
        return overrides()
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }

    private static Config load(File file, String origin, ConfigMessageHandler handler) {
        handler.log(MessageLevel.INFO, "Using configuration file " + origin + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    private static File requireExisting(File file, String option) {
        if (!file.exists()) {
            throw new IllegalArgumentException("Configuration file given with " + option + " not found: "
                + file.getAbsolutePath());
        }
        return file;
    }

    private static List<Candidate> discoveryCandidates() {
        List<Candidate> candidates = new ArrayList<>();
        candidates.add(new Candidate(new File(CONFIG_DIR, CONFIG_FILE_NAME), "found in current directory"));
        String home = System.getenv(HOME_VARIABLE);
        if (home != null && !home.isBlank()) {
            candidates.add(new Candidate(inConfigDir(new File(home)), "found via " + HOME_VARIABLE));
        }
        File installation = installationDirectory();
        if (installation != null) {
            candidates.add(new Candidate(inConfigDir(installation), "from installation directory"));
        }
        return candidates;
    }

    private static File inConfigDir(File home) {
        return new File(new File(home, CONFIG_DIR), CONFIG_FILE_NAME);
    }

    /**
     * The distribution layout is {@code APP_HOME/lib/prisma-xrd.jar}. When running from a classes
     * directory there is no installation.
     */
    private static File installationDirectory() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        try {
            File jar = new File(codeSource.getLocation().toURI());
            if (!jar.isFile() || jar.getParentFile() == null) {
                return null;
            }
            return jar.getParentFile().getParentFile();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }
}
