package org.transitlog.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration for the CLI.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dpipeline.dataBaseDir=/srv/gtfs})</li>
 *   <li>Environment variables</li>
 *   <li>The selected configuration file</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * <p>
 * Substitutions are resolved only after all layers are stacked, so overriding
 * {@code pipeline.dataBaseDir} moves the store and the archive root that
 * {@code reference.conf} derives from it.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "transitlog.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message
         * @param message the human-readable description
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Locates and loads the configuration file. The first match wins:
     * <ol>
     *   <li>the file passed via {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/transitlog.conf} below the working directory</li>
     *   <li>{@code config/transitlog.conf} below the installation directory</li>
     *   <li>no file: classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the CLI option, or {@code null}
     * @param handler            callback for progress messages
     * @return the resolved configuration
     * @throws IllegalArgumentException            if an explicitly requested file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file specified via --config: "
                + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExists(systemConfigFile, "Configuration file specified via -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: "
                + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file found in current directory: "
                + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + "' found, using default configuration from classpath.");
        return loadDefaults();
    }

    private static void requireExists(File file, String messagePrefix) {
        if (!file.exists()) {
            throw new IllegalArgumentException(messagePrefix + file.getAbsolutePath());
        }
    }

    /**
     * Loads a configuration file layered over the classpath defaults.
     *
     * @param configFile the configuration file
     * @return the resolved configuration
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the classpath defaults, still honoring system properties and environment.
     *
     * @return the resolved configuration
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/transitlog.conf}, where {@code APP_HOME} is the parent
     * of the {@code lib/} directory holding the running jar.
     *
     * @return the file, or {@code null} when not running from an installation or the file is missing
     */
    private static File detectInstallationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        final URL location = codeSource.getLocation();
        final File jar;
        try {
            jar = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return null;
        }
        final File configFile = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
