package org.ipod.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the configuration for the CLI.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dipod.orchestration.maxWorkers=4})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The user file is the first of: the {@code --config} option, {@code -Dconfig.file},
 * {@code config/ipod.conf} in the working directory, {@code config/ipod.conf} next to the
 * installation's {@code lib} directory. Substitutions are resolved after all layers are
 * stacked so user overrides reach values referenced from {@code reference.conf}.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "ipod.conf";

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
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads the layered configuration.
     *
     * @param explicitConfigFile File given on the command line, or {@code null}.
     * @param handler            Receives messages about which file was chosen.
     * @return The resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        File userFile = locate(explicitConfigFile, handler);
        if (userFile == null) {
            handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                    + " found in the working or installation directory. Using defaults from the classpath.");
            return loadDefaults();
        }
        return loadFromFile(userFile);
    }

    static Config loadFromFile(File configFile) {
        return compose(ConfigFactory.parseFile(configFile));
    }

    static Config loadDefaults() {
        return compose(ConfigFactory.empty());
    }

    private static Config compose(Config userLayer) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(userLayer)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static File locate(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from --config: " + explicitConfigFile.getAbsolutePath());
            return explicitConfigFile;
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExists(systemConfigFile, "Configuration file from -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return systemConfigFile;
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file from the working directory: "
                    + workingDirFile.getAbsolutePath());
            return workingDirFile;
        }

        File installationFile = installationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from the installation directory: "
                    + installationFile.getAbsolutePath());
            return installationFile;
        }
        return null;
    }

    private static void requireExists(File file, String message) {
        if (!file.exists()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }

    /**
     * Looks for {@code APP_HOME/config/ipod.conf}, where {@code APP_HOME} is the parent of the
     * {@code lib} directory holding the running jar.
     *
     * @return The file, or {@code null} if not running from a jar or the file does not exist.
     */
    private static File installationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        URL location = codeSource.getLocation();
        File jar;
        try {
            jar = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            // Not a file location, e.g. a nested or remote class source
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return null;
        }
        File candidate = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.exists() ? candidate : null;
    }
}
