package org.starledger.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Locates and loads the HOCON configuration of the command line tool.
 * <p>
 * Layers, highest precedence first: system properties, environment variables, the user configuration file,
 * {@code reference.conf}. Substitutions are resolved after all layers are stacked, so overriding
 * {@code starledger.import.threads} in the user file also changes every default that refers to it.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "starledger.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives the progress messages of {@link #resolve}. The caller decides whether they are logged or printed.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Finds the configuration file and loads it. The first hit wins:
     * <ol>
     *   <li>{@code explicitConfigFile}, from {@code --config}</li>
     *   <li>{@code -Dconfig.file}</li>
     *   <li>{@code config/starledger.conf} in the working directory</li>
     *   <li>{@code config/starledger.conf} next to the installation's {@code lib} directory</li>
     *   <li>none, {@code reference.conf} alone</li>
     * </ol>
     *
     * @param explicitConfigFile File named on the command line, or {@code null}.
     * @param handler            Receives which file was picked.
     * @return The resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from --config: "
                    + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            File file = new File(property).getAbsoluteFile();
            requireExists(file, "Configuration file from -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + file.getAbsolutePath());
            return loadFromFile(file);
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file in working directory: "
                    + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        File installed = detectInstallationConfigFile();
        if (installed != null) {
            handler.log(MessageLevel.INFO, "Using configuration file of the installation: "
                    + installed.getAbsolutePath());
            return loadFromFile(installed);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found, using built-in defaults");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static void requireExists(File file, String message) {
        if (!file.exists()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }

    /**
     * {@code APP_HOME/config/starledger.conf}, where the running jar sits in {@code APP_HOME/lib}.
     *
     * @return The file, or {@code null} when not running from a jar or the file is absent.
     */
    private static File detectInstallationConfigFile() {
        try {
            CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
            if (codeSource == null || codeSource.getLocation() == null) {
                return null;
            }
            File jar = new File(codeSource.getLocation().toURI());
            if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
                return null;
            }
            File candidate = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
            return candidate.exists() ? candidate : null;
        } catch (URISyntaxException | SecurityException e) {
            return null;
        }
    }
}
