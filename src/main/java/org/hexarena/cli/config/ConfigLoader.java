package org.hexarena.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Builds the engine configuration for the command-line front end.
 * <p>
 * Sources, highest precedence first: Java system properties, environment variables, the user file
 * (if any), then {@code reference.conf}. Substitutions are resolved after the layers are composed,
 * so an override reaches every value that refers to it.
 */
public final class ConfigLoader {

    /** User file looked up in the working directory when none is named. */
    static final File DEFAULT_FILE = new File("config", "hexarena.conf");

    private ConfigLoader() {
    }

    /**
     * A composed configuration and the user file it includes.
     *
     * @param config the resolved configuration
     * @param file   the user file layered over the defaults, or {@code null} if there was none
     */
    public record LoadedConfig(Config config, File file) {

        public boolean isDefaultsOnly() {
            return file == null;
        }
    }

    /**
     * Picks the user file, first match wins: {@code explicitFile}, then {@code -Dconfig.file}, then
     * {@link #DEFAULT_FILE} if it exists. Without any, only the defaults are used.
     *
     * @param explicitFile file from the command line, or {@code null}
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved
     */
    public static LoadedConfig load(final File explicitFile) {
        File file = explicitFile;
        if (file == null) {
            final String property = System.getProperty("config.file");
            if (property != null && !property.isBlank()) {
                file = new File(property);
            }
        }
        if (file != null) {
            if (!file.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + file.getAbsolutePath());
            }
            return new LoadedConfig(layered(file), file.getAbsoluteFile());
        }
        if (DEFAULT_FILE.isFile()) {
            return new LoadedConfig(layered(DEFAULT_FILE), DEFAULT_FILE.getAbsoluteFile());
        }
        return new LoadedConfig(layered(null), null);
    }

    /**
     * Composes the layers around an optional user file.
     */
    static Config layered(final File file) {
        Config layers = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            layers = layers.withFallback(ConfigFactory.parseFile(file));
        }
        return layers.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
    }
}
