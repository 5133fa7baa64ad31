package org.jfront.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Responsible for loading the front-end configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "jfront.conf";
    private static final String ENV_PREFIX = "JFRONT_";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code jfront.conf} from the working directory, if present.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    public static Config load(final File configFile) {
        return load(configFile, System.getenv());
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Djfront.parser.debug=true)
     * 2. Environment variables with the {@code JFRONT_} prefix
     * 3. The configuration file
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file. A missing file is skipped.
     * @param environment The environment variables to consider.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile, final Map<String, String> environment) {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config envConfig = fromEnvironment(environment);

        final Config fileConfig;
        if (configFile != null && configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.",
                    configFile == null ? null : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = cliConfig
                .withFallback(envConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }

    /**
     * Maps {@code JFRONT_LEXER_IGNORE__ERRORS=true} to {@code jfront.lexer.ignore-errors = true}:
     * a single underscore separates path elements, a double underscore stands for a dash.
     */
    static Config fromEnvironment(final Map<String, String> environment) {
        final Map<String, String> values = new HashMap<>();
        for (final Map.Entry<String, String> entry : environment.entrySet()) {
            final String name = entry.getKey();
            if (!name.startsWith(ENV_PREFIX) || name.length() == ENV_PREFIX.length()) {
                continue;
            }
            final String path = name.substring(ENV_PREFIX.length())
                    .toLowerCase(Locale.ROOT)
                    .replace("__", "-")
                    .replace('_', '.');
            values.put("jfront." + path, entry.getValue());
        }
        return ConfigFactory.parseMap(values, "environment variables");
    }
}
