package com.fileprovider.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Loads and merges the provider process configuration from multiple sources.
 *
 * <p>Configuration is layered in the following order (later sources override earlier):
 * <ol>
 *   <li>reference.conf files from the classpath (module defaults)</li>
 *   <li>application.conf from the classpath</li>
 *   <li>Config files passed to {@link #load(String...)} or {@link #load(List)}, in order</li>
 *   <li>System properties</li>
 *   <li>Environment variables</li>
 * </ol>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Config config = ConfigLoader.load("provider.conf");
 * ProviderConfig providerConfig = ProviderConfig.fromConfig(config);
 *
 * Config isolated = ConfigLoader.builder()
 *     .addFile("provider.conf")
 *     .withEnvironmentVariables(false)
 *     .build();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Load configuration with additional config files.
     *
     * @param configFiles paths to config files
     * @return merged configuration
     */
    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    /**
     * Load configuration with additional config files.
     *
     * @param configFiles list of paths to config files
     * @return merged configuration
     */
    public static Config load(List<String> configFiles) {
        return builder().addFiles(configFiles).build();
    }

    /**
     * Create a builder for more control over configuration loading.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ConfigLoader with fine-grained control over loading.
     */
    public static final class Builder {
        private final List<String> configFiles = new ArrayList<>();
        private boolean includeSystemProperties = true;
        private boolean includeEnvironmentVariables = true;
        private boolean includeApplicationConf = true;

        private Builder() {}

        /**
         * Add a config file to load.
         */
        public Builder addFile(String path) {
            this.configFiles.add(path);
            return this;
        }

        /**
         * Add multiple config files to load.
         */
        public Builder addFiles(List<String> paths) {
            this.configFiles.addAll(paths);
            return this;
        }

        /**
         * Whether to apply system properties on top.
         * Default: true
         */
        public Builder withSystemProperties(boolean include) {
            this.includeSystemProperties = include;
            return this;
        }

        /**
         * Whether to apply environment variables on top.
         * Default: true
         */
        public Builder withEnvironmentVariables(boolean include) {
            this.includeEnvironmentVariables = include;
            return this;
        }

        /**
         * Whether to load application.conf from classpath.
         * Default: true
         */
        public Builder withApplicationConf(boolean include) {
            this.includeApplicationConf = include;
            return this;
        }

        /**
         * Build the merged configuration.
         *
         * @throws ConfigurationException if a file cannot be parsed or a substitution cannot be resolved
         */
        public Config build() {
            Config config = ConfigFactory.defaultReference();

            if (includeApplicationConf) {
                config = ConfigFactory.defaultApplication().withFallback(config);
            }

            for (String filePath : configFiles) {
                config = loadConfigFile(filePath).withFallback(config);
                log.info("Loaded config file: {}", filePath);
            }

            if (includeSystemProperties) {
                config = ConfigFactory.systemProperties().withFallback(config);
            }
            if (includeEnvironmentVariables) {
                config = ConfigFactory.systemEnvironment().withFallback(config);
            }

            try {
                return config.resolve(ConfigResolveOptions.defaults());
            } catch (ConfigException e) {
                throw new ConfigurationException("Failed to resolve configuration: " + e.getMessage(), e);
            }
        }

        private Config loadConfigFile(String path) {
            File file = new File(path);
            if (!file.exists()) {
                Config classpathConfig = ConfigFactory.parseResources(path, ConfigParseOptions.defaults());
                if (classpathConfig.isEmpty()) {
                    throw new ConfigurationException("Config file not found: " + path);
                }
                return classpathConfig;
            }
            try {
                return ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setAllowMissing(false));
            } catch (ConfigException e) {
                log.error("Failed to parse config file: {}", path, e);
                throw new ConfigurationException("Failed to parse config file: " + path, e);
            }
        }
    }

    /**
     * Exception thrown when configuration loading fails.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
