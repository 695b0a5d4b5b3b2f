package com.fileprovider.provider.config;

import com.typesafe.config.Config;

/**
 * Identity of the provider reported by the info operation.
 *
 * <p>Example HOCON configuration:</p>
 * <pre>
 * provider {
 *   version = "0.2.1"
 *   type = "file"
 * }
 * </pre>
 */
public class ProviderConfig {

    private final String version;
    private final String type;

    private ProviderConfig(Builder builder) {
        this.version = builder.version;
        this.type = builder.type;
    }

    /**
     * Load configuration from HOCON config.
     */
    public static ProviderConfig fromConfig(Config config) {
        Builder builder = builder();

        if (config.hasPath("provider.version")) {
            builder.version(config.getString("provider.version"));
        }
        if (config.hasPath("provider.type")) {
            builder.type(config.getString("provider.type"));
        }

        return builder.build();
    }

    public String getVersion() {
        return version;
    }

    public String getType() {
        return type;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String version = "0.2.1";
        private String type = "file";

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public ProviderConfig build() {
            return new ProviderConfig(this);
        }
    }
}
