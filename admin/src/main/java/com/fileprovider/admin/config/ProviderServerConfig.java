package com.fileprovider.admin.config;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Configuration for the provider HTTP server.
 *
 * <p>Example HOCON configuration:</p>
 * <pre>
 * server {
 *   host = "127.0.0.1"
 *   port = 0
 *   context-path = "/api"
 *   cors {
 *     enabled = false
 *     allowed-origins = ["*"]
 *   }
 * }
 * </pre>
 */
public class ProviderServerConfig {

    private final String host;
    private final int port;
    private final String contextPath;
    private final boolean corsEnabled;
    private final List<String> corsAllowedOrigins;

    private ProviderServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.contextPath = builder.contextPath;
        this.corsEnabled = builder.corsEnabled;
        this.corsAllowedOrigins = List.copyOf(builder.corsAllowedOrigins);
    }

    /**
     * Load configuration from HOCON config.
     */
    public static ProviderServerConfig fromConfig(Config config) {
        Builder builder = builder();

        if (config.hasPath("server.host")) {
            builder.host(config.getString("server.host"));
        }
        if (config.hasPath("server.port")) {
            builder.port(config.getInt("server.port"));
        }
        if (config.hasPath("server.context-path")) {
            builder.contextPath(config.getString("server.context-path"));
        }
        if (config.hasPath("server.cors.enabled")) {
            builder.corsEnabled(config.getBoolean("server.cors.enabled"));
        }
        if (config.hasPath("server.cors.allowed-origins")) {
            builder.corsAllowedOrigins(config.getStringList("server.cors.allowed-origins"));
        }

        return builder.build();
    }

    public String getHost() {
        return host;
    }

    /**
     * @return the configured port, 0 for any free port
     */
    public int getPort() {
        return port;
    }

    public String getContextPath() {
        return contextPath;
    }

    public boolean isCorsEnabled() {
        return corsEnabled;
    }

    public List<String> getCorsAllowedOrigins() {
        return corsAllowedOrigins;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "127.0.0.1";
        private int port = 0;
        private String contextPath = "/api";
        private boolean corsEnabled = false;
        private List<String> corsAllowedOrigins = List.of("*");

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder contextPath(String contextPath) {
            // "/" and "" both mean no prefix
            String trimmed = contextPath.endsWith("/")
                    ? contextPath.substring(0, contextPath.length() - 1)
                    : contextPath;
            this.contextPath = trimmed.isEmpty() || trimmed.startsWith("/") ? trimmed : "/" + trimmed;
            return this;
        }

        public Builder corsEnabled(boolean corsEnabled) {
            this.corsEnabled = corsEnabled;
            return this;
        }

        public Builder corsAllowedOrigins(List<String> corsAllowedOrigins) {
            this.corsAllowedOrigins = corsAllowedOrigins;
            return this;
        }

        public ProviderServerConfig build() {
            return new ProviderServerConfig(this);
        }
    }
}
