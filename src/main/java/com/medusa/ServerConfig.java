package com.medusa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Properties;

/**
 * Server process configuration.
 * <p>
 * Each setting is read from an environment variable, then from a system property,
 * then falls back to its default. Invalid values are logged and ignored.
 */
public final class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 2312;
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_METRICS_PORT = 9091;

    private final String host;
    private final int port;
    private final int maxConnections;
    private final Duration connectionTimeout;
    private final boolean timeoutsEnabled;
    private final boolean metricsEnabled;
    private final int metricsPort;

    private ServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.maxConnections = builder.maxConnections;
        this.connectionTimeout = builder.connectionTimeout;
        this.timeoutsEnabled = builder.timeoutsEnabled;
        this.metricsEnabled = builder.metricsEnabled;
        this.metricsPort = builder.metricsPort;
    }

    /**
     * Load the configuration from the process environment and system properties.
     */
    public static ServerConfig fromEnvironment() {
        return fromSources(System.getenv(), System.getProperties());
    }

    /**
     * Load the configuration from explicit sources.
     *
     * @param env        environment variables, consulted first
     * @param properties system properties, consulted second
     * @return the resolved configuration
     */
    static ServerConfig fromSources(Map<String, String> env, Properties properties) {
        Source source = new Source(env, properties);
        Builder builder = builder();

        String host = source.get("MEDUSA_HOST", "medusa.host");
        if (host != null) {
            builder.host(host);
        }
        source.getInt("MEDUSA_PORT", "medusa.port", 1, 65535).ifPresent(builder::port);
        source.getInt("MEDUSA_MAX_CONNECTIONS", "medusa.max.connections", 1, Integer.MAX_VALUE)
                .ifPresent(builder::maxConnections);
        source.getInt("MEDUSA_TIMEOUT", "medusa.timeout", 1, Integer.MAX_VALUE)
                .ifPresent(seconds -> builder.connectionTimeout(Duration.ofSeconds(seconds)));
        String timeouts = source.get("MEDUSA_ENABLE_TIMEOUTS", "medusa.enable.timeouts");
        if (timeouts != null) {
            builder.timeoutsEnabled(parseBoolean(timeouts));
        }
        String metrics = source.get("MEDUSA_METRICS", "medusa.metrics");
        if (metrics != null) {
            builder.metricsEnabled(parseBoolean(metrics));
        }
        source.getInt("MEDUSA_METRICS_PORT", "medusa.metrics.port", 1, 65535)
                .ifPresent(builder::metricsPort);

        return builder.build();
    }

    private static boolean parseBoolean(String value) {
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy this configuration into a builder, to override individual settings.
     */
    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .maxConnections(maxConnections)
                .connectionTimeout(connectionTimeout)
                .timeoutsEnabled(timeoutsEnabled)
                .metricsEnabled(metricsEnabled)
                .metricsPort(metricsPort);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public boolean isTimeoutsEnabled() {
        return timeoutsEnabled;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    /**
     * One-line description for the startup log.
     */
    public String describe() {
        return "host=" + host +
               ", port=" + port +
               ", maxConnections=" + maxConnections +
               ", timeouts=" + (timeoutsEnabled ? connectionTimeout.getSeconds() + "s" : "disabled") +
               ", metrics=" + (metricsEnabled ? "port " + metricsPort : "disabled");
    }

    @Override
    public String toString() {
        return "ServerConfig{" + describe() + '}';
    }

    /**
     * Environment-then-property lookup.
     */
    private static final class Source {

        private final Map<String, String> env;
        private final Properties properties;

        Source(Map<String, String> env, Properties properties) {
            this.env = env;
            this.properties = properties;
        }

        String get(String envKey, String propKey) {
            String value = env.get(envKey);
            if (value == null || value.isEmpty()) {
                value = properties.getProperty(propKey);
            }
            if (value == null || value.trim().isEmpty()) {
                return null;
            }
            return value.trim();
        }

        OptionalInt getInt(String envKey, String propKey, int min, int max) {
            String value = get(envKey, propKey);
            if (value == null) {
                return OptionalInt.empty();
            }
            try {
                int parsed = Integer.parseInt(value);
                if (parsed >= min && parsed <= max) {
                    logger.info("Using {}={}", envKey, parsed);
                    return OptionalInt.of(parsed);
                }
                logger.warn("Out of range {} value: {}, using default", envKey, value);
            } catch (NumberFormatException e) {
                logger.warn("Invalid {} value: {}, using default", envKey, value);
            }
            return OptionalInt.empty();
        }
    }

    /**
     * Builder for {@link ServerConfig}.
     */
    public static final class Builder {

        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        private boolean timeoutsEnabled = false;
        private boolean metricsEnabled = false;
        private int metricsPort = DEFAULT_METRICS_PORT;

        private Builder() {
        }

        public Builder host(String host) {
            if (host == null || host.isEmpty()) {
                throw new IllegalArgumentException("host cannot be null or empty");
            }
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) {
                throw new IllegalArgumentException("maxConnections must be positive, got: " + maxConnections);
            }
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            if (connectionTimeout == null || connectionTimeout.isNegative() || connectionTimeout.isZero()) {
                throw new IllegalArgumentException("connectionTimeout must be positive, got: " + connectionTimeout);
            }
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder timeoutsEnabled(boolean timeoutsEnabled) {
            this.timeoutsEnabled = timeoutsEnabled;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            if (metricsPort < 0 || metricsPort > 65535) {
                throw new IllegalArgumentException("metricsPort must be between 0 and 65535, got: " + metricsPort);
            }
            this.metricsPort = metricsPort;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
