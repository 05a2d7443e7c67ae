package com.medusa.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Connection settings for {@link com.medusa.MedusaClient}.
 */
public final class ClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ClientConfig.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 2312;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    private ClientConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Settings for the server named by {@code MEDUSA_HOST} / {@code MEDUSA_PORT}
     * (or the {@code medusa.host} / {@code medusa.port} system properties), default timeouts.
     */
    public static ClientConfig fromEnvironment() {
        Builder builder = builder();
        String host = lookup("MEDUSA_HOST", "medusa.host");
        if (host != null) {
            builder.host(host);
        }
        String port = lookup("MEDUSA_PORT", "medusa.port");
        if (port != null) {
            try {
                builder.port(Integer.parseInt(port));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid MEDUSA_PORT value: {}, using default", port);
            }
        }
        return builder.build();
    }

    private static String lookup(String envKey, String propKey) {
        String value = System.getenv(envKey);
        if (value == null || value.trim().isEmpty()) {
            value = System.getProperty(propKey);
        }
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    /**
     * Copy these settings into a builder.
     */
    public Builder toBuilder() {
        return builder()
                .host(host)
                .port(port)
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout);
    }

    @Override
    public String toString() {
        return "ClientConfig{" + host + ":" + port +
               ", connectTimeout=" + connectTimeout.toMillis() + "ms" +
               ", readTimeout=" + readTimeout.toMillis() + "ms}";
    }

    /**
     * Builder for ClientConfig.
     */
    public static final class Builder {

        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;

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
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535, got: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = requirePositive(timeout, "connectTimeout");
            return this;
        }

        public Builder readTimeout(Duration timeout) {
            this.readTimeout = requirePositive(timeout, "readTimeout");
            return this;
        }

        private static Duration requirePositive(Duration timeout, String name) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + timeout);
            }
            if (timeout.toMillis() > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(name + " is too large: " + timeout);
            }
            return timeout;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
