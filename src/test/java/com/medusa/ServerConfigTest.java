package com.medusa;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ServerConfigTest {

    @Test
    void fromSources_defaults() {
        ServerConfig config = ServerConfig.fromSources(Map.of(), new Properties());

        assertThat(config.getHost()).isEqualTo("127.0.0.1");
        assertThat(config.getPort()).isEqualTo(2312);
        assertThat(config.getMaxConnections()).isEqualTo(100);
        assertThat(config.getConnectionTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.isTimeoutsEnabled()).isFalse();
        assertThat(config.isMetricsEnabled()).isFalse();
        assertThat(config.getMetricsPort()).isEqualTo(9091);
    }

    @Test
    void fromSources_readsEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("MEDUSA_HOST", "0.0.0.0");
        env.put("MEDUSA_PORT", "7000");
        env.put("MEDUSA_MAX_CONNECTIONS", "5");
        env.put("MEDUSA_TIMEOUT", "10");
        env.put("MEDUSA_ENABLE_TIMEOUTS", "true");
        env.put("MEDUSA_METRICS", "1");
        env.put("MEDUSA_METRICS_PORT", "9100");

        ServerConfig config = ServerConfig.fromSources(env, new Properties());

        assertThat(config.getHost()).isEqualTo("0.0.0.0");
        assertThat(config.getPort()).isEqualTo(7000);
        assertThat(config.getMaxConnections()).isEqualTo(5);
        assertThat(config.getConnectionTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.isTimeoutsEnabled()).isTrue();
        assertThat(config.isMetricsEnabled()).isTrue();
        assertThat(config.getMetricsPort()).isEqualTo(9100);
    }

    @Test
    void fromSources_environmentWinsOverProperties() {
        Properties props = new Properties();
        props.setProperty("medusa.port", "7001");
        props.setProperty("medusa.host", "localhost");

        ServerConfig config = ServerConfig.fromSources(Map.of("MEDUSA_PORT", "7002"), props);

        assertThat(config.getPort()).isEqualTo(7002);
        assertThat(config.getHost()).isEqualTo("localhost");
    }

    @Test
    void fromSources_invalidValuesFallBackToDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put("MEDUSA_PORT", "not-a-port");
        env.put("MEDUSA_MAX_CONNECTIONS", "0");
        env.put("MEDUSA_TIMEOUT", "-3");
        env.put("MEDUSA_METRICS", "yes please");

        ServerConfig config = ServerConfig.fromSources(env, new Properties());

        assertThat(config.getPort()).isEqualTo(ServerConfig.DEFAULT_PORT);
        assertThat(config.getMaxConnections()).isEqualTo(ServerConfig.DEFAULT_MAX_CONNECTIONS);
        assertThat(config.getConnectionTimeout()).isEqualTo(ServerConfig.DEFAULT_CONNECTION_TIMEOUT);
        assertThat(config.isMetricsEnabled()).isFalse();
    }

    @Test
    void builder_rejectsInvalidValues() {
        assertThatThrownBy(() -> ServerConfig.builder().port(70000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerConfig.builder().maxConnections(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerConfig.builder().connectionTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerConfig.builder().host(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilder_copiesAndOverrides() {
        ServerConfig original = ServerConfig.builder().port(0).maxConnections(3).build();

        ServerConfig copy = original.toBuilder().timeoutsEnabled(true).build();

        assertThat(copy.getPort()).isZero();
        assertThat(copy.getMaxConnections()).isEqualTo(3);
        assertThat(copy.isTimeoutsEnabled()).isTrue();
        assertThat(original.isTimeoutsEnabled()).isFalse();
    }

    @Test
    void describe_mentionsDisabledFeatures() {
        String description = ServerConfig.builder().build().describe();

        assertThat(description).contains("port=2312");
        assertThat(description).contains("timeouts=disabled");
        assertThat(description).contains("metrics=disabled");
    }
}
