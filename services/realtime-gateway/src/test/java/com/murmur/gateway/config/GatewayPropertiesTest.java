package com.murmur.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GatewayProperties")
class GatewayPropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new GatewayProperties("realtime-gateway", "production", "gw-eu-1a");

        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.instanceId()).isEqualTo("gw-eu-1a");
    }

    @Test
    @DisplayName("defaults environment to 'development' when null")
    void defaultsEnvironment() {
        assertThat(new GatewayProperties("realtime-gateway", null, "gw-1").environment()).isEqualTo("development");
    }

    @Test
    @DisplayName("generates a distinct instance id when blank")
    void generatesInstanceId() {
        var first = new GatewayProperties("realtime-gateway", null, "");
        var second = new GatewayProperties("realtime-gateway", null, null);

        assertThat(first.instanceId()).startsWith("realtime-gateway-");
        assertThat(first.instanceId()).isNotEqualTo(second.instanceId());
    }
}
