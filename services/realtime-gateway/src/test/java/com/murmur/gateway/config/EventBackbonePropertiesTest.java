package com.murmur.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.murmur.gateway.config.EventBackboneProperties.Backend;
import com.murmur.gateway.config.EventBackboneProperties.Relay;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventBackboneProperties")
class EventBackbonePropertiesTest {

    @Test
    @DisplayName("defaults to the in-memory single-node setup")
    void defaults() {
        var props = new EventBackboneProperties(null, null, null, null, null, null, null, null, null, null);

        assertThat(props.eventLog()).isEqualTo(Backend.MEMORY);
        assertThat(props.idempotencyStore()).isEqualTo(Backend.MEMORY);
        assertThat(props.broker()).isEqualTo(Backend.MEMORY);
        assertThat(props.handlerTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.claimLease()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.handlerThreads()).isEqualTo(8);
        assertThat(props.idempotencyRetention()).isEqualTo(Duration.ofDays(7));
        assertThat(props.relay().enabled()).isTrue();
        assertThat(props.relay().batchSize()).isEqualTo(100);
    }

    @Test
    @DisplayName("keeps explicit values")
    void explicitValues() {
        var relay = new Relay(false, Duration.ofSeconds(1), Duration.ZERO, 3, 10);
        var props = new EventBackboneProperties(Backend.JDBC, Backend.REDIS, Backend.REDIS, Duration.ofSeconds(2),
                Duration.ofSeconds(5), 2, 1, Duration.ofHours(1), Duration.ofMinutes(5), relay);

        assertThat(props.eventLog()).isEqualTo(Backend.JDBC);
        assertThat(props.idempotencyStore()).isEqualTo(Backend.REDIS);
        assertThat(props.relay().enabled()).isFalse();
        assertThat(props.relay().maxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("rejects a claim lease that does not outlive the handler timeout")
    void leaseMustExceedTimeout() {
        assertThatThrownBy(() -> new EventBackboneProperties(null, null, null, Duration.ofSeconds(30),
                Duration.ofSeconds(30), null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("claim-lease");
    }
}
