package com.murmur.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "realtime-gateway", "gw-1");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject missing arguments")
        void rejectsMissing() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
            assertThatThrownBy(() -> new MetricFactory(registry, " "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
            assertThatThrownBy(() -> new MetricFactory(registry, "svc", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("instanceId");
        }

        @Test
        @DisplayName("two-argument form uses the service name as instance")
        void singleInstance() {
            assertThat(new MetricFactory(registry, "svc").instanceId()).isEqualTo("svc");
        }
    }

    @Nested
    @DisplayName("meters")
    class Meters {

        @Test
        @DisplayName("counter carries service, instance and extra tags")
        void counterTags() {
            factory.counter("murmur.events.published", "Published", "type", "MESSAGE_SENT").increment(3);

            var counter = registry.get("murmur.events.published")
                    .tag("service", "realtime-gateway")
                    .tag("instance", "gw-1")
                    .tag("type", "MESSAGE_SENT")
                    .counter();
            assertThat(counter.count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("same name and tags return the same counter")
        void counterReuse() {
            factory.counter("c", "d", "k", "v").increment();
            factory.counter("c", "d", "k", "v").increment();

            assertThat(registry.get("c").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("time() records one sample and returns the result")
        void timeRecords() {
            var timer = factory.timer("murmur.events.publish.duration", "Publish");

            var result = factory.time(timer, () -> "done");

            assertThat(result).isEqualTo("done");
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isGreaterThanOrEqualTo(0);
        }

        @Test
        @DisplayName("gauge samples its owner")
        void gauge() {
            var subscriptions = new AtomicInteger(4);
            factory.gauge("murmur.pubsub.channels", "Channels", subscriptions, AtomicInteger::doubleValue);

            assertThat(registry.get("murmur.pubsub.channels").gauge().value()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("distribution summary records amounts")
        void summary() {
            factory.distributionSummary("murmur.pubsub.payload.bytes", "Bytes").record(128);

            assertThat(registry.get("murmur.pubsub.payload.bytes").summary().totalAmount()).isEqualTo(128.0);
        }
    }
}
