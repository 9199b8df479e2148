package com.murmur.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Creates Micrometer meters that all carry the {@code service} and {@code instance} tags.
 *
 * <p>The instance tag separates gateway processes that share a service name, which is how
 * broadcast misses and subscription counts are told apart per node.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_INSTANCE = "instance";
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;
    private final String serviceName;
    private final String instanceId;

    /**
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name
     * @param instanceId identifier of this process among the service's replicas
     */
    public MetricFactory(MeterRegistry registry, String serviceName, String instanceId) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.instanceId = instanceId;
    }

    /** Single-instance convenience: the instance tag equals the service name. */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        this(registry, serviceName, serviceName);
    }

    /**
     * Returns the counter for {@code name} and the given extra tags, registering it on first use.
     *
     * @param tags additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public DistributionSummary distributionSummary(String name, String description, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge sampling {@code value} on {@code owner}. The registry holds the owner
     * weakly, so the gauge stops reporting once the owner is collected.
     */
    public <T> void gauge(String name, String description, T owner, ToDoubleFunction<T> value, String... tags) {
        Gauge.builder(name, owner, value)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Times {@code work} on the given timer and returns its result. */
    public <T> T time(Timer timer, Supplier<T> work) {
        Timer.Sample sample = Timer.start(registry);
        try {
            return work.get();
        } finally {
            sample.stop(timer);
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    public String instanceId() {
        return instanceId;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName, TAG_INSTANCE, instanceId);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
