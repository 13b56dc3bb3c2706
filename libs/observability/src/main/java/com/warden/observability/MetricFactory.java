package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates the engine's Micrometer meters with a fixed {@code service} and {@code environment}
 * tag set, so that several Warden deployments can share one metrics backend.
 * <p>
 * Lookups are idempotent: asking again for a meter with the same name and tags returns the one
 * already registered, and for gauges the same value holder.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_ENVIRONMENT = "environment";

    static final String DEFAULT_ENVIRONMENT = "development";

    private final MeterRegistry registry;
    private final String environment;
    private final Tags baseTags;
    private final ConcurrentMap<GaugeKey, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MetricFactory(MeterRegistry registry, String serviceName) {
        this(registry, serviceName, DEFAULT_ENVIRONMENT);
    }

    /**
     * @param registry    registry the meters are bound to
     * @param serviceName value of the {@code service} tag
     * @param environment value of the {@code environment} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName, String environment) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        requireText(serviceName, "serviceName");
        requireText(environment, "environment");
        this.registry = registry;
        this.environment = environment;
        this.baseTags = Tags.of(TAG_SERVICE, serviceName, TAG_ENVIRONMENT, environment);
    }

    /**
     * @param tags extra tags as alternating keys and values
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(withBase(tags)).register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(withBase(tags)).register(registry);
    }

    /**
     * Registers a gauge that reports whatever is stored in the returned holder. Repeated calls
     * with the same name and tags return the holder created by the first call.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        Tags allTags = withBase(tags);
        return gauges.computeIfAbsent(new GaugeKey(name, allTags), key -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder(name, holder, AtomicLong::doubleValue)
                    .description(description)
                    .tags(allTags)
                    .strongReference(true)
                    .register(registry);
            return holder;
        });
    }

    public String environment() {
        return environment;
    }

    private Tags withBase(String... extra) {
        return extra.length == 0 ? baseTags : baseTags.and(extra);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    private record GaugeKey(String name, Tags tags) {
    }
}
