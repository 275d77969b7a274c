package com.aegis.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are looked up by name and tags on every call; Micrometer returns the existing
 * instance, so callers may ask for a counter per event without caching it.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns the counter for {@code name} with the given extra tags (key-value pairs).
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Increments the counter {@code name} tagged with {@code outcome}.
     */
    public void recordOutcome(String name, String outcome) {
        counter(name, "Outcomes of " + name, TAG_OUTCOME, outcome).increment();
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
