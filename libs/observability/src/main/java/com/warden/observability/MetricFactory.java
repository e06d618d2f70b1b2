package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Factory for Micrometer meters that carry the owning server's name as a common tag.
 * <p>
 * Every meter created here gets a {@code server} tag so that several protocol servers
 * reporting into one registry can be told apart. Additional tags are supplied per meter
 * as key-value pairs.
 */
public final class MetricFactory {

    /** Tag key for the server name. */
    public static final String TAG_SERVER = "server";

    private final MeterRegistry registry;
    private final String serverName;

    /**
     * Creates a MetricFactory bound to the given registry and server name.
     *
     * @param registry   the Micrometer meter registry
     * @param serverName logical server name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serverName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serverName == null || serverName.isBlank()) {
            throw new IllegalArgumentException("serverName must not be null or blank");
        }
        this.registry = registry;
        this.serverName = serverName;
    }

    /**
     * Returns the counter with the given name and tags, registering it on first use.
     *
     * @param name        metric name (e.g., "warden.credentials.accepted")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the timer with the given name and tags, registering it on first use.
     *
     * @param name        metric name (e.g., "warden.credentials.validation")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples the supplier each time the registry is scraped.
     *
     * @param name        metric name (e.g., "warden.impersonation.pending")
     * @param description human-readable description
     * @param supplier    source of the current value
     * @param tags        additional tags (key-value pairs)
     * @return the registered gauge
     */
    public Gauge gauge(String name, String description, Supplier<Number> supplier, String... tags) {
        return Gauge.builder(name, supplier)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the server name used as a default tag.
     */
    public String serverName() {
        return serverName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVER, serverName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
