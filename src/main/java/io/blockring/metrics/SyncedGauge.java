package io.blockring.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Labelled gauge updated transactionally: a sync cycle accumulates values with
 * {@link #set} and {@link #add}, and {@link #submit()} publishes them as one batch.
 * Scrapes in between keep reading the previous batch, never a half-filled one.
 * <p>
 * Labels not touched during a cycle read as zero after the next submit.
 */
public final class SyncedGauge {
    private final MeterRegistry registry;
    private final String name;
    private final String labelKey;

    private final Map<String, Double> pending = new HashMap<>();
    private final Set<String> registered = new HashSet<>();
    private volatile Map<String, Double> published = Map.of();

    public SyncedGauge(final MeterRegistry registry, final String name, final String labelKey) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.name = Objects.requireNonNull(name, "name");
        this.labelKey = Objects.requireNonNull(labelKey, "labelKey");
    }

    public synchronized void set(final String label, final double value) {
        pending.put(label, value);
    }

    public synchronized void add(final String label, final double delta) {
        pending.merge(label, delta, Double::sum);
    }

    /** Publishes every value accumulated since the previous submit and starts a new cycle. */
    public synchronized void submit() {
        for (final String label : pending.keySet()) {
            if (registered.add(label)) {
                Gauge.builder(name, this, g -> g.value(label))
                        .tag(labelKey, label)
                        .register(registry);
            }
        }
        published = Map.copyOf(pending);
        pending.clear();
    }

    /** Last submitted value for the label, zero if absent. */
    public double value(final String label) {
        return published.getOrDefault(label, 0d);
    }
}
