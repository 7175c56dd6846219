package de.mirkosertic.ciexporter.schemas;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single metric sample. The labels are copied, later changes to the caller's map do not leak in.
 */
public record Metric(MetricKind kind, Map<String, String> labels, double value) {

    public Metric {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public MetricKey key() {
        return new MetricKey(kind, labels);
    }

    public Metric withValue(final double newValue) {
        return new Metric(kind, labels, newValue);
    }
}
