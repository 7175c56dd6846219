package de.mirkosertic.ciexporter.schemas;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity of a metric: its kind plus its label set. Label order does not affect equality.
 */
public record MetricKey(MetricKind kind, Map<String, String> labels) {

    public MetricKey {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }
}
