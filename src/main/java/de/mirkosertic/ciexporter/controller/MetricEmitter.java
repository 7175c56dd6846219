package de.mirkosertic.ciexporter.controller;

import de.mirkosertic.ciexporter.schemas.Metric;
import de.mirkosertic.ciexporter.schemas.MetricKind;
import de.mirkosertic.ciexporter.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes metrics into the {@link Store}.
 * <p>
 * Metric writes are best effort: a failing write is logged and does not interrupt the caller,
 * the next pull recomputes every value from remote state anyway.
 */
public class MetricEmitter {

    private static final Logger logger = LoggerFactory.getLogger(MetricEmitter.class);

    static final String STATUS_LABEL = "status";

    private final Store store;

    public MetricEmitter(final Store store) {
        this.store = store;
    }

    public void setMetric(final MetricKind kind, final Map<String, String> labels, final double value) {
        setMetric(new Metric(kind, labels, value));
    }

    public void setMetric(final Metric metric) {
        try {
            store.setMetric(metric);
        } catch (final IOException e) {
            logger.error("Writing metric {} {} to the store failed", metric.kind(), metric.labels(), e);
        }
    }

    /**
     * Read the current value of a metric.
     *
     * @param defaultValue returned when the metric does not exist or cannot be read
     */
    public double getMetricValue(final MetricKind kind, final Map<String, String> labels, final double defaultValue) {
        final Metric lookup = new Metric(kind, labels, defaultValue);
        try {
            return store.getMetric(lookup.key()).map(Metric::value).orElse(defaultValue);
        } catch (final IOException e) {
            logger.error("Reading metric {} {} from the store failed", kind, labels, e);
            return defaultValue;
        }
    }

    /**
     * Expand a status into one metric per known status, labeled with {@code status}.
     * <p>
     * The matching status gets value 1. The others get 0, or are removed in sparse mode so
     * that only the current status is exposed.
     *
     * @param statuses all statuses the metric may take
     * @param status   the current status
     * @param sparse   only keep the metric of the current status
     */
    public void emitStatusMetric(final MetricKind kind,
                                 final Map<String, String> labels,
                                 final List<String> statuses,
                                 final String status,
                                 final boolean sparse) {

        for (final String candidate : statuses) {
            final Map<String, String> statusLabels = new LinkedHashMap<>(labels);
            statusLabels.put(STATUS_LABEL, candidate);

            if (candidate.equals(status)) {
                setMetric(kind, statusLabels, 1);
            } else if (sparse) {
                deleteMetric(new Metric(kind, statusLabels, 0));
            } else {
                setMetric(kind, statusLabels, 0);
            }
        }
    }

    private void deleteMetric(final Metric metric) {
        try {
            store.delMetric(metric.key());
        } catch (final IOException e) {
            logger.error("Deleting metric {} {} from the store failed", metric.kind(), metric.labels(), e);
        }
    }
}
