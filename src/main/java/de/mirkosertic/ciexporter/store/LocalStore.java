package de.mirkosertic.ciexporter.store;

import de.mirkosertic.ciexporter.schemas.Metric;
import de.mirkosertic.ciexporter.schemas.MetricKey;
import de.mirkosertic.ciexporter.schemas.Pipeline;
import de.mirkosertic.ciexporter.schemas.Ref;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link Store}. Thread-safe, state is lost on restart.
 */
public class LocalStore implements Store {

    private static final Logger logger = LoggerFactory.getLogger(LocalStore.class);

    private final Map<String, Ref> refs = new ConcurrentHashMap<>();
    private final Map<MetricKey, Metric> metrics = new ConcurrentHashMap<>();
    private final Map<Long, String> pipelineVariables = new ConcurrentHashMap<>();

    @Override
    public Optional<Ref> getRef(final String refKey) {
        return Optional.ofNullable(refs.get(refKey));
    }

    @Override
    public void setRef(final Ref ref) {
        refs.put(ref.key(), ref);
    }

    @Override
    public Optional<Metric> getMetric(final MetricKey key) {
        return Optional.ofNullable(metrics.get(key));
    }

    @Override
    public void setMetric(final Metric metric) {
        metrics.put(metric.key(), metric);
        if (logger.isTraceEnabled()) {
            logger.trace("Set metric {}{} = {}", metric.kind().metricName(), metric.labels(), metric.value());
        }
    }

    @Override
    public void delMetric(final MetricKey key) {
        metrics.remove(key);
    }

    @Override
    public boolean metricExists(final MetricKey key) {
        return metrics.containsKey(key);
    }

    @Override
    public long metricsCount() {
        return metrics.size();
    }

    @Override
    public boolean pipelineVariablesExist(final Pipeline pipeline) {
        return pipelineVariables.containsKey(pipeline.id());
    }

    @Override
    public String getPipelineVariables(final Pipeline pipeline) {
        return pipelineVariables.getOrDefault(pipeline.id(), "");
    }

    @Override
    public void setPipelineVariables(final Pipeline pipeline, final String variables) {
        pipelineVariables.put(pipeline.id(), variables == null ? "" : variables);
    }
}
