package de.mirkosertic.ciexporter.store;

import de.mirkosertic.ciexporter.schemas.Metric;
import de.mirkosertic.ciexporter.schemas.MetricKey;
import de.mirkosertic.ciexporter.schemas.Pipeline;
import de.mirkosertic.ciexporter.schemas.Ref;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable state shared by all pull cycles: refs, metrics and cached pipeline variables.
 * <p>
 * Plain get/set semantics. There are no multi-key transactions, each key is overwritten
 * independently and the last write wins.
 */
public interface Store {

    /**
     * @param refKey see {@link Ref#key()}
     * @return the stored ref, or empty if the ref was never persisted
     */
    Optional<Ref> getRef(String refKey) throws IOException;

    void setRef(Ref ref) throws IOException;

    Optional<Metric> getMetric(MetricKey key) throws IOException;

    void setMetric(Metric metric) throws IOException;

    /**
     * Remove a metric. Removing a metric that does not exist is a no-op.
     */
    void delMetric(MetricKey key) throws IOException;

    boolean metricExists(MetricKey key) throws IOException;

    long metricsCount() throws IOException;

    boolean pipelineVariablesExist(Pipeline pipeline) throws IOException;

    /**
     * @return the cached variables of the pipeline, empty string when none are stored
     */
    String getPipelineVariables(Pipeline pipeline) throws IOException;

    void setPipelineVariables(Pipeline pipeline, String variables) throws IOException;
}
