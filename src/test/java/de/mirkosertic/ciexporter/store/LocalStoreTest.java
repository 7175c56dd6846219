package de.mirkosertic.ciexporter.store;

import de.mirkosertic.ciexporter.schemas.Metric;
import de.mirkosertic.ciexporter.schemas.MetricKey;
import de.mirkosertic.ciexporter.schemas.MetricKind;
import de.mirkosertic.ciexporter.schemas.Pipeline;
import de.mirkosertic.ciexporter.schemas.Project;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.RefKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocalStore Tests")
class LocalStoreTest {

    private LocalStore store;

    @BeforeEach
    void setUp() {
        store = new LocalStore();
    }

    @Test
    @DisplayName("Should read back a written metric with identical value and labels")
    void shouldRoundTripMetric() {
        final Map<String, String> labels = new LinkedHashMap<>();
        labels.put("project", "g1");
        labels.put("ref", "main");
        final Metric coverage = new Metric(MetricKind.COVERAGE, labels, 87.5);

        store.setMetric(coverage);
        final Optional<Metric> read = store.getMetric(new MetricKey(MetricKind.COVERAGE, Map.of("project", "g1", "ref", "main")));

        assertThat(read).isPresent();
        assertThat(read.get().value()).isEqualTo(87.5);
        assertThat(read.get().labels()).isEqualTo(Map.of("project", "g1", "ref", "main"));
        assertThat(read.get()).isEqualTo(coverage);
    }

    @Test
    @DisplayName("Should overwrite a metric with the last write")
    void shouldOverwriteMetric() {
        final Metric metric = new Metric(MetricKind.RUN_COUNT, Map.of("ref", "main"), 1);
        store.setMetric(metric);
        store.setMetric(metric.withValue(2));

        assertThat(store.metricsCount()).isEqualTo(1);
        assertThat(store.getMetric(metric.key())).map(Metric::value).contains(2d);
    }

    @Test
    @DisplayName("Should delete metrics and ignore unknown ones")
    void shouldDeleteMetric() {
        final Metric metric = new Metric(MetricKind.STATUS, Map.of("status", "failed"), 0);
        store.setMetric(metric);

        store.delMetric(metric.key());
        store.delMetric(metric.key());

        assertThat(store.metricExists(metric.key())).isFalse();
        assertThat(store.metricsCount()).isZero();
    }

    @Test
    @DisplayName("Should store refs by key and replace them on update")
    void shouldStoreRefs() {
        final Ref ref = new Ref(new Project("group/app"), RefKind.BRANCH, "main");
        assertThat(store.getRef(ref.key())).isEmpty();

        store.setRef(ref);
        final Ref updated = ref.withLatestPipeline(new Pipeline(5, "main", "push", "success", 0, 0, 0, 0, "", null));
        store.setRef(updated);

        assertThat(store.getRef(ref.key())).contains(updated);
    }

    @Test
    @DisplayName("Should cache pipeline variables by pipeline id")
    void shouldCachePipelineVariables() {
        final Pipeline pipeline = new Pipeline(12, "main", "push", "success", 0, 0, 0, 0, "", null);
        assertThat(store.pipelineVariablesExist(pipeline)).isFalse();
        assertThat(store.getPipelineVariables(pipeline)).isEmpty();

        store.setPipelineVariables(pipeline, "A:1,B:2");

        assertThat(store.pipelineVariablesExist(pipeline.withVariables("other"))).isTrue();
        assertThat(store.getPipelineVariables(pipeline)).isEqualTo("A:1,B:2");
    }
}
