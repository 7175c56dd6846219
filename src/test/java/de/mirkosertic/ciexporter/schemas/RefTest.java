package de.mirkosertic.ciexporter.schemas;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Ref Tests")
class RefTest {

    private final Project project = new Project("group/app", "java,backend", ProjectPull.DEFAULT, true);

    @Test
    @DisplayName("Should start without a reconciled pipeline")
    void shouldStartUnreconciled() {
        final Ref ref = new Ref(project, RefKind.BRANCH, "main");

        assertThat(ref.latestPipeline()).isSameAs(Pipeline.EMPTY);
        assertThat(ref.latestPipeline().id()).isZero();
    }

    @Test
    @DisplayName("Should keep the store key stable when the latest pipeline changes")
    void shouldKeepKeyStable() {
        final Ref ref = new Ref(project, RefKind.MERGE_REQUEST, "42");
        final Ref updated = ref.withLatestPipeline(new Pipeline(7, "", "push", "running", 0, 0, 0, 0, "", null));

        assertThat(updated.key()).isEqualTo(ref.key()).isEqualTo("merge-request/group/app/42");
        assertThat(ref.latestPipeline().id()).isZero();
        assertThat(updated.latestPipeline().id()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should distinguish a branch and a tag with the same name")
    void shouldDistinguishKinds() {
        assertThat(new Ref(project, RefKind.BRANCH, "v1").key())
                .isNotEqualTo(new Ref(project, RefKind.TAG, "v1").key());
    }

    @Test
    @DisplayName("Should build default labels from the latest pipeline")
    void shouldBuildDefaultLabels() {
        final Ref ref = new Ref(project, RefKind.TAG, "v1.0",
                new Pipeline(3, "v1.0", "web", "success", 0, 0, 0, 0, "A:1", null));

        assertThat(ref.defaultLabelsValues()).containsExactly(
                Map.entry("project", "group/app"),
                Map.entry("topics", "java,backend"),
                Map.entry("kind", "tag"),
                Map.entry("ref", "v1.0"),
                Map.entry("source", "web"),
                Map.entry("variables", "A:1"));
    }

    @Test
    @DisplayName("Should take source and variables from an explicit pipeline")
    void shouldBuildLabelsForPipeline() {
        final Ref ref = new Ref(project, RefKind.BRANCH, "main");
        final Pipeline pipeline = new Pipeline(9, "main", "schedule", "failed", 0, 0, 0, 0, "B:2", null);

        final Map<String, String> labels = ref.defaultLabelsValues(pipeline);

        assertThat(labels).containsEntry("source", "schedule").containsEntry("variables", "B:2");
        assertThat(ref.defaultLabelsValues()).containsEntry("source", "").containsEntry("variables", "");
    }

    @Test
    @DisplayName("Should parse ref kinds from configuration values")
    void shouldParseRefKinds() {
        assertThat(RefKind.fromLabelValue("branch")).isEqualTo(RefKind.BRANCH);
        assertThat(RefKind.fromLabelValue("merge-request")).isEqualTo(RefKind.MERGE_REQUEST);
        assertThat(RefKind.fromLabelValue("MERGE_REQUEST")).isEqualTo(RefKind.MERGE_REQUEST);
        assertThatThrownBy(() -> RefKind.fromLabelValue("commit")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should treat metrics with equal labels in any order as the same key")
    void shouldCompareMetricKeysByContent() {
        final Metric first = new Metric(MetricKind.ID, Map.of("project", "g1", "ref", "main"), 1);
        final Metric second = new Metric(MetricKind.ID, Map.of("ref", "main", "project", "g1"), 2);

        assertThat(first.key()).isEqualTo(second.key());
        assertThat(first.key()).isNotEqualTo(new Metric(MetricKind.RUN_COUNT, first.labels(), 1).key());
    }
}
