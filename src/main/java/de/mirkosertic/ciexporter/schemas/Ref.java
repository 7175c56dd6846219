package de.mirkosertic.ciexporter.schemas;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A branch, tag or merge request of a project, together with the last pipeline reconciled for it.
 * <p>
 * Records are values: updating the latest pipeline yields a new {@code Ref}, the only way to
 * publish that change to other pull cycles is the store.
 */
public record Ref(Project project, RefKind kind, String name, Pipeline latestPipeline) {

    public Ref {
        if (project == null || kind == null || name == null) {
            throw new IllegalArgumentException("project, kind and name are required");
        }
        if (latestPipeline == null) {
            latestPipeline = Pipeline.EMPTY;
        }
    }

    public Ref(final Project project, final RefKind kind, final String name) {
        this(project, kind, name, Pipeline.EMPTY);
    }

    /**
     * Store key of this ref. Independent of the latest pipeline.
     */
    public String key() {
        return kind.labelValue() + "/" + project.name() + "/" + name;
    }

    public Ref withLatestPipeline(final Pipeline pipeline) {
        return new Ref(project, kind, name, pipeline);
    }

    /**
     * Labels shared by every metric of this ref, using the latest pipeline for
     * {@code source} and {@code variables}.
     */
    public Map<String, String> defaultLabelsValues() {
        return defaultLabelsValues(latestPipeline);
    }

    /**
     * Same as {@link #defaultLabelsValues()}, but taking {@code source} and {@code variables}
     * from the given pipeline.
     */
    public Map<String, String> defaultLabelsValues(final Pipeline pipeline) {
        final Map<String, String> labels = new LinkedHashMap<>();
        labels.put("project", project.name());
        labels.put("topics", project.topics());
        labels.put("kind", kind.labelValue());
        labels.put("ref", name);
        labels.put("source", pipeline.source());
        labels.put("variables", pipeline.variables());
        return labels;
    }
}
