package de.mirkosertic.ciexporter.schemas;

/**
 * A GitLab project being exported.
 */
public record Project(
        /** Path with namespace, e.g. {@code group/app}. */
        String name,
        /** Comma separated project topics, exposed as a label. */
        String topics,
        ProjectPull pull,
        /** When set, status metrics only carry the current status instead of a full one-hot set. */
        boolean outputSparseStatusMetrics
) {

    public Project {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Project name must not be empty");
        }
        if (topics == null) {
            topics = "";
        }
        if (pull == null) {
            pull = ProjectPull.DEFAULT;
        }
    }

    public Project(final String name) {
        this(name, "", ProjectPull.DEFAULT, true);
    }
}
