package de.mirkosertic.ciexporter.schemas;

/**
 * Per-project pull settings: which sub-resources to fetch and how many pipelines per ref.
 */
public record ProjectPull(
        /** Page size of the pipeline listing for a single ref. Only the first page is ever read. */
        int perRef,
        /** Pull the jobs of a pipeline when it changed. */
        boolean jobsEnabled,
        /** Resolve and cache pipeline variables. */
        boolean variablesEnabled,
        /** Only variables whose key matches this regular expression are kept. */
        String variablesRegexp,
        /** Pull test reports of finished pipelines. */
        boolean testReportsEnabled,
        /** Also emit one metric set per test case. Requires {@link #testReportsEnabled()}. */
        boolean testCasesEnabled
) {

    public static final ProjectPull DEFAULT = new ProjectPull(1, false, false, ".*", false, false);

    public ProjectPull {
        if (perRef < 1) {
            throw new IllegalArgumentException("perRef must be at least 1, got " + perRef);
        }
        if (variablesRegexp == null || variablesRegexp.isEmpty()) {
            variablesRegexp = ".*";
        }
    }
}
