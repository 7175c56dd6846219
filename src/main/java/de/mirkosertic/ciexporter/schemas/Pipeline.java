package de.mirkosertic.ciexporter.schemas;

import org.jspecify.annotations.Nullable;

/**
 * Snapshot of a single pipeline run as seen on the remote side.
 * <p>
 * An id of {@code 0} denotes "no pipeline", see {@link #EMPTY}.
 */
public record Pipeline(
        long id,
        String ref,
        /** What triggered the pipeline: push, schedule, web, merge_request_event ... */
        String source,
        String status,
        double coverage,
        double durationSeconds,
        double queuedDurationSeconds,
        /** Unix timestamp (seconds) of the last update of the pipeline. */
        double timestamp,
        /** Concatenated {@code key:value} pairs, empty when variables are not pulled. */
        String variables,
        @Nullable TestReport testReport
) {

    public static final Pipeline EMPTY = new Pipeline(0, "", "", "", 0, 0, 0, 0, "", null);

    public Pipeline {
        ref = ref == null ? "" : ref;
        source = source == null ? "" : source;
        status = status == null ? "" : status;
        variables = variables == null ? "" : variables;
    }

    public Pipeline withVariables(final String newVariables) {
        return new Pipeline(id, ref, source, status, coverage, durationSeconds, queuedDurationSeconds, timestamp,
                newVariables, testReport);
    }

    public Pipeline withTestReport(final @Nullable TestReport newTestReport) {
        return new Pipeline(id, ref, source, status, coverage, durationSeconds, queuedDurationSeconds, timestamp,
                variables, newTestReport);
    }
}
