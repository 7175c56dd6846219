package de.mirkosertic.ciexporter.controller;

import java.util.List;

/**
 * Status enumerations used for status metric expansion and test report gating.
 */
public final class Statuses {

    /**
     * Every status a pipeline (or a test case) may report, in GitLab's spelling.
     */
    public static final List<String> PIPELINE_STATUSES = List.of(
            "created",
            "waiting_for_resource",
            "preparing",
            "pending",
            "running",
            "success",
            "failed",
            "canceled",
            "skipped",
            "manual",
            "scheduled",
            "error"
    );

    /**
     * Statuses after which a pipeline's test report is complete and worth fetching.
     */
    public static final List<String> FINISHED_STATUSES = List.of(
            "success",
            "failed",
            "skipped",
            "cancelled"
    );

    private Statuses() {
    }

    public static boolean isFinished(final String status) {
        return FINISHED_STATUSES.contains(status);
    }
}
