package de.mirkosertic.ciexporter.controller;

import de.mirkosertic.ciexporter.schemas.Ref;

import java.io.IOException;

/**
 * Pulls job level metrics of a ref. Triggered by the {@link PipelineProcessor}.
 */
public interface JobMetricsPuller {

    /**
     * Pull the jobs of the ref's latest pipeline. Called when a new pipeline was observed.
     */
    void pullFullJobMetrics(Ref ref) throws IOException, InterruptedException;

    /**
     * Refresh only the most recent jobs of the ref. Called when the pipeline did not change.
     */
    void pullMostRecentJobMetrics(Ref ref) throws IOException, InterruptedException;
}
