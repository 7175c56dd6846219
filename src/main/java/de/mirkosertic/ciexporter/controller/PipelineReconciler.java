package de.mirkosertic.ciexporter.controller;

import de.mirkosertic.ciexporter.gitlab.CiClient;
import de.mirkosertic.ciexporter.schemas.PipelineSummary;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.RefKind;
import de.mirkosertic.ciexporter.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entry point of a pull cycle for one ref: reconciles the stored ref state with the pipelines
 * the remote currently reports.
 * <p>
 * Runs synchronously on the calling thread. Interrupting that thread cancels the pull.
 */
public class PipelineReconciler {

    private static final Logger logger = LoggerFactory.getLogger(PipelineReconciler.class);

    private final Store store;
    private final CiClient ciClient;
    private final PipelineProcessor pipelineProcessor;

    public PipelineReconciler(final Store store, final CiClient ciClient, final PipelineProcessor pipelineProcessor) {
        this.store = store;
        this.ciClient = ciClient;
        this.pipelineProcessor = pipelineProcessor;
    }

    /**
     * Pull the pipeline metrics of a ref.
     * <p>
     * A failure while processing a single pipeline is logged and the remaining pipelines are still
     * processed.
     *
     * @param scheduledRef the ref as known by the scheduler, possibly stale
     * @throws IOException          if the ref cannot be read from the store or the pipelines cannot be listed
     * @throws InterruptedException if the pull was cancelled
     */
    public void pullRefMetrics(final Ref scheduledRef) throws IOException, InterruptedException {
        // The scheduler's copy may lag behind what other pulls already stored
        final Ref ref = store.getRef(scheduledRef.key()).orElse(scheduledRef);

        final String refName = remoteRefName(ref);

        final List<PipelineSummary> listed;
        try {
            listed = ciClient.listProjectPipelines(ref.project().name(), refName, ref.project().pull().perRef());
        } catch (final IOException e) {
            throw new IOException("error fetching project pipelines for " + ref.project().name() + ": " + e.getMessage(), e);
        }

        if (listed.isEmpty()) {
            logger.debug("Could not find any pipeline for the ref: project-name={}, ref={}, ref-kind={}",
                    ref.project().name(), ref.name(), ref.kind().labelValue());
            return;
        }

        // Listing is newest first, process in the order the pipelines were created
        final List<PipelineSummary> pipelines = new ArrayList<>(listed);
        Collections.reverse(pipelines);

        for (final PipelineSummary pipeline : pipelines) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Pull of " + ref.key() + " cancelled");
            }
            try {
                pipelineProcessor.processPipelinesMetrics(ref, pipeline);
            } catch (final IOException e) {
                logger.error("Processing pipeline metrics failed: project-name={}, ref={}, ref-kind={}, pipeline={}",
                        ref.project().name(), ref.name(), ref.kind().labelValue(), pipeline.id(), e);
            }
        }
    }

    static String remoteRefName(final Ref ref) {
        if (ref.kind() == RefKind.MERGE_REQUEST) {
            return "refs/merge-requests/" + ref.name() + "/head";
        }
        return ref.name();
    }
}
