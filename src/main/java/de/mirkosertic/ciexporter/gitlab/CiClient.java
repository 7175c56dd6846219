package de.mirkosertic.ciexporter.gitlab;

import de.mirkosertic.ciexporter.schemas.Pipeline;
import de.mirkosertic.ciexporter.schemas.PipelineSummary;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.TestReport;

import java.io.IOException;
import java.util.List;

/**
 * Remote CI system as seen by the pipeline controller.
 * <p>
 * Implementations do not retry. An interrupted calling thread aborts a call with
 * {@link InterruptedException}.
 */
public interface CiClient {

    /**
     * List the most recent pipelines of a ref, newest first. Only the first page is returned.
     *
     * @param projectName path with namespace of the project
     * @param refName     ref as understood by the remote, see merge request addressing
     * @param perPage     maximum number of pipelines to return
     */
    List<PipelineSummary> listProjectPipelines(String projectName, String refName, int perPage)
            throws IOException, InterruptedException;

    Pipeline getPipeline(String projectName, long pipelineId) throws IOException, InterruptedException;

    /**
     * @return the variables of the pipeline matching the ref's variable filter,
     *         concatenated as {@code key:value} pairs separated by commas
     */
    String getPipelineVariables(Ref ref, Pipeline pipeline) throws IOException, InterruptedException;

    TestReport getPipelineTestReport(Ref ref, Pipeline pipeline) throws IOException, InterruptedException;
}
