package de.mirkosertic.ciexporter.controller;

import de.mirkosertic.ciexporter.gitlab.CiClient;
import de.mirkosertic.ciexporter.schemas.MetricKind;
import de.mirkosertic.ciexporter.schemas.Pipeline;
import de.mirkosertic.ciexporter.schemas.PipelineSummary;
import de.mirkosertic.ciexporter.schemas.ProjectPull;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.TestCase;
import de.mirkosertic.ciexporter.schemas.TestReport;
import de.mirkosertic.ciexporter.schemas.TestSuite;
import de.mirkosertic.ciexporter.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Turns a single pipeline of a ref into metrics.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Fetch the pipeline details, and its variables if enabled. Variables never change for a
 *       pipeline, so they are fetched from the remote at most once and cached in the store.</li>
 *   <li>Compare the pipeline id against the stored {@code ID} metric. A ref that was never
 *       reconciled always counts as changed.</li>
 *   <li>Changed: persist the ref with its new latest pipeline, bump the run count and emit all
 *       pipeline metrics, then pull the jobs if enabled.
 *       Unchanged: only pull the most recent jobs.</li>
 *   <li>If the latest pipeline is finished and test reports are enabled, fetch the test report
 *       and emit report, suite and case metrics.</li>
 * </ol>
 * Only the id takes part in change detection. A status change on a pipeline that was already
 * seen does not re-emit the pipeline metrics.
 */
public class PipelineProcessor {

    private static final Logger logger = LoggerFactory.getLogger(PipelineProcessor.class);

    private final Store store;
    private final CiClient ciClient;
    private final JobMetricsPuller jobMetricsPuller;
    private final MetricEmitter metricEmitter;
    private final TestReportEmitter testReportEmitter;

    public PipelineProcessor(final Store store,
                             final CiClient ciClient,
                             final JobMetricsPuller jobMetricsPuller,
                             final MetricEmitter metricEmitter,
                             final TestReportEmitter testReportEmitter) {
        this.store = store;
        this.ciClient = ciClient;
        this.jobMetricsPuller = jobMetricsPuller;
        this.metricEmitter = metricEmitter;
        this.testReportEmitter = testReportEmitter;
    }

    /**
     * Process one pipeline of the given ref.
     *
     * @param ref     working copy of the ref, as refreshed by the caller
     * @param summary the pipeline as returned by the listing
     * @throws IOException if the remote or the ref update in the store fails
     */
    public void processPipelinesMetrics(final Ref ref, final PipelineSummary summary)
            throws IOException, InterruptedException {

        final ProjectPull pull = ref.project().pull();

        Pipeline pipeline = ciClient.getPipeline(ref.project().name(), summary.id());

        if (pull.variablesEnabled()) {
            pipeline = attachVariables(ref, pipeline);
        }

        // TODO compare the whole previous pipeline instead of the id only, status changes are missed here
        final double storedId = metricEmitter.getMetricValue(
                MetricKind.ID, ref.defaultLabelsValues(pipeline), pipeline.id());

        Ref current = ref;
        if (ref.latestPipeline().id() == 0 || storedId != pipeline.id()) {
            final Pipeline formerPipeline = ref.latestPipeline();
            current = ref.withLatestPipeline(pipeline);

            store.setRef(current);

            logger.debug("New pipeline observed: project-name={}, ref={}, ref-kind={}, pipeline={}, former-pipeline={}",
                    ref.project().name(), ref.name(), ref.kind().labelValue(), pipeline.id(), formerPipeline.id());

            emitPipelineMetrics(current, formerPipeline);

            if (pull.jobsEnabled()) {
                jobMetricsPuller.pullFullJobMetrics(current);
            }
        } else {
            jobMetricsPuller.pullMostRecentJobMetrics(current);
        }

        if (pull.testReportsEnabled() && Statuses.isFinished(current.latestPipeline().status())) {
            processTestReport(current);
        }
    }

    private Pipeline attachVariables(final Ref ref, final Pipeline pipeline) throws IOException, InterruptedException {
        if (store.pipelineVariablesExist(pipeline)) {
            return pipeline.withVariables(store.getPipelineVariables(pipeline));
        }

        try {
            final String variables = ciClient.getPipelineVariables(ref, pipeline);
            store.setPipelineVariables(pipeline, variables);
            return pipeline.withVariables(variables);
        } catch (final IOException e) {
            // Cached as empty, the pipeline is not asked for its variables again
            store.setPipelineVariables(pipeline, "");
            throw e;
        }
    }

    private void emitPipelineMetrics(final Ref ref, final Pipeline formerPipeline) {
        final Pipeline pipeline = ref.latestPipeline();
        final Map<String, String> labels = ref.defaultLabelsValues();

        // Start at 0 for unknown refs, a restart must not look like a new run
        double runCount = metricEmitter.getMetricValue(MetricKind.RUN_COUNT, labels, 0);
        if (formerPipeline.id() != 0 && formerPipeline.id() != pipeline.id()) {
            runCount++;
        }

        metricEmitter.setMetric(MetricKind.RUN_COUNT, labels, runCount);
        metricEmitter.setMetric(MetricKind.COVERAGE, labels, pipeline.coverage());
        metricEmitter.setMetric(MetricKind.ID, labels, pipeline.id());
        metricEmitter.emitStatusMetric(
                MetricKind.STATUS,
                labels,
                Statuses.PIPELINE_STATUSES,
                pipeline.status(),
                ref.project().outputSparseStatusMetrics());
        metricEmitter.setMetric(MetricKind.DURATION_SECONDS, labels, pipeline.durationSeconds());
        metricEmitter.setMetric(MetricKind.QUEUED_DURATION_SECONDS, labels, pipeline.queuedDurationSeconds());
        metricEmitter.setMetric(MetricKind.TIMESTAMP, labels, pipeline.timestamp());
    }

    private void processTestReport(final Ref ref) throws IOException, InterruptedException {
        final TestReport report = ciClient.getPipelineTestReport(ref, ref.latestPipeline());
        final Ref withReport = ref.withLatestPipeline(ref.latestPipeline().withTestReport(report));

        testReportEmitter.processTestReportMetrics(withReport, report);

        for (final TestSuite suite : report.testSuites()) {
            testReportEmitter.processTestSuiteMetrics(withReport, suite);
            if (withReport.project().pull().testCasesEnabled()) {
                for (final TestCase testCase : suite.testCases()) {
                    testReportEmitter.processTestCaseMetrics(withReport, suite, testCase);
                }
            }
        }
    }
}
