package de.mirkosertic.ciexporter.controller;

import de.mirkosertic.ciexporter.schemas.MetricKind;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.TestCase;
import de.mirkosertic.ciexporter.schemas.TestReport;
import de.mirkosertic.ciexporter.schemas.TestSuite;
import de.mirkosertic.ciexporter.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens a pipeline test report into report, suite and case level metrics.
 * <p>
 * Every method refreshes the ref from the store first. A failing refresh is logged and the
 * metrics are skipped; nothing is propagated to the caller.
 */
public class TestReportEmitter {

    private static final Logger logger = LoggerFactory.getLogger(TestReportEmitter.class);

    static final String TEST_SUITE_NAME_LABEL = "test_suite_name";
    static final String TEST_CASE_NAME_LABEL = "test_case_name";
    static final String TEST_CASE_CLASSNAME_LABEL = "test_case_classname";

    private final Store store;
    private final MetricEmitter metricEmitter;

    public TestReportEmitter(final Store store, final MetricEmitter metricEmitter) {
        this.store = store;
        this.metricEmitter = metricEmitter;
    }

    public void processTestReportMetrics(final Ref ref, final TestReport report) {
        final Map<String, String> labels = ref.defaultLabelsValues();

        if (refresh(ref, "project-name=" + ref.project().name() + ", ref=" + ref.name()).isEmpty()) {
            return;
        }

        logger.trace("Processing test report metrics: project-name={}, ref={}", ref.project().name(), ref.name());

        metricEmitter.setMetric(MetricKind.TEST_REPORT_ERROR_COUNT, labels, report.errorCount());
        metricEmitter.setMetric(MetricKind.TEST_REPORT_FAILED_COUNT, labels, report.failedCount());
        metricEmitter.setMetric(MetricKind.TEST_REPORT_SKIPPED_COUNT, labels, report.skippedCount());
        metricEmitter.setMetric(MetricKind.TEST_REPORT_SUCCESS_COUNT, labels, report.successCount());
        metricEmitter.setMetric(MetricKind.TEST_REPORT_TOTAL_COUNT, labels, report.totalCount());
        metricEmitter.setMetric(MetricKind.TEST_REPORT_TOTAL_TIME, labels, report.totalTime());
    }

    public void processTestSuiteMetrics(final Ref ref, final TestSuite suite) {
        final Map<String, String> labels = ref.defaultLabelsValues();
        labels.put(TEST_SUITE_NAME_LABEL, suite.name());

        if (refresh(ref, "project-name=" + ref.project().name() + ", ref=" + ref.name()
                + ", test-suite-name=" + suite.name()).isEmpty()) {
            return;
        }

        logger.trace("Processing test suite metrics: project-name={}, ref={}, test-suite-name={}",
                ref.project().name(), ref.name(), suite.name());

        metricEmitter.setMetric(MetricKind.TEST_SUITE_ERROR_COUNT, labels, suite.errorCount());
        metricEmitter.setMetric(MetricKind.TEST_SUITE_FAILED_COUNT, labels, suite.failedCount());
        metricEmitter.setMetric(MetricKind.TEST_SUITE_SKIPPED_COUNT, labels, suite.skippedCount());
        metricEmitter.setMetric(MetricKind.TEST_SUITE_SUCCESS_COUNT, labels, suite.successCount());
        metricEmitter.setMetric(MetricKind.TEST_SUITE_TOTAL_COUNT, labels, suite.totalCount());
        metricEmitter.setMetric(MetricKind.TEST_SUITE_TOTAL_TIME, labels, suite.totalTime());
    }

    public void processTestCaseMetrics(final Ref ref, final TestSuite suite, final TestCase testCase) {
        final Map<String, String> labels = ref.defaultLabelsValues();
        labels.put(TEST_SUITE_NAME_LABEL, suite.name());
        labels.put(TEST_CASE_NAME_LABEL, testCase.name());
        labels.put(TEST_CASE_CLASSNAME_LABEL, testCase.classname());

        final Optional<Ref> refreshed = refresh(ref, "project-name=" + ref.project().name() + ", ref=" + ref.name()
                + ", test-suite-name=" + suite.name() + ", test-case-name=" + testCase.name()
                + ", test-case-status=" + testCase.status());
        if (refreshed.isEmpty()) {
            return;
        }

        logger.trace("Processing test case metrics: project-name={}, ref={}, test-suite-name={}, test-case-name={}",
                ref.project().name(), ref.name(), suite.name(), testCase.name());

        metricEmitter.setMetric(MetricKind.TEST_CASE_EXECUTION_TIME, labels, testCase.executionTime());
        metricEmitter.emitStatusMetric(
                MetricKind.TEST_CASE_STATUS,
                labels,
                Statuses.PIPELINE_STATUSES,
                testCase.status(),
                refreshed.get().project().outputSparseStatusMetrics());
    }

    /**
     * @return the stored ref, the given one if it was never stored, or empty if the store failed
     */
    private Optional<Ref> refresh(final Ref ref, final String logContext) {
        try {
            return Optional.of(store.getRef(ref.key()).orElse(ref));
        } catch (final IOException e) {
            logger.error("Getting ref from the store failed: {}", logContext, e);
            return Optional.empty();
        }
    }
}
