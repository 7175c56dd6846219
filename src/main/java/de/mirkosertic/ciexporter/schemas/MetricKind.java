package de.mirkosertic.ciexporter.schemas;

/**
 * All metric kinds produced by the pipeline controller, with their exposition names.
 */
public enum MetricKind {

    COVERAGE("gitlab_ci_pipeline_coverage"),
    DURATION_SECONDS("gitlab_ci_pipeline_duration_seconds"),
    ID("gitlab_ci_pipeline_id"),
    QUEUED_DURATION_SECONDS("gitlab_ci_pipeline_queued_duration_seconds"),
    RUN_COUNT("gitlab_ci_pipeline_run_count"),
    STATUS("gitlab_ci_pipeline_status"),
    TIMESTAMP("gitlab_ci_pipeline_timestamp"),

    TEST_REPORT_TOTAL_TIME("gitlab_ci_pipeline_test_report_total_time"),
    TEST_REPORT_TOTAL_COUNT("gitlab_ci_pipeline_test_report_total_count"),
    TEST_REPORT_SUCCESS_COUNT("gitlab_ci_pipeline_test_report_success_count"),
    TEST_REPORT_FAILED_COUNT("gitlab_ci_pipeline_test_report_failed_count"),
    TEST_REPORT_SKIPPED_COUNT("gitlab_ci_pipeline_test_report_skipped_count"),
    TEST_REPORT_ERROR_COUNT("gitlab_ci_pipeline_test_report_error_count"),

    TEST_SUITE_TOTAL_TIME("gitlab_ci_pipeline_test_suite_total_time"),
    TEST_SUITE_TOTAL_COUNT("gitlab_ci_pipeline_test_suite_total_count"),
    TEST_SUITE_SUCCESS_COUNT("gitlab_ci_pipeline_test_suite_success_count"),
    TEST_SUITE_FAILED_COUNT("gitlab_ci_pipeline_test_suite_failed_count"),
    TEST_SUITE_SKIPPED_COUNT("gitlab_ci_pipeline_test_suite_skipped_count"),
    TEST_SUITE_ERROR_COUNT("gitlab_ci_pipeline_test_suite_error_count"),

    TEST_CASE_EXECUTION_TIME("gitlab_ci_pipeline_test_case_execution_time"),
    TEST_CASE_STATUS("gitlab_ci_pipeline_test_case_status");

    private final String metricName;

    MetricKind(final String metricName) {
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }
}
