package de.mirkosertic.ciexporter.schemas;

import java.util.List;

/**
 * Aggregated test results of a single pipeline.
 */
public record TestReport(
        double totalTime,
        long totalCount,
        long successCount,
        long failedCount,
        long skippedCount,
        long errorCount,
        List<TestSuite> testSuites
) {

    public TestReport {
        testSuites = testSuites == null ? List.of() : List.copyOf(testSuites);
    }
}
