package de.mirkosertic.ciexporter.schemas;

import java.util.List;

public record TestSuite(
        String name,
        double totalTime,
        long totalCount,
        long successCount,
        long failedCount,
        long skippedCount,
        long errorCount,
        List<TestCase> testCases
) {

    public TestSuite {
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }
}
