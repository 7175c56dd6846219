package de.mirkosertic.ciexporter.controller;

import de.mirkosertic.ciexporter.schemas.Ref;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link JobMetricsPuller} that only records the requests. Used when no job level exporter is wired in.
 */
public class LoggingJobMetricsPuller implements JobMetricsPuller {

    private static final Logger logger = LoggerFactory.getLogger(LoggingJobMetricsPuller.class);

    private final AtomicLong fullPulls = new AtomicLong();
    private final AtomicLong mostRecentPulls = new AtomicLong();

    @Override
    public void pullFullJobMetrics(final Ref ref) {
        fullPulls.incrementAndGet();
        logger.debug("Full job pull requested: project-name={}, ref={}, ref-kind={}, pipeline={}",
                ref.project().name(), ref.name(), ref.kind().labelValue(), ref.latestPipeline().id());
    }

    @Override
    public void pullMostRecentJobMetrics(final Ref ref) {
        mostRecentPulls.incrementAndGet();
        logger.debug("Most recent job pull requested: project-name={}, ref={}, ref-kind={}",
                ref.project().name(), ref.name(), ref.kind().labelValue());
    }

    public long getFullPulls() {
        return fullPulls.get();
    }

    public long getMostRecentPulls() {
        return mostRecentPulls.get();
    }
}
