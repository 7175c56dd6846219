package de.mirkosertic.ciexporter;

import de.mirkosertic.ciexporter.config.ApplicationConfig;
import de.mirkosertic.ciexporter.config.LoggingConfigurator;
import de.mirkosertic.ciexporter.controller.LoggingJobMetricsPuller;
import de.mirkosertic.ciexporter.controller.MetricEmitter;
import de.mirkosertic.ciexporter.controller.PipelineProcessor;
import de.mirkosertic.ciexporter.controller.PipelineReconciler;
import de.mirkosertic.ciexporter.controller.TestReportEmitter;
import de.mirkosertic.ciexporter.gitlab.CiClient;
import de.mirkosertic.ciexporter.gitlab.GitLabHttpClient;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.store.LocalStore;
import de.mirkosertic.ciexporter.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the exporter.
 * Wires store, GitLab client and controller, then pulls every configured ref at a fixed interval.
 */
public class CiExporterApplication {

    private static final Logger logger = LoggerFactory.getLogger(CiExporterApplication.class);

    private final ApplicationConfig config;
    private final Store store;
    private final LoggingJobMetricsPuller jobMetricsPuller;
    private final PipelineReconciler reconciler;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "ref-puller");
        t.setDaemon(false);
        return t;
    });

    public CiExporterApplication(final ApplicationConfig config) {
        this(config, new LocalStore(),
                new GitLabHttpClient(config.getGitlabUrl(), config.getGitlabToken(), config.getRequestTimeoutMs()),
                new LoggingJobMetricsPuller());
    }

    CiExporterApplication(final ApplicationConfig config,
                          final Store store,
                          final CiClient ciClient,
                          final LoggingJobMetricsPuller jobMetricsPuller) {
        this.config = config;
        this.store = store;
        this.jobMetricsPuller = jobMetricsPuller;

        // Initialize services in dependency order
        final MetricEmitter metricEmitter = new MetricEmitter(store);
        final TestReportEmitter testReportEmitter = new TestReportEmitter(store, metricEmitter);
        final PipelineProcessor processor = new PipelineProcessor(store, ciClient, jobMetricsPuller, metricEmitter, testReportEmitter);
        this.reconciler = new PipelineReconciler(store, ciClient, processor);
    }

    /**
     * Pull every configured ref once. Failures of a ref are logged and do not stop the others.
     *
     * @return the number of refs pulled without error
     */
    public int pullAll() throws InterruptedException {
        final List<Ref> refs = config.getRefs();
        int succeeded = 0;
        for (final Ref ref : refs) {
            try {
                reconciler.pullRefMetrics(ref);
                succeeded++;
            } catch (final IOException e) {
                logger.error("Pulling ref metrics failed: project-name={}, ref={}, ref-kind={}",
                        ref.project().name(), ref.name(), ref.kind().labelValue(), e);
            }
        }
        logger.info("Pull cycle finished: refs={}, succeeded={}, metrics={}", refs.size(), succeeded, metricsCount());
        return succeeded;
    }

    /**
     * Start pulling at the configured interval.
     */
    public void start() {
        if (config.getRefs().isEmpty()) {
            logger.warn("No refs configured, nothing will be pulled");
        }

        scheduler.scheduleWithFixedDelay(() -> {
            try {
                pullAll();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Pull cycle interrupted");
            } catch (final RuntimeException e) {
                logger.error("Unexpected error during pull cycle", e);
            }
        }, 0, config.getPullIntervalSeconds(), TimeUnit.SECONDS);

        logger.info("Exporter started, pulling {} refs every {}s", config.getRefs().size(), config.getPullIntervalSeconds());
    }

    /**
     * Stop the scheduler, interrupting a running pull cycle.
     */
    public void shutdown() {
        logger.info("Shutting down exporter...");
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Pull cycle did not terminate in time");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Exporter shutdown complete: fullJobPulls={}, mostRecentJobPulls={}",
                jobMetricsPuller.getFullPulls(), jobMetricsPuller.getMostRecentPulls());
    }

    private long metricsCount() {
        try {
            return store.metricsCount();
        } catch (final IOException e) {
            logger.warn("Could not count metrics", e);
            return -1;
        }
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            final CiExporterApplication app = new CiExporterApplication(config);
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
            app.start();

        } catch (final Exception e) {
            System.err.println("Failed to start exporter: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
