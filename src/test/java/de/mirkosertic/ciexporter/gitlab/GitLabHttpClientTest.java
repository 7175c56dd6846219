package de.mirkosertic.ciexporter.gitlab;

import com.sun.net.httpserver.HttpServer;
import de.mirkosertic.ciexporter.schemas.Pipeline;
import de.mirkosertic.ciexporter.schemas.PipelineSummary;
import de.mirkosertic.ciexporter.schemas.Project;
import de.mirkosertic.ciexporter.schemas.ProjectPull;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.RefKind;
import de.mirkosertic.ciexporter.schemas.TestReport;
import de.mirkosertic.ciexporter.schemas.TestSuite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("GitLabHttpClient Tests")
class GitLabHttpClientTest {

    private static String fixture(final String name) throws IOException {
        try (final InputStream is = GitLabHttpClientTest.class.getResourceAsStream("/gitlab/" + name)) {
            assertThat(is).as("fixture %s", name).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("Response parsing")
    class ParsingTests {

        private final GitLabHttpClient client = new GitLabHttpClient("http://localhost", "", 1000);

        @Test
        @DisplayName("Should parse pipeline listing in remote order")
        void shouldParsePipelineListing() throws IOException {
            final List<PipelineSummary> summaries = client.parsePipelineSummaries(fixture("pipelines.json"));

            assertThat(summaries).containsExactly(
                    new PipelineSummary(47, "main", "pending"),
                    new PipelineSummary(48, "main", "success"));
        }

        @Test
        @DisplayName("Should parse pipeline details including string coverage and update time")
        void shouldParsePipelineDetails() throws IOException {
            final Pipeline pipeline = client.parsePipeline(fixture("pipeline.json"));

            assertThat(pipeline.id()).isEqualTo(46);
            assertThat(pipeline.ref()).isEqualTo("main");
            assertThat(pipeline.source()).isEqualTo("schedule");
            assertThat(pipeline.status()).isEqualTo("success");
            assertThat(pipeline.coverage()).isCloseTo(30.0, within(0.0001));
            assertThat(pipeline.durationSeconds()).isCloseTo(123.65, within(0.0001));
            assertThat(pipeline.queuedDurationSeconds()).isCloseTo(0.01, within(0.0001));
            assertThat(pipeline.timestamp()).isEqualTo(1470915155d);
            assertThat(pipeline.variables()).isEmpty();
            assertThat(pipeline.testReport()).isNull();
        }

        @Test
        @DisplayName("Should default null numeric fields of a running pipeline to zero")
        void shouldDefaultNullFields() throws IOException {
            final Pipeline pipeline = client.parsePipeline(fixture("pipeline-running.json"));

            assertThat(pipeline.id()).isEqualTo(49);
            assertThat(pipeline.status()).isEqualTo("running");
            assertThat(pipeline.coverage()).isZero();
            assertThat(pipeline.durationSeconds()).isZero();
            assertThat(pipeline.queuedDurationSeconds()).isZero();
            assertThat(pipeline.timestamp()).isZero();
        }

        @Test
        @DisplayName("Should parse nested test report")
        void shouldParseTestReport() throws IOException {
            final TestReport report = client.parseTestReport(fixture("test_report.json"));

            assertThat(report.totalCount()).isEqualTo(3);
            assertThat(report.successCount()).isEqualTo(1);
            assertThat(report.failedCount()).isEqualTo(1);
            assertThat(report.skippedCount()).isEqualTo(1);
            assertThat(report.errorCount()).isZero();
            assertThat(report.totalTime()).isCloseTo(5.2, within(0.0001));
            assertThat(report.testSuites()).extracting(TestSuite::name).containsExactly("unit", "integration");

            final TestSuite unit = report.testSuites().get(0);
            assertThat(unit.testCases()).hasSize(3);
            assertThat(unit.testCases().get(1).name()).isEqualTo("divides by zero");
            assertThat(unit.testCases().get(1).classname()).isEqualTo("CalculatorTest");
            assertThat(unit.testCases().get(1).status()).isEqualTo("failed");
            assertThat(unit.testCases().get(1).executionTime()).isCloseTo(3.7, within(0.0001));
            assertThat(report.testSuites().get(1).testCases()).isEmpty();
        }

        @Test
        @DisplayName("Should concatenate all variables with the default filter")
        void shouldConcatenateAllVariables() throws IOException {
            assertThat(client.concatenateVariables(fixture("variables.json"), ".*"))
                    .isEqualTo("RUN_NIGHTLY_BUILD:true,DEPLOY_TARGET:staging,foo:bar");
        }

        @Test
        @DisplayName("Should only keep variables whose key matches the filter")
        void shouldFilterVariablesByKey() throws IOException {
            assertThat(client.concatenateVariables(fixture("variables.json"), "[A-Z_]+"))
                    .isEqualTo("RUN_NIGHTLY_BUILD:true,DEPLOY_TARGET:staging");
        }

        @Test
        @DisplayName("Should reject an invalid variables filter")
        void shouldRejectInvalidFilter() {
            assertThatThrownBy(() -> client.concatenateVariables("[]", "[unclosed"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("[unclosed");
        }
    }

    @Nested
    @DisplayName("HTTP interaction")
    class HttpTests {

        private HttpServer server;
        private final AtomicReference<String> lastRawPath = new AtomicReference<>();
        private final AtomicReference<String> lastRawQuery = new AtomicReference<>();
        private final AtomicReference<String> lastToken = new AtomicReference<>();
        private volatile int responseCode = 200;
        private volatile String responseBody = "[]";

        @BeforeEach
        void startServer() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/", exchange -> {
                lastRawPath.set(exchange.getRequestURI().getRawPath());
                lastRawQuery.set(exchange.getRequestURI().getRawQuery());
                lastToken.set(exchange.getRequestHeaders().getFirst("PRIVATE-TOKEN"));
                final byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(responseCode, body.length);
                try (final OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            });
            server.start();
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        private GitLabHttpClient client() {
            return new GitLabHttpClient("http://127.0.0.1:" + server.getAddress().getPort() + "/", "secret", 5000);
        }

        @Test
        @DisplayName("Should list a single page of pipelines with encoded project and ref")
        void shouldListPipelines() throws Exception {
            responseBody = fixture("pipelines.json");

            final List<PipelineSummary> summaries = client()
                    .listProjectPipelines("group/app", "refs/merge-requests/42/head", 5);

            assertThat(summaries).hasSize(2);
            assertThat(lastRawPath.get()).isEqualTo("/api/v4/projects/group%2Fapp/pipelines");
            assertThat(lastRawQuery.get()).isEqualTo("ref=refs%2Fmerge-requests%2F42%2Fhead&per_page=5&page=1");
            assertThat(lastToken.get()).isEqualTo("secret");
        }

        @Test
        @DisplayName("Should fetch filtered variables of a pipeline")
        void shouldFetchVariables() throws Exception {
            responseBody = fixture("variables.json");
            final Project project = new Project("group/app", "",
                    new ProjectPull(1, false, true, "DEPLOY_.*", false, false), true);
            final Ref ref = new Ref(project, RefKind.BRANCH, "main");
            final Pipeline pipeline = new Pipeline(46, "main", "push", "success", 0, 0, 0, 0, "", null);

            final String variables = client().getPipelineVariables(ref, pipeline);

            assertThat(variables).isEqualTo("DEPLOY_TARGET:staging");
            assertThat(lastRawPath.get()).isEqualTo("/api/v4/projects/group%2Fapp/pipelines/46/variables");
        }

        @Test
        @DisplayName("Should fail with the HTTP status on non successful responses")
        void shouldFailOnErrorStatus() {
            responseCode = 404;
            responseBody = "{\"message\":\"404 Project Not Found\"}";

            assertThatThrownBy(() -> client().getPipeline("group/missing", 1))
                    .isInstanceOf(GitLabApiException.class)
                    .hasMessageContaining("404")
                    .satisfies(e -> assertThat(((GitLabApiException) e).getStatusCode()).isEqualTo(404));
        }
    }
}
