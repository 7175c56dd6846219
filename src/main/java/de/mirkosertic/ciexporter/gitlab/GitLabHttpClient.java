package de.mirkosertic.ciexporter.gitlab;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.ciexporter.schemas.Pipeline;
import de.mirkosertic.ciexporter.schemas.PipelineSummary;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.TestCase;
import de.mirkosertic.ciexporter.schemas.TestReport;
import de.mirkosertic.ciexporter.schemas.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@link CiClient} backed by the GitLab v4 REST API.
 * <p>
 * Authenticates with a private token header when one is configured. Pagination is limited to the
 * first page and failed requests are not retried.
 */
public class GitLabHttpClient implements CiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitLabHttpClient.class);

    private static final String API_PREFIX = "/api/v4";
    private static final String TOKEN_HEADER = "PRIVATE-TOKEN";

    private final String baseUrl;
    private final String token;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GitLabHttpClient(final String baseUrl, final String token, final long requestTimeoutMs) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.token = token;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<PipelineSummary> listProjectPipelines(final String projectName, final String refName, final int perPage)
            throws IOException, InterruptedException {

        final String path = projectPath(projectName) + "/pipelines?ref=" + encode(refName)
                + "&per_page=" + perPage + "&page=1";
        return parsePipelineSummaries(get(path));
    }

    @Override
    public Pipeline getPipeline(final String projectName, final long pipelineId) throws IOException, InterruptedException {
        return parsePipeline(get(projectPath(projectName) + "/pipelines/" + pipelineId));
    }

    @Override
    public String getPipelineVariables(final Ref ref, final Pipeline pipeline) throws IOException, InterruptedException {
        final String body = get(projectPath(ref.project().name()) + "/pipelines/" + pipeline.id() + "/variables");
        return concatenateVariables(body, ref.project().pull().variablesRegexp());
    }

    @Override
    public TestReport getPipelineTestReport(final Ref ref, final Pipeline pipeline) throws IOException, InterruptedException {
        return parseTestReport(get(projectPath(ref.project().name()) + "/pipelines/" + pipeline.id() + "/test_report"));
    }

    private String get(final String path) throws IOException, InterruptedException {
        final HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + API_PREFIX + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        if (token != null && !token.isEmpty()) {
            builder.header(TOKEN_HEADER, token);
        }

        logger.debug("GET {}", path);
        final HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        final int code = response.statusCode();
        if (code < 200 || code >= 300) {
            throw new GitLabApiException("GET " + path + " failed with HTTP " + code + " body=" + response.body(), code);
        }
        return response.body();
    }

    List<PipelineSummary> parsePipelineSummaries(final String json) throws IOException {
        final JsonNode root = objectMapper.readTree(json);
        final List<PipelineSummary> result = new ArrayList<>();
        if (root == null || !root.isArray()) {
            return result;
        }
        for (final JsonNode node : root) {
            result.add(new PipelineSummary(
                    node.path("id").asLong(),
                    node.path("ref").asText(""),
                    node.path("status").asText("")));
        }
        return result;
    }

    Pipeline parsePipeline(final String json) throws IOException {
        final JsonNode node = objectMapper.readTree(json);
        return new Pipeline(
                node.path("id").asLong(),
                node.path("ref").asText(""),
                node.path("source").asText(""),
                node.path("status").asText(""),
                parseCoverage(node.path("coverage")),
                node.path("duration").asDouble(0),
                node.path("queued_duration").asDouble(0),
                parseTimestamp(node.path("updated_at")),
                "",
                null);
    }

    TestReport parseTestReport(final String json) throws IOException {
        final JsonNode node = objectMapper.readTree(json);
        final List<TestSuite> suites = new ArrayList<>();
        for (final JsonNode suiteNode : node.path("test_suites")) {
            final List<TestCase> cases = new ArrayList<>();
            for (final JsonNode caseNode : suiteNode.path("test_cases")) {
                cases.add(new TestCase(
                        caseNode.path("name").asText(""),
                        caseNode.path("classname").asText(""),
                        caseNode.path("execution_time").asDouble(0),
                        caseNode.path("status").asText("")));
            }
            suites.add(new TestSuite(
                    suiteNode.path("name").asText(""),
                    suiteNode.path("total_time").asDouble(0),
                    suiteNode.path("total_count").asLong(0),
                    suiteNode.path("success_count").asLong(0),
                    suiteNode.path("failed_count").asLong(0),
                    suiteNode.path("skipped_count").asLong(0),
                    suiteNode.path("error_count").asLong(0),
                    cases));
        }
        return new TestReport(
                node.path("total_time").asDouble(0),
                node.path("total_count").asLong(0),
                node.path("success_count").asLong(0),
                node.path("failed_count").asLong(0),
                node.path("skipped_count").asLong(0),
                node.path("error_count").asLong(0),
                suites);
    }

    String concatenateVariables(final String json, final String keyRegexp) throws IOException {
        final Pattern keyPattern;
        try {
            keyPattern = Pattern.compile(keyRegexp);
        } catch (final PatternSyntaxException e) {
            throw new IOException("Invalid variables regexp: " + keyRegexp, e);
        }

        final StringJoiner joiner = new StringJoiner(",");
        final JsonNode root = objectMapper.readTree(json);
        if (root != null && root.isArray()) {
            for (final JsonNode variable : root) {
                final String key = variable.path("key").asText("");
                if (keyPattern.matcher(key).matches()) {
                    joiner.add(key + ":" + variable.path("value").asText(""));
                }
            }
        }
        return joiner.toString();
    }

    private static double parseCoverage(final JsonNode coverage) {
        if (coverage.isMissingNode() || coverage.isNull()) {
            return 0;
        }
        if (coverage.isNumber()) {
            return coverage.asDouble();
        }
        try {
            return Double.parseDouble(coverage.asText());
        } catch (final NumberFormatException e) {
            logger.warn("Unparseable pipeline coverage '{}', using 0", coverage.asText());
            return 0;
        }
    }

    private static double parseTimestamp(final JsonNode updatedAt) {
        if (updatedAt.isMissingNode() || updatedAt.isNull() || updatedAt.asText().isEmpty()) {
            return 0;
        }
        try {
            return OffsetDateTime.parse(updatedAt.asText()).toInstant().getEpochSecond();
        } catch (final DateTimeParseException e) {
            logger.warn("Unparseable pipeline update time '{}', using 0", updatedAt.asText());
            return 0;
        }
    }

    private static String projectPath(final String projectName) {
        return "/projects/" + encode(projectName);
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(final String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
