package de.mirkosertic.ciexporter.config;

import de.mirkosertic.ciexporter.schemas.Project;
import de.mirkosertic.ciexporter.schemas.ProjectPull;
import de.mirkosertic.ciexporter.schemas.Ref;
import de.mirkosertic.ciexporter.schemas.RefKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Central configuration of the exporter.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.ciexporter/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_GITLAB_URL = "CI_EXPORTER_GITLAB_URL";
    private static final String ENV_GITLAB_TOKEN = "CI_EXPORTER_GITLAB_TOKEN";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".ciexporter";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // GitLab settings
    private String gitlabUrl = "https://gitlab.com";
    private String gitlabToken = "";
    private long requestTimeoutMs = 10000;

    // Scheduling of the pull cycles
    private long pullIntervalSeconds = 30;

    // Defaults applied to every project unless overridden
    private boolean defaultOutputSparseStatusMetrics = true;
    private ProjectPull defaultPull = ProjectPull.DEFAULT;

    private final List<Ref> refs = new ArrayList<>();

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath());
    }

    /**
     * Load configuration, reading the user config from the given path instead of the home directory.
     */
    public static ApplicationConfig load(final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig();

        // Defaults and the project list may come from both files, the last one defining projects wins
        final List<Map<String, Object>> sources = new ArrayList<>();
        config.readClasspath().ifPresent(sources::add);
        config.readUserConfig(userConfigPath).ifPresent(sources::add);

        for (final Map<String, Object> source : sources) {
            config.applySettings(source);
        }
        for (final Map<String, Object> source : sources) {
            config.applyProjects(source);
        }

        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: gitlabUrl={}, refs={}, pullIntervalSeconds={}, deployedMode={}",
                config.gitlabUrl, config.refs.size(), config.pullIntervalSeconds, config.deployedMode);

        return config;
    }

    private Optional<Map<String, Object>> readClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                    return Optional.of(config);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
        return Optional.empty();
    }

    private Optional<Map<String, Object>> readUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    logger.debug("Loaded user config from: {}", userConfigPath);
                    return Optional.of(config);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    private void applySettings(final Map<String, Object> config) {
        final Map<String, Object> gitlabConfig = (Map<String, Object>) config.get("gitlab");
        if (gitlabConfig != null) {
            if (gitlabConfig.get("url") != null) {
                this.gitlabUrl = resolveVariables(gitlabConfig.get("url").toString());
            }
            if (gitlabConfig.get("token") != null) {
                this.gitlabToken = resolveVariables(gitlabConfig.get("token").toString());
            }
            if (gitlabConfig.containsKey("request-timeout-ms")) {
                this.requestTimeoutMs = ((Number) gitlabConfig.get("request-timeout-ms")).longValue();
            }
        }

        final Map<String, Object> pullConfig = (Map<String, Object>) config.get("pull");
        if (pullConfig != null && pullConfig.containsKey("interval-seconds")) {
            this.pullIntervalSeconds = ((Number) pullConfig.get("interval-seconds")).longValue();
        }

        final Map<String, Object> defaults = (Map<String, Object>) config.get("project-defaults");
        if (defaults != null) {
            if (defaults.containsKey("output-sparse-status-metrics")) {
                this.defaultOutputSparseStatusMetrics = (Boolean) defaults.get("output-sparse-status-metrics");
            }
            final Map<String, Object> defaultPullConfig = (Map<String, Object>) defaults.get("pull");
            if (defaultPullConfig != null) {
                this.defaultPull = applyPullConfig(this.defaultPull, defaultPullConfig);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyProjects(final Map<String, Object> config) {
        final Object projects = config.get("projects");
        if (!(projects instanceof List)) {
            return;
        }

        refs.clear();
        for (final Map<String, Object> projectConfig : (List<Map<String, Object>>) projects) {
            final Object name = projectConfig.get("name");
            if (name == null) {
                logger.warn("Skipping project without name: {}", projectConfig);
                continue;
            }

            final Object topics = projectConfig.get("topics");
            final boolean sparse = projectConfig.containsKey("output-sparse-status-metrics")
                    ? (Boolean) projectConfig.get("output-sparse-status-metrics")
                    : defaultOutputSparseStatusMetrics;
            final Map<String, Object> pullConfig = (Map<String, Object>) projectConfig.get("pull");
            final ProjectPull pull = pullConfig != null ? applyPullConfig(defaultPull, pullConfig) : defaultPull;

            final Project project = new Project(name.toString(), topics != null ? topics.toString() : "", pull, sparse);

            final Object refList = projectConfig.get("refs");
            if (refList instanceof List) {
                for (final Map<String, Object> refConfig : (List<Map<String, Object>>) refList) {
                    final Object refName = refConfig.get("name");
                    if (refName == null) {
                        logger.warn("Skipping ref without name in project {}", project.name());
                        continue;
                    }
                    final Object kind = refConfig.getOrDefault("kind", "branch");
                    refs.add(new Ref(project, RefKind.fromLabelValue(kind.toString()), refName.toString()));
                }
            }
        }
    }

    private static ProjectPull applyPullConfig(final ProjectPull base, final Map<String, Object> pullConfig) {
        int perRef = base.perRef();
        boolean jobsEnabled = base.jobsEnabled();
        boolean variablesEnabled = base.variablesEnabled();
        String variablesRegexp = base.variablesRegexp();
        boolean testReportsEnabled = base.testReportsEnabled();
        boolean testCasesEnabled = base.testCasesEnabled();

        if (pullConfig.containsKey("per-ref")) {
            perRef = ((Number) pullConfig.get("per-ref")).intValue();
        }
        if (pullConfig.containsKey("jobs-enabled")) {
            jobsEnabled = (Boolean) pullConfig.get("jobs-enabled");
        }
        if (pullConfig.containsKey("variables-enabled")) {
            variablesEnabled = (Boolean) pullConfig.get("variables-enabled");
        }
        if (pullConfig.containsKey("variables-regexp")) {
            variablesRegexp = pullConfig.get("variables-regexp").toString();
        }
        if (pullConfig.containsKey("test-reports-enabled")) {
            testReportsEnabled = (Boolean) pullConfig.get("test-reports-enabled");
        }
        if (pullConfig.containsKey("test-cases-enabled")) {
            testCasesEnabled = (Boolean) pullConfig.get("test-cases-enabled");
        }

        return new ProjectPull(perRef, jobsEnabled, variablesEnabled, variablesRegexp, testReportsEnabled, testCasesEnabled);
    }

    private void applyEnvironmentOverrides() {
        final String envUrl = System.getenv(ENV_GITLAB_URL);
        if (envUrl != null && !envUrl.trim().isEmpty()) {
            this.gitlabUrl = envUrl.trim();
            logger.info("GitLab URL from environment: {}", this.gitlabUrl);
        }

        final String envToken = System.getenv(ENV_GITLAB_TOKEN);
        if (envToken != null && !envToken.trim().isEmpty()) {
            this.gitlabToken = envToken.trim();
        }

        // System property for the URL
        final String propUrl = System.getProperty("ciexporter.gitlab.url");
        if (propUrl != null && !propUrl.isEmpty()) {
            this.gitlabUrl = propUrl;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public String getGitlabUrl() {
        return gitlabUrl;
    }

    public String getGitlabToken() {
        return gitlabToken;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public long getPullIntervalSeconds() {
        return pullIntervalSeconds;
    }

    public ProjectPull getDefaultPull() {
        return defaultPull;
    }

    public boolean isDefaultOutputSparseStatusMetrics() {
        return defaultOutputSparseStatusMetrics;
    }

    public List<Ref> getRefs() {
        return List.copyOf(refs);
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
