package org.carball.pgsight.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public MonitorConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public MonitorConfig loadConfiguration(Path yamlFile, String[] args) {
        log.debug("Loading monitor configuration");

        MonitorConfig.MonitorConfigBuilder builder = MonitorConfig.defaultsBuilder();

        if (yamlFile != null) {
            applyYamlFile(builder, yamlFile);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        MonitorConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyYamlFile(MonitorConfig.MonitorConfigBuilder builder, Path yamlFile) {
        if (!Files.exists(yamlFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + yamlFile);
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(yamlFile.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid configuration file " + yamlFile + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            log.warn("Configuration file {} is empty, using defaults", yamlFile);
            return;
        }

        // Accept the settings either at the top level or under a "monitor" section
        JsonNode monitor = root.has("monitor") ? root.get("monitor") : root;

        if (monitor.has("max_queries")) {
            builder.maxQueries(monitor.get("max_queries").asInt());
        }
        if (monitor.has("log_file")) {
            String logFile = monitor.get("log_file").asText();
            builder.logFile(logFile.isBlank() ? null : Paths.get(logFile));
        }
        if (monitor.has("log_queue_capacity")) {
            builder.logQueueCapacity(monitor.get("log_queue_capacity").asInt());
        }
        if (monitor.has("flush_timeout_ms")) {
            builder.flushTimeoutMs(monitor.get("flush_timeout_ms").asLong());
        }
        if (monitor.has("self_label_prefix")) {
            builder.selfLabelPrefix(monitor.get("self_label_prefix").asText());
        }
        if (monitor.has("caller_frames_to_skip")) {
            builder.callerFramesToSkip(monitor.get("caller_frames_to_skip").asInt());
        }
        if (monitor.has("caller_frame_limit")) {
            builder.callerFrameLimit(monitor.get("caller_frame_limit").asInt());
        }
        if (monitor.has("annotate_queries")) {
            builder.annotateQueries(monitor.get("annotate_queries").asBoolean());
        }
        if (monitor.has("session_ttl_hours")) {
            builder.sessionTtl(Duration.ofHours(monitor.get("session_ttl_hours").asLong()));
        }

        replaceList(monitor, "excluded_source_patterns", builder::clearExcludedSourcePatterns,
                builder::excludedSourcePatterns);
        replaceList(monitor, "ignored_source_patterns", builder::clearIgnoredSourcePatterns,
                builder::ignoredSourcePatterns);
        replaceList(monitor, "framework_patterns", builder::clearFrameworkPatterns,
                builder::frameworkPatterns);

        log.debug("Applied configuration file {}", yamlFile);
    }

    private void replaceList(JsonNode node, String key, Runnable clear, Consumer<List<String>> addAll) {
        JsonNode values = node.get(key);
        if (values == null) {
            return;
        }
        if (!values.isArray()) {
            log.warn("Configuration key {} should be a list, ignoring", key);
            return;
        }

        List<String> patterns = new ArrayList<>();
        values.forEach(value -> patterns.add(value.asText()));
        clear.run();
        addAll.accept(patterns);
    }

    private void applyEnvironmentVariables(MonitorConfig.MonitorConfigBuilder builder) {
        if (environment.containsKey("PGSIGHT_MAX_QUERIES")) {
            try {
                builder.maxQueries(Integer.parseInt(environment.get("PGSIGHT_MAX_QUERIES")));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for PGSIGHT_MAX_QUERIES: {}", environment.get("PGSIGHT_MAX_QUERIES"));
            }
        }
        if (environment.containsKey("PGSIGHT_LOG_FILE")) {
            String logFile = environment.get("PGSIGHT_LOG_FILE");
            builder.logFile(logFile == null || logFile.isBlank() ? null : Paths.get(logFile));
        }
        if (environment.containsKey("PGSIGHT_SELF_LABEL_PREFIX")) {
            builder.selfLabelPrefix(environment.get("PGSIGHT_SELF_LABEL_PREFIX"));
        }
        if (environment.containsKey("PGSIGHT_ANNOTATE_QUERIES")) {
            builder.annotateQueries(Boolean.parseBoolean(environment.get("PGSIGHT_ANNOTATE_QUERIES")));
        }
    }

    private void applyCLIArguments(MonitorConfig.MonitorConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--monitor.max-queries":
                        builder.maxQueries(Integer.parseInt(value));
                        break;
                    case "--monitor.log-file":
                        builder.logFile(Paths.get(value));
                        break;
                    case "--monitor.self-label":
                        builder.selfLabelPrefix(value);
                        break;
                    case "--monitor.annotate":
                        builder.annotateQueries(Boolean.parseBoolean(value));
                        break;
                    case "--monitor.flush-timeout-ms":
                        builder.flushTimeoutMs(Long.parseLong(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for monitor configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Monitor Configuration Options:

            CLI Arguments:
              --monitor.max-queries <num>        Maximum queries kept in the in-memory buffer
              --monitor.log-file <path>          Append-only query log (JSON lines)
              --monitor.self-label <prefix>      Query label prefix of the monitor's own queries
              --monitor.annotate <true|false>    Prepend source location comments to queries
              --monitor.flush-timeout-ms <num>   Time stop waits for pending log writes

            Environment Variables:
              PGSIGHT_MAX_QUERIES                Same as --monitor.max-queries
              PGSIGHT_LOG_FILE                   Same as --monitor.log-file
              PGSIGHT_SELF_LABEL_PREFIX          Same as --monitor.self-label
              PGSIGHT_ANNOTATE_QUERIES           Same as --monitor.annotate

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file (--config <file.yml>)
              4. Built-in defaults
            """;
    }
}
