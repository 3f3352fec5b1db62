package org.carball.pgsight.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultConfiguration() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        // When
        MonitorConfig config = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(config.getMaxQueries()).isEqualTo(100);
        assertThat(config.getLogFile()).isNull();
        assertThat(config.isLogFileEnabled()).isFalse();
        assertThat(config.getSelfLabelPrefix()).isEqualTo("PgSight");
        assertThat(config.isAnnotateQueries()).isFalse();
        assertThat(config.getExcludedSourcePatterns()).containsExactly("org.carball.pgsight.report.");
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(
                "PGSIGHT_MAX_QUERIES", "250",
                "PGSIGHT_LOG_FILE", "/var/log/pgsight/queries.log",
                "PGSIGHT_SELF_LABEL_PREFIX", "Diag",
                "PGSIGHT_ANNOTATE_QUERIES", "true"));

        // When
        MonitorConfig config = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(config.getMaxQueries()).isEqualTo(250);
        assertThat(config.getLogFile()).isEqualTo(Paths.get("/var/log/pgsight/queries.log"));
        assertThat(config.getSelfLabelPrefix()).isEqualTo("Diag");
        assertThat(config.isAnnotateQueries()).isTrue();
    }

    @Test
    void shouldPreferCliArgumentsOverEnvironment() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("PGSIGHT_MAX_QUERIES", "250"));
        String[] args = {"--monitor.max-queries", "20", "--monitor.flush-timeout-ms", "750"};

        // When
        MonitorConfig config = loader.loadConfiguration(args);

        // Then - CLI > env vars > defaults
        assertThat(config.getMaxQueries()).isEqualTo(20);
        assertThat(config.getFlushTimeoutMs()).isEqualTo(750);
    }

    @Test
    void shouldIgnoreInvalidNumbers() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("PGSIGHT_MAX_QUERIES", "lots"));

        MonitorConfig config = loader.loadConfiguration(new String[]{"--monitor.flush-timeout-ms", "soon"});

        assertThat(config.getMaxQueries()).isEqualTo(100);
        assertThat(config.getFlushTimeoutMs()).isEqualTo(5000);
    }

    @Test
    void shouldLoadYamlFileBelowEnvironment() throws Exception {
        // Given
        Path yaml = tempDir.resolve("pgsight.yml");
        Files.writeString(yaml, String.join("\n",
                "monitor:",
                "  max_queries: 40",
                "  log_file: /tmp/pgsight.log",
                "  session_ttl_hours: 2",
                "  annotate_queries: true",
                "  excluded_source_patterns:",
                "    - com.acme.diagnostics.",
                ""));
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("PGSIGHT_MAX_QUERIES", "60"));

        // When
        MonitorConfig config = loader.loadConfiguration(yaml, new String[0]);

        // Then
        assertThat(config.getMaxQueries()).isEqualTo(60);
        assertThat(config.getLogFile()).isEqualTo(Paths.get("/tmp/pgsight.log"));
        assertThat(config.getSessionTtl()).isEqualTo(Duration.ofHours(2));
        assertThat(config.isAnnotateQueries()).isTrue();
        assertThat(config.getExcludedSourcePatterns()).containsExactly("com.acme.diagnostics.");
        assertThat(config.getIgnoredSourcePatterns()).contains("org.carball.pgsight.dashboard.");
    }

    @Test
    void shouldAcceptTopLevelYamlKeys() throws Exception {
        Path yaml = tempDir.resolve("flat.yml");
        Files.writeString(yaml, "max_queries: 15\nself_label_prefix: Audit\n");

        MonitorConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(yaml, new String[0]);

        assertThat(config.getMaxQueries()).isEqualTo(15);
        assertThat(config.getSelfLabelPrefix()).isEqualTo("Audit");
    }

    @Test
    void shouldThrowExceptionForMissingConfigurationFile() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        Path missing = tempDir.resolve("missing.yml");

        assertThatThrownBy(() -> loader.loadConfiguration(missing, new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    void shouldProvideHelpText() {
        String help = ConfigurationLoader.getConfigurationHelp();

        assertThat(help).contains("--monitor.max-queries");
        assertThat(help).contains("PGSIGHT_LOG_FILE");
        assertThat(help).contains("Priority Order");
    }
}
