package org.carball.pgsight.config;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class MonitorConfig {

    // Buffer
    @Builder.Default
    private int maxQueries = 100;

    // Query log; null disables file logging
    private Path logFile;

    @Builder.Default
    private int logQueueCapacity = 10_000;

    @Builder.Default
    private long flushTimeoutMs = 5_000;

    // Self-exclusion
    @Builder.Default
    private String selfLabelPrefix = "PgSight";

    /**
     * Class name prefixes of the reporting code that issues its own bookkeeping queries.
     * A query with any of these on its call stack is never captured.
     */
    @Singular
    private List<String> excludedSourcePatterns;

    /**
     * Class name prefixes never treated as self-origin, even when they live next to the
     * excluded code. The dashboard belongs here: queries it triggers are application signal.
     */
    @Singular
    private List<String> ignoredSourcePatterns;

    /**
     * Class name prefixes skipped when looking for the application frame that issued a query.
     */
    @Singular
    private List<String> frameworkPatterns;

    @Builder.Default
    private int callerFramesToSkip = 1;

    @Builder.Default
    private int callerFrameLimit = 50;

    @Builder.Default
    private int selfOriginFrameLimit = 30;

    // Query annotation
    @Builder.Default
    private boolean annotateQueries = false;

    // Shared session state
    @Builder.Default
    private Duration sessionTtl = Duration.ofHours(24);

    /**
     * Creates the default configuration: in-memory buffer of 100 queries, no query log.
     */
    public static MonitorConfig defaults() {
        return defaultsBuilder().build();
    }

    /**
     * Builder pre-populated with the default source pattern lists.
     */
    public static MonitorConfigBuilder defaultsBuilder() {
        return MonitorConfig.builder()
                .excludedSourcePattern("org.carball.pgsight.report.")
                .ignoredSourcePattern("org.carball.pgsight.monitor.QueryMonitor")
                .ignoredSourcePattern("org.carball.pgsight.dashboard.")
                .frameworkPattern("java.")
                .frameworkPattern("javax.")
                .frameworkPattern("jdk.")
                .frameworkPattern("sun.")
                .frameworkPattern("com.sun.")
                .frameworkPattern("org.junit.")
                .frameworkPattern("org.springframework.")
                .frameworkPattern("org.hibernate.")
                .frameworkPattern("com.zaxxer.hikari.")
                .frameworkPattern("org.postgresql.")
                .frameworkPattern("org.slf4j.")
                .frameworkPattern("ch.qos.logback.")
                .frameworkPattern("org.carball.pgsight.caller.")
                .frameworkPattern("org.carball.pgsight.monitor.")
                .frameworkPattern("org.carball.pgsight.annotation.")
                .frameworkPattern("org.carball.pgsight.report.")
                .frameworkPattern("org.carball.pgsight.dashboard.");
    }

    public boolean isLogFileEnabled() {
        return logFile != null;
    }

    /**
     * Validates the configuration and logs warnings for problematic values.
     */
    public void validate() {
        if (maxQueries <= 0) {
            log.warn("Max queries ({}) should be positive; the buffer will keep nothing", maxQueries);
        }

        if (logQueueCapacity <= 0) {
            log.warn("Log queue capacity ({}) should be positive", logQueueCapacity);
        }

        if (flushTimeoutMs <= 0) {
            log.warn("Flush timeout ({} ms) should be positive; stop will not wait for pending log writes",
                    flushTimeoutMs);
        }

        if (selfLabelPrefix == null || selfLabelPrefix.isBlank()) {
            log.warn("Self label prefix is empty; the monitor may capture its own queries");
        }

        if (callerFramesToSkip < 0) {
            log.warn("Caller frames to skip ({}) should not be negative", callerFramesToSkip);
        }

        log.debug("Using monitor config - max queries: {}, log file: {}, self prefix: {}",
                maxQueries, logFile, selfLabelPrefix);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Max queries: %d | Log file: %s | Self label: %s | Annotate: %s",
                maxQueries, logFile != null ? logFile : "disabled", selfLabelPrefix, annotateQueries);
    }
}
