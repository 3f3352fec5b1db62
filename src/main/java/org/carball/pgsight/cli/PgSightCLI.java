package org.carball.pgsight.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgsight.annotation.AnnotationParser;
import org.carball.pgsight.config.ConfigurationLoader;
import org.carball.pgsight.config.MonitorConfig;
import org.carball.pgsight.explain.ExplainAnalyzer;
import org.carball.pgsight.model.monitor.CapturedQuery;
import org.carball.pgsight.model.plan.AnalysisSummary;
import org.carball.pgsight.model.plan.ExplainAnalysis;
import org.carball.pgsight.model.plan.PlanStats;
import org.carball.pgsight.model.plan.Problem;
import org.carball.pgsight.monitor.QueryLog;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Operator entry point: analyzes saved EXPLAIN ANALYZE output and reads query logs.
 */
@Slf4j
public class PgSightCLI {

    private static final String VERSION = "1.0.0";
    private static final int SQL_PREVIEW_LENGTH = 150;

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public PgSightCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
    }

    public static void main(String[] args) {
        int exitCode = new PgSightCLI(System.out, System.err, new ConfigurationLoader()).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        if (args.length == 0) {
            printUsage(err);
            return 1;
        }
        if (isHelpRequested(args)) {
            printUsage(out);
            return 0;
        }

        try {
            switch (args[0]) {
                case "explain":
                    return explain(args);
                case "log":
                    return showLog(args);
                default:
                    throw new IllegalArgumentException("Unknown command: " + args[0]);
            }
        } catch (IllegalArgumentException e) {
            err.println("❌ Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private int explain(String[] args) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            throw new IllegalArgumentException("explain requires a plan file");
        }

        Path planFile = Paths.get(args[1]);
        if (!Files.exists(planFile)) {
            throw new IOException("Plan file not found: " + planFile);
        }

        String format = optionValue(args, "--format", "text");
        ExplainAnalysis analysis = ExplainAnalyzer.analyze(Files.readString(planFile, StandardCharsets.UTF_8));

        switch (format) {
            case "json":
                out.println(toJson(analysis));
                break;
            case "text":
                printAnalysis(analysis);
                break;
            default:
                throw new IllegalArgumentException("Unknown format: " + format + " (expected text or json)");
        }
        return 0;
    }

    private int showLog(String[] args) {
        String configFile = optionValue(args, "--config", null);
        MonitorConfig config = configurationLoader.loadConfiguration(
                configFile != null ? Paths.get(configFile) : null, args);

        Path logFile = args.length > 1 && !args[1].startsWith("--") ? Paths.get(args[1]) : config.getLogFile();
        if (logFile == null) {
            throw new IllegalArgumentException("No query log given and none configured");
        }

        String sessionId = optionValue(args, "--session", null);
        Integer limit = parseLimit(optionValue(args, "--limit", null));

        List<CapturedQuery> queries;
        try (QueryLog queryLog = new QueryLog(logFile, 1)) {
            queries = queryLog.load(sessionId, limit);
        }

        out.printf("%d queries from %s%n", queries.size(), logFile);
        for (CapturedQuery query : queries) {
            out.printf("%10.2f ms  %s%n", query.durationMs(), preview(query.displaySql()));

            Map<String, String> annotation = query.annotation();
            String provenance = AnnotationParser.formatForDisplay(annotation);
            if (provenance == null && query.sourceLocation() != null) {
                provenance = query.sourceLocation().toString();
            }
            if (provenance != null && !provenance.isEmpty()) {
                out.println("             ↳ " + provenance);
            }
        }
        return 0;
    }

    private void printAnalysis(ExplainAnalysis analysis) {
        AnalysisSummary summary = analysis.summary();
        PlanStats stats = analysis.stats();

        out.printf("%s %s%n", summary.statusIcon(), summary.statusText());
        out.printf("   Problems: %d (critical: %d, warnings: %d, info: %d)%n",
                summary.totalProblems(), summary.criticalProblems(), summary.warnings(), summary.info());
        if (stats.getPlanningTime() != null) {
            out.printf("   Planning time: %.2f ms%n", stats.getPlanningTime());
        }
        if (stats.getExecutionTime() != null) {
            out.printf("   Execution time: %.2f ms%n", stats.getExecutionTime());
        }
        if (stats.getTotalCost() != null) {
            out.printf("   Total cost: %.2f%n", stats.getTotalCost());
        }

        for (Problem problem : analysis.problems()) {
            out.println();
            String location = problem.getLineNumber() != null ? " (line " + problem.getLineNumber() + ")" : "";
            out.printf("[%s] %s%s%n", problem.getSeverity().value().toUpperCase(), problem.getMessage(), location);
            if (problem.getDetails() != null) {
                out.println("   " + problem.getDetails());
            }
            out.println("   💡 " + problem.getRecommendation());
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis", e);
        }
    }

    private static Integer parseLimit(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid limit: " + value);
        }
    }

    private static String optionValue(String[] args, String option, String defaultValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(option)) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }

    private static String preview(String sql) {
        if (sql == null) {
            return "";
        }
        String singleLine = sql.replaceAll("\\s+", " ");
        return singleLine.length() > SQL_PREVIEW_LENGTH
                ? singleLine.substring(0, SQL_PREVIEW_LENGTH) + "..."
                : singleLine;
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream stream) {
        stream.println("pgsight v" + VERSION);
        stream.println();
        stream.println("Usage:");
        stream.println("  pgsight explain <plan-file> [--format text|json]");
        stream.println("  pgsight log [<log-file>] [--session <id>] [--limit <n>] [--config <file.yml>]");
        stream.println();
        stream.println("Commands:");
        stream.println("  explain   Analyze saved EXPLAIN (ANALYZE, BUFFERS) output and list performance problems");
        stream.println("  log       Print queries captured in a query log");
        stream.println();
        stream.print(ConfigurationLoader.getConfigurationHelp());
    }
}
