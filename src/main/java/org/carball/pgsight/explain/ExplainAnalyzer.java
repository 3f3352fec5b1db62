package org.carball.pgsight.explain;

import org.carball.pgsight.model.plan.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzes EXPLAIN (ANALYZE, BUFFERS) text output: annotates every line and runs a fixed
 * battery of heuristic detectors over it.
 *
 * <p>All work happens in the constructor. Instances are immutable and the result is a pure
 * function of the input text; malformed or partial plans simply yield fewer fields and problems.
 */
public class ExplainAnalyzer {

    // Sequential scan thresholds
    private static final double SEQ_SCAN_COST_THRESHOLD = 1000;
    private static final long SEQ_SCAN_ROWS_THRESHOLD = 1000;
    private static final double SEQ_SCAN_TIME_THRESHOLD_MS = 100;

    private static final double HIGH_COST_THRESHOLD = 10000;
    private static final double SLOW_SORT_THRESHOLD_MS = 1000;

    // Row estimates below this on both sides are noise
    private static final long ESTIMATION_NOISE_FLOOR = 10;
    private static final double ESTIMATION_RATIO_THRESHOLD = 10;

    private static final double SLOW_EXECUTION_THRESHOLD_MS = 1000;
    private static final double SLOW_PLANNING_THRESHOLD_MS = 100;

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("\\bon (\\w+(?:\\.\\w+)?)");
    private static final Pattern EXTERNAL_SORT_PATTERN = Pattern.compile("external.*sort", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLANNING_TIME_PATTERN = Pattern.compile("Planning Time: (\\d+(?:\\.\\d+)?) ms");
    private static final Pattern EXECUTION_TIME_PATTERN = Pattern.compile("Execution Time: (\\d+(?:\\.\\d+)?) ms");
    private static final Pattern ROOT_COST_PATTERN = Pattern.compile("cost=\\d+(?:\\.\\d+)?\\.\\.(\\d+(?:\\.\\d+)?)");
    private static final Pattern ROOT_ROWS_PATTERN = Pattern.compile("rows=(\\d+)");

    private final String rawOutput;
    private final List<String> lines;
    private final List<PlanAnnotation> annotatedLines;
    private final PlanStats stats;
    private final List<Problem> problems;
    private final AnalysisSummary summary;

    public ExplainAnalyzer(String explainOutput) {
        this.rawOutput = explainOutput == null ? "" : explainOutput;
        this.lines = splitLines(rawOutput);
        this.annotatedLines = annotateLines();
        this.stats = extractStats();

        List<Problem> detected = new ArrayList<>();
        detectSequentialScans(detected);
        detectHighCostOperations(detected);
        detectSortOperations(detected);
        detectEstimationErrors(detected);
        detectTimingIssues(detected);
        this.problems = Collections.unmodifiableList(detected);

        this.summary = buildSummary(problems);
    }

    /**
     * Convenience entry point returning the full analysis.
     */
    public static ExplainAnalysis analyze(String explainOutput) {
        return new ExplainAnalyzer(explainOutput).toAnalysis();
    }

    public ExplainAnalysis toAnalysis() {
        return new ExplainAnalysis(rawOutput, annotatedLines, problems, summary, stats);
    }

    public String getRawOutput() {
        return rawOutput;
    }

    public List<PlanAnnotation> getAnnotatedLines() {
        return annotatedLines;
    }

    public List<Problem> getProblems() {
        return problems;
    }

    public AnalysisSummary getSummary() {
        return summary;
    }

    public PlanStats getStats() {
        return stats;
    }

    private static List<String> splitLines(String text) {
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(text.split("\\r?\\n")));
    }

    private List<PlanAnnotation> annotateLines() {
        List<PlanAnnotation> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            NodeType nodeType = PlanLineClassifier.classify(line);
            result.add(new PlanAnnotation(
                    i + 1,
                    line,
                    nodeType,
                    nodeType != null ? nodeType.info() : null,
                    PlanLineClassifier.extractMetrics(line),
                    PlanLineClassifier.indentLevel(line),
                    line.contains("Planning"),
                    line.contains("Execution"),
                    line.contains("Planning Time") || line.contains("Execution Time")
            ));
        }
        return Collections.unmodifiableList(result);
    }

    private PlanStats extractStats() {
        PlanStats.PlanStatsBuilder result = PlanStats.builder();
        Double planningTime = null;
        Double executionTime = null;

        for (String line : lines) {
            if (planningTime == null) {
                Matcher planning = PLANNING_TIME_PATTERN.matcher(line);
                if (planning.find()) {
                    planningTime = PlanLineClassifier.parseDouble(planning.group(1));
                }
            }
            if (executionTime == null) {
                Matcher execution = EXECUTION_TIME_PATTERN.matcher(line);
                if (execution.find()) {
                    executionTime = PlanLineClassifier.parseDouble(execution.group(1));
                }
            }
        }
        result.planningTime(planningTime).executionTime(executionTime);

        // The outermost node carries the cost of the whole plan
        lines.stream()
                .filter(line -> line.contains("cost="))
                .findFirst()
                .ifPresent(rootLine -> {
                    Matcher cost = ROOT_COST_PATTERN.matcher(rootLine);
                    if (cost.find()) {
                        result.totalCost(PlanLineClassifier.parseDouble(cost.group(1)));
                    }
                    Matcher rows = ROOT_ROWS_PATTERN.matcher(rootLine);
                    if (rows.find()) {
                        result.rowsEstimated(PlanLineClassifier.parseLong(rows.group(1)));
                    }
                });

        return result.build();
    }

    private void detectSequentialScans(List<Problem> detected) {
        for (PlanAnnotation annotation : annotatedLines) {
            if (!annotation.text().contains(NodeType.SEQ_SCAN.getLabel())) {
                continue;
            }

            PlanMetrics metrics = annotation.metrics();
            List<String> reasons = new ArrayList<>();

            if (metrics.getTotalCost() != null && metrics.getTotalCost() > SEQ_SCAN_COST_THRESHOLD) {
                reasons.add(String.format("high cost (%s)", round(metrics.getTotalCost())));
            }
            if (metrics.getRowsEstimated() != null && metrics.getRowsEstimated() > SEQ_SCAN_ROWS_THRESHOLD) {
                reasons.add(String.format("many rows (%d)", metrics.getRowsEstimated()));
            }
            if (metrics.getActualTimeEnd() != null && metrics.getActualTimeEnd() > SEQ_SCAN_TIME_THRESHOLD_MS) {
                reasons.add(String.format("slow execution (%sms)", round(metrics.getActualTimeEnd())));
            }

            if (reasons.isEmpty()) {
                continue;
            }

            String table = extractTableName(annotation.text());
            detected.add(Problem.builder()
                    .type(ProblemType.SEQUENTIAL_SCAN)
                    .severity(Severity.WARNING)
                    .lineNumber(annotation.lineNumber())
                    .table(table)
                    .message("Sequential scan on " + (table != null ? table : "table"))
                    .details(String.join(", ", reasons))
                    .recommendation("Consider adding an index on frequently filtered columns")
                    .build());
        }
    }

    private void detectHighCostOperations(List<Problem> detected) {
        for (PlanAnnotation annotation : annotatedLines) {
            Double totalCost = annotation.metrics().getTotalCost();
            if (totalCost == null || totalCost <= HIGH_COST_THRESHOLD) {
                continue;
            }

            detected.add(Problem.builder()
                    .type(ProblemType.HIGH_COST)
                    .severity(Severity.WARNING)
                    .lineNumber(annotation.lineNumber())
                    .nodeType(annotation.nodeType())
                    .cost(totalCost)
                    .message(String.format("Very high cost operation (%s)", round(totalCost)))
                    .recommendation("This operation is expensive - review if it can be optimized")
                    .build());
        }
    }

    private void detectSortOperations(List<Problem> detected) {
        for (PlanAnnotation annotation : annotatedLines) {
            String line = annotation.text();
            if (!line.contains(NodeType.SORT.getLabel())) {
                continue;
            }

            if (EXTERNAL_SORT_PATTERN.matcher(line).find() || line.contains("Disk:")) {
                detected.add(Problem.builder()
                        .type(ProblemType.SORT_SPILL)
                        .severity(Severity.CRITICAL)
                        .lineNumber(annotation.lineNumber())
                        .message("Sort operation spilled to disk")
                        .recommendation("Increase work_mem or optimize query to reduce sort size")
                        .build());
                continue;
            }

            Double actualTimeEnd = annotation.metrics().getActualTimeEnd();
            if (actualTimeEnd != null && actualTimeEnd > SLOW_SORT_THRESHOLD_MS) {
                detected.add(Problem.builder()
                        .type(ProblemType.SLOW_SORT)
                        .severity(Severity.WARNING)
                        .lineNumber(annotation.lineNumber())
                        .message(String.format("Slow sort operation (%sms)", round(actualTimeEnd)))
                        .recommendation("Consider reducing the dataset before sorting or using an index")
                        .build());
            }
        }
    }

    private void detectEstimationErrors(List<Problem> detected) {
        for (PlanAnnotation annotation : annotatedLines) {
            PlanMetrics metrics = annotation.metrics();
            if (metrics.getRowsEstimated() == null || metrics.getRowsActual() == null) {
                continue;
            }

            long estimated = metrics.getRowsEstimated();
            long actual = metrics.getRowsActual();

            if (estimated < ESTIMATION_NOISE_FLOOR && actual < ESTIMATION_NOISE_FLOOR) {
                continue;
            }

            long min = Math.min(estimated, actual);
            if (min == 0) {
                continue;
            }

            double ratio = (double) Math.max(estimated, actual) / min;
            if (ratio > ESTIMATION_RATIO_THRESHOLD) {
                detected.add(Problem.builder()
                        .type(ProblemType.ESTIMATION_ERROR)
                        .severity(Severity.WARNING)
                        .lineNumber(annotation.lineNumber())
                        .message(String.format("Row estimation is significantly off (estimated: %d, actual: %d)",
                                estimated, actual))
                        .recommendation("Run ANALYZE on the involved tables to update statistics")
                        .build());
            }
        }
    }

    private void detectTimingIssues(List<Problem> detected) {
        if (stats.getExecutionTime() != null && stats.getExecutionTime() > SLOW_EXECUTION_THRESHOLD_MS) {
            detected.add(Problem.builder()
                    .type(ProblemType.SLOW_QUERY)
                    .severity(Severity.CRITICAL)
                    .message(String.format("Query execution is very slow (%sms)", round(stats.getExecutionTime())))
                    .recommendation("Review the execution plan for optimization opportunities")
                    .build());
        }

        if (stats.getPlanningTime() != null && stats.getPlanningTime() > SLOW_PLANNING_THRESHOLD_MS) {
            detected.add(Problem.builder()
                    .type(ProblemType.SLOW_PLANNING)
                    .severity(Severity.INFO)
                    .message(String.format("Query planning is slow (%sms)", round(stats.getPlanningTime())))
                    .recommendation("Consider simplifying the query or using prepared statements")
                    .build());
        }
    }

    /**
     * Aggregates the final problem list. Counts are always derived from the list itself.
     */
    static AnalysisSummary buildSummary(List<Problem> problems) {
        int critical = countBySeverity(problems, Severity.CRITICAL);
        int warnings = countBySeverity(problems, Severity.WARNING);
        int info = countBySeverity(problems, Severity.INFO);

        SummaryStatus status;
        if (critical > 0) {
            status = SummaryStatus.CRITICAL;
        } else if (warnings > 0) {
            status = SummaryStatus.WARNING;
        } else {
            status = SummaryStatus.GOOD;
        }

        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (Problem problem : problems) {
            breakdown.merge(problem.getType().value(), 1L, Long::sum);
        }

        return new AnalysisSummary(problems.size(), critical, warnings, info,
                status, status.getText(), status.getIcon(), Collections.unmodifiableMap(breakdown));
    }

    private static int countBySeverity(List<Problem> problems, Severity severity) {
        return (int) problems.stream()
                .filter(p -> p.getSeverity() == severity)
                .count();
    }

    private static String extractTableName(String line) {
        Matcher matcher = TABLE_NAME_PATTERN.matcher(line);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
