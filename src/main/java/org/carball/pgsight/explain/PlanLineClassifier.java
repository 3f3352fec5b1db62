package org.carball.pgsight.explain;

import org.carball.pgsight.model.plan.NodeType;
import org.carball.pgsight.model.plan.PlanMetrics;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the node type and numeric metrics from a single line of EXPLAIN ANALYZE output.
 */
public final class PlanLineClassifier {

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";

    private static final Pattern COST_PATTERN = Pattern.compile("cost=" + NUMBER + "\\.\\." + NUMBER);
    private static final Pattern ROWS_PATTERN = Pattern.compile("rows=(\\d+)");
    private static final Pattern ESTIMATED_AND_ACTUAL_ROWS_PATTERN = Pattern.compile("rows=(\\d+).*actual.*rows=(\\d+)");
    private static final Pattern ACTUAL_ROWS_PATTERN = Pattern.compile("actual.*rows=(\\d+)");
    private static final Pattern ACTUAL_TIME_PATTERN = Pattern.compile("actual time=" + NUMBER + "\\.\\." + NUMBER);
    private static final Pattern LOOPS_PATTERN = Pattern.compile("loops=(\\d+)");
    private static final Pattern BUFFERS_HIT_PATTERN = Pattern.compile("Buffers: shared hit=(\\d+)");
    private static final Pattern BUFFERS_READ_PATTERN = Pattern.compile("Buffers:.*?\\bread=(\\d+)");

    private PlanLineClassifier() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the first node type, in declaration order, whose label the line contains.
     */
    public static NodeType classify(String line) {
        if (line == null) {
            return null;
        }
        for (NodeType type : NodeType.values()) {
            if (line.contains(type.getLabel())) {
                return type;
            }
        }
        return null;
    }

    public static PlanMetrics extractMetrics(String line) {
        PlanMetrics.PlanMetricsBuilder metrics = PlanMetrics.builder();
        if (line == null) {
            return metrics.build();
        }

        Matcher cost = COST_PATTERN.matcher(line);
        if (cost.find()) {
            metrics.startupCost(parseDouble(cost.group(1)));
            metrics.totalCost(parseDouble(cost.group(2)));
        }

        // The estimate lives in the planner section, ahead of "(actual ..."
        int actualIndex = line.indexOf("(actual");
        String plannerSection = actualIndex >= 0 ? line.substring(0, actualIndex) : line;
        Matcher rows = ROWS_PATTERN.matcher(plannerSection);
        if (rows.find()) {
            metrics.rowsEstimated(parseLong(rows.group(1)));
        }

        // Combined pattern first so an estimate/actual pair is captured together
        Matcher pair = ESTIMATED_AND_ACTUAL_ROWS_PATTERN.matcher(line);
        if (pair.find()) {
            metrics.rowsEstimated(parseLong(pair.group(1)));
            metrics.rowsActual(parseLong(pair.group(2)));
        } else {
            Matcher actualRows = ACTUAL_ROWS_PATTERN.matcher(line);
            if (actualRows.find()) {
                metrics.rowsActual(parseLong(actualRows.group(1)));
            }
        }

        Matcher time = ACTUAL_TIME_PATTERN.matcher(line);
        if (time.find()) {
            metrics.actualTimeStart(parseDouble(time.group(1)));
            metrics.actualTimeEnd(parseDouble(time.group(2)));
        }

        Matcher loops = LOOPS_PATTERN.matcher(line);
        if (loops.find()) {
            metrics.loops(parseLong(loops.group(1)));
        }

        Matcher hit = BUFFERS_HIT_PATTERN.matcher(line);
        if (hit.find()) {
            metrics.buffersHit(parseLong(hit.group(1)));
        }
        Matcher read = BUFFERS_READ_PATTERN.matcher(line);
        if (read.find()) {
            metrics.buffersRead(parseLong(read.group(1)));
        }

        return metrics.build();
    }

    /**
     * Depth of the line in the plan tree, two spaces per level.
     */
    public static int indentLevel(String line) {
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') {
            spaces++;
        }
        return spaces / 2;
    }

    static Double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
