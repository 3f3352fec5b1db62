package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of EXPLAIN output with the structure recovered from it.
 */
public record PlanAnnotation(
        @JsonProperty("line_number") int lineNumber,
        @JsonProperty("text") String text,
        @JsonProperty("node_type") NodeType nodeType,
        @JsonProperty("node_info") NodeInfo nodeInfo,
        @JsonProperty("metrics") PlanMetrics metrics,
        @JsonProperty("indent_level") int indentLevel,
        @JsonProperty("is_planning") boolean planning,
        @JsonProperty("is_execution") boolean execution,
        @JsonProperty("is_timing") boolean timing
) {}
