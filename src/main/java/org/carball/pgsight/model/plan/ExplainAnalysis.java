package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Complete result of analyzing one EXPLAIN ANALYZE report.
 */
public record ExplainAnalysis(
        @JsonProperty("raw_output") String rawOutput,
        @JsonProperty("annotated_lines") List<PlanAnnotation> annotatedLines,
        @JsonProperty("problems") List<Problem> problems,
        @JsonProperty("summary") AnalysisSummary summary,
        @JsonProperty("stats") PlanStats stats
) {}
