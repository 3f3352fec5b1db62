package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record AnalysisSummary(
        @JsonProperty("total_problems") int totalProblems,
        @JsonProperty("critical_problems") int criticalProblems,
        @JsonProperty("warnings") int warnings,
        @JsonProperty("info") int info,
        @JsonProperty("status") SummaryStatus status,
        @JsonProperty("status_text") String statusText,
        @JsonProperty("status_icon") String statusIcon,
        @JsonProperty("problem_breakdown") Map<String, Long> problemBreakdown
) {}
