package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * A performance problem flagged by one of the plan detectors.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Problem {

    @JsonProperty("type")
    private final ProblemType type;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("line_number")
    private final Integer lineNumber;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("details")
    private final String details;

    @JsonProperty("recommendation")
    private final String recommendation;

    // Type-specific
    @JsonProperty("table")
    private final String table;

    @JsonProperty("node_type")
    private final NodeType nodeType;

    @JsonProperty("cost")
    private final Double cost;
}
