package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Plan-wide figures: planner and executor timings plus the cost and row estimate of the root node.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanStats {

    @JsonProperty("planning_time")
    private final Double planningTime;

    @JsonProperty("execution_time")
    private final Double executionTime;

    @JsonProperty("total_cost")
    private final Double totalCost;

    @JsonProperty("rows_estimated")
    private final Long rowsEstimated;
}
