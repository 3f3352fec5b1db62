package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Numeric values extracted from one plan line. A field stays null when its pattern is absent.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanMetrics {

    @JsonProperty("startup_cost")
    private final Double startupCost;

    @JsonProperty("total_cost")
    private final Double totalCost;

    @JsonProperty("rows_estimated")
    private final Long rowsEstimated;

    @JsonProperty("rows_actual")
    private final Long rowsActual;

    @JsonProperty("actual_time_start")
    private final Double actualTimeStart;

    @JsonProperty("actual_time_end")
    private final Double actualTimeEnd;

    @JsonProperty("loops")
    private final Long loops;

    @JsonProperty("buffers_hit")
    private final Long buffersHit;

    @JsonProperty("buffers_read")
    private final Long buffersRead;

    @JsonIgnore
    public boolean isEmpty() {
        return startupCost == null && totalCost == null
                && rowsEstimated == null && rowsActual == null
                && actualTimeStart == null && actualTimeEnd == null
                && loops == null && buffersHit == null && buffersRead == null;
    }
}
