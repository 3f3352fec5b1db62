package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProblemType {
    SEQUENTIAL_SCAN,
    HIGH_COST,
    SORT_SPILL,
    SLOW_SORT,
    ESTIMATION_ERROR,
    SLOW_QUERY,
    SLOW_PLANNING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
