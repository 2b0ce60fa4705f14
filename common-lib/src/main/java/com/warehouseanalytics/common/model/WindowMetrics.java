package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary statistics of the observation window.
 *
 * <p>Note: {@code variance} holds the population <em>standard deviation</em>,
 * not its square. The field name is kept because dashboard consumers read it
 * under that key.
 */
public record WindowMetrics(
    @JsonProperty("count") int count,
    @JsonProperty("total") double total,
    @JsonProperty("average") double average,
    @JsonProperty("min") double min,
    @JsonProperty("max") double max,
    @JsonProperty("variance") double variance
) {
    public static WindowMetrics empty() {
        return new WindowMetrics(0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
