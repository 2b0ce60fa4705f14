package com.warehouseanalytics.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warehouseanalytics.common.model.Observation;

import java.util.List;

public record AnalyticsRequest(
    @JsonProperty("observations") List<Observation> observations,
    @JsonProperty("config") ConfigOverrides config
) {
    public List<Observation> observationsOrEmpty() {
        return observations != null ? observations : List.of();
    }

    public ConfigOverrides configOrNone() {
        return config != null ? config : ConfigOverrides.none();
    }
}
