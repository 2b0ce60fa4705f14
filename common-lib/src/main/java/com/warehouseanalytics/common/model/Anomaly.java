package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Anomaly(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("value") double value,
    @JsonProperty("expectedValue") double expectedValue,
    @JsonProperty("severity") AnomalySeverity severity,
    @JsonProperty("type") AnomalyType type,
    @JsonProperty("description") String description,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("impact") String impact
) {}
