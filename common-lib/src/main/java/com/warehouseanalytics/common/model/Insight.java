package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A human-readable finding with recommended follow-up actions.
 * {@code data} carries supporting detail, e.g. the critical anomalies behind an anomaly insight.
 */
public record Insight(
    @JsonProperty("id") String id,
    @JsonProperty("type") InsightType type,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("importance") InsightImportance importance,
    @JsonProperty("actionable") boolean actionable,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("data") Object data,
    @JsonProperty("timestamp") Instant timestamp
) {}
