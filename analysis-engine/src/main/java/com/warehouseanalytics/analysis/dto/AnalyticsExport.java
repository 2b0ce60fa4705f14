package com.warehouseanalytics.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.AnalyticsResult;
import com.warehouseanalytics.common.model.Observation;

import java.time.Instant;
import java.util.List;

/**
 * Downloadable snapshot: the effective configuration, the windowed input,
 * the full result bundle and when it was produced.
 */
public record AnalyticsExport(
    @JsonProperty("config") AnalyticsConfig config,
    @JsonProperty("data") List<Observation> data,
    @JsonProperty("analytics") AnalyticsResult analytics,
    @JsonProperty("timestamp") Instant timestamp
) {}
