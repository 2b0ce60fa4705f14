package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warehouseanalytics.common.exception.InvalidArgumentException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Map;

/**
 * One timestamped numeric reading supplied by the inventory/movement data source.
 * Forecast output reuses this shape with {@code category = "forecast"}.
 */
public record Observation(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("value") double value,
    @JsonProperty("category") String category,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static final String FORECAST_CATEGORY = "forecast";

    public static Observation of(Instant timestamp, double value) {
        return new Observation(timestamp, value, null, null);
    }

    /**
     * Accepts an ISO-8601 instant or offset date-time, a local date-time (read as UTC),
     * or a bare {@code yyyy-MM-dd} date (start of day, UTC).
     */
    public static Observation of(String timestamp, double value) {
        return new Observation(parseTimestamp(timestamp), value, null, null);
    }

    /** JSON entry point; accepts the same timestamp formats as {@link #of(String, double)}. */
    @JsonCreator
    public static Observation fromJson(@JsonProperty("timestamp") String timestamp,
                                       @JsonProperty("value") double value,
                                       @JsonProperty("category") String category,
                                       @JsonProperty("metadata") Map<String, Object> metadata) {
        return new Observation(parseTimestamp(timestamp), value, category, metadata);
    }

    public static Observation forecast(Instant timestamp, double value) {
        return new Observation(timestamp, value, FORECAST_CATEGORY, null);
    }

    @JsonIgnore
    public boolean isForecast() {
        return FORECAST_CATEGORY.equals(category);
    }

    static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidArgumentException("Observation", "timestamp must be provided");
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("Observation", "Unparseable timestamp '" + text + "'", e);
        }
    }
}
