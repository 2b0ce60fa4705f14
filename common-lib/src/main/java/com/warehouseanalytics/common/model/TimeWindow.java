package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.warehouseanalytics.common.exception.InvalidArgumentException;

import java.time.Duration;

/**
 * Look-back span used to select the observation window relative to "now".
 * A year is counted as 365 days.
 */
public enum TimeWindow {

    SEVEN_DAYS("7d", Duration.ofDays(7)),
    THIRTY_DAYS("30d", Duration.ofDays(30)),
    NINETY_DAYS("90d", Duration.ofDays(90)),
    ONE_YEAR("1y", Duration.ofDays(365));

    private final String code;
    private final Duration span;

    TimeWindow(String code, Duration span) {
        this.code = code;
        this.span = span;
    }

    @JsonValue
    public String code() { return code; }

    public Duration span() { return span; }

    @JsonCreator
    public static TimeWindow fromCode(String code) {
        for (TimeWindow window : values()) {
            if (window.code.equals(code)) return window;
        }
        throw new InvalidArgumentException("AnalyticsConfig",
            "Unrecognized timeWindow '" + code + "' (expected 7d, 30d, 90d or 1y)");
    }
}
