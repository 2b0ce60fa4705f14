package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightType {
    TREND("trend"),
    ANOMALY("anomaly"),
    PATTERN("pattern"),
    CORRELATION("correlation"),
    FORECAST("forecast");

    private final String code;

    InsightType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static InsightType fromCode(String code) {
        for (InsightType value : values()) {
            if (value.code.equals(code)) return value;
        }
        throw new IllegalArgumentException("Unknown InsightType code: " + code);
    }
}
