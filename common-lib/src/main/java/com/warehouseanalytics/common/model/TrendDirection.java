package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of movement between the first and second half of a window. */
public enum TrendDirection {
    UP("up"),
    DOWN("down"),
    STABLE("stable");

    private final String code;

    TrendDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static TrendDirection fromCode(String code) {
        for (TrendDirection value : values()) {
            if (value.code.equals(code)) return value;
        }
        throw new IllegalArgumentException("Unknown TrendDirection code: " + code);
    }
}
