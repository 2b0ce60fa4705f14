package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendStrength {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    private final String code;

    TrendStrength(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static TrendStrength fromCode(String code) {
        for (TrendStrength value : values()) {
            if (value.code.equals(code)) return value;
        }
        throw new IllegalArgumentException("Unknown TrendStrength code: " + code);
    }
}
