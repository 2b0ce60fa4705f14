package com.warehouseanalytics.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    SPIKE("spike"),
    DROP("drop");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static AnomalyType fromCode(String code) {
        for (AnomalyType value : values()) {
            if (value.code.equals(code)) return value;
        }
        throw new IllegalArgumentException("Unknown AnomalyType code: " + code);
    }
}
