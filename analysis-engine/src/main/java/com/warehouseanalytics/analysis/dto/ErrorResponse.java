package com.warehouseanalytics.analysis.dto;

public record ErrorResponse(String code, String message, String traceId) {
}
