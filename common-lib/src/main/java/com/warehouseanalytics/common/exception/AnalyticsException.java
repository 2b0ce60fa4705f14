package com.warehouseanalytics.common.exception;

public class AnalyticsException extends RuntimeException {
    private final String component;

    public AnalyticsException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AnalyticsException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
