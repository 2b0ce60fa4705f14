package com.warehouseanalytics.common.exception;

/**
 * Raised for caller mistakes: non-positive window sizes, negative forecast
 * horizons, unknown configuration codes. Never coerced into a default.
 */
public class InvalidArgumentException extends AnalyticsException {

    public InvalidArgumentException(String component, String message) {
        super(component, message);
    }

    public InvalidArgumentException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
