package com.warehouseanalytics.common.exception;

/**
 * Raised only by statistical primitives that have no meaningful result for
 * an empty input. Higher-level detectors degrade to empty results instead.
 */
public class InsufficientDataException extends AnalyticsException {

    public InsufficientDataException(String component, String message) {
        super(component, message);
    }
}
