package com.warehouseanalytics.common.stats;

import com.warehouseanalytics.common.exception.InsufficientDataException;
import com.warehouseanalytics.common.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure aggregation helpers shared by the detectors and the forecaster.
 * Input values are expected oldest-first (index 0 = earliest observation).
 */
public final class StatisticsPrimitives {

    private static final String COMPONENT = "StatisticsPrimitives";

    private StatisticsPrimitives() {}

    // ── Moving Average ───────────────────────────────────────────────────────

    /**
     * Causal moving average. Element {@code i} averages
     * {@code values[max(0, i - window + 1) .. i]}, so the first {@code window - 1}
     * entries use a shorter leading window.
     *
     * @param values  observations, oldest-first
     * @param window  number of trailing points to average; must be positive
     * @return a list of the same length as {@code values}
     * @throws InvalidArgumentException if {@code window <= 0}
     */
    public static List<Double> movingAverage(List<Double> values, int window) {
        if (window <= 0) {
            throw new InvalidArgumentException(COMPONENT, "window must be positive but was " + window);
        }
        List<Double> result = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            int from = Math.max(0, i - window + 1);
            double sum = 0.0;
            for (int j = from; j <= i; j++) sum += values.get(j);
            result.add(sum / (i - from + 1));
        }
        return result;
    }

    // ── Mean ─────────────────────────────────────────────────────────────────

    /**
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new InsufficientDataException(COMPONENT, "mean requires at least one value");
        }
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    // ── Standard Deviation ───────────────────────────────────────────────────

    /**
     * Population standard deviation (divides by N).
     *
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static double standardDeviation(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new InsufficientDataException(COMPONENT, "standardDeviation requires at least one value");
        }
        double mean = mean(values);
        double variance = 0.0;
        for (double v : values) {
            double diff = v - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / values.size());
    }
}
