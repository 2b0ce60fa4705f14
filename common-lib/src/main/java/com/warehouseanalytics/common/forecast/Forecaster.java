package com.warehouseanalytics.common.forecast;

import com.warehouseanalytics.common.exception.InvalidArgumentException;
import com.warehouseanalytics.common.model.Observation;
import com.warehouseanalytics.common.stats.StatisticsPrimitives;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Short-horizon projection by ordinary least-squares linear regression.
 *
 * <p>The line {@code y = slope * x + intercept} is fitted over {@code x = 0..n-1}
 * with the closed-form sums. Each projected point gets bounded noise of
 * {@code (u - 0.5) * stdDev * 0.1} where {@code u} comes from the supplied
 * {@link NoiseSource}, and is floored at zero since forecast quantities
 * (stock levels, movement counts) are non-negative. Future points are spaced one
 * day apart after the last observation and carry {@code category = "forecast"}.
 */
public final class Forecaster {

    private static final String COMPONENT = "Forecaster";

    /** Minimum window size that supports a regression. */
    static final int MIN_POINTS = 5;

    private static final double NOISE_SCALE = 0.1;

    private Forecaster() {}

    /**
     * @param observations window, oldest-first
     * @param periods      number of future days to project; zero yields an empty list
     * @param noise        jitter source, consumed once per projected point
     * @return {@code periods} forecast points, or an empty list if fewer than
     *         {@value #MIN_POINTS} observations are available
     * @throws InvalidArgumentException if {@code periods} is negative
     */
    public static List<Observation> forecast(List<Observation> observations, int periods, NoiseSource noise) {
        if (periods < 0) {
            throw new InvalidArgumentException(COMPONENT, "periods must not be negative but was " + periods);
        }
        if (observations == null || observations.size() < MIN_POINTS || periods == 0) {
            return List.of();
        }

        List<Double> values = observations.stream().map(Observation::value).toList();
        int n = values.size();

        double[] line = fitLine(values);
        double slope = line[0];
        double intercept = line[1];
        double noiseAmplitude = StatisticsPrimitives.standardDeviation(values) * NOISE_SCALE;

        Instant lastTimestamp = observations.get(n - 1).timestamp();
        List<Observation> forecast = new ArrayList<>(periods);
        for (int i = 1; i <= periods; i++) {
            double predicted = slope * (n + i - 1) + intercept;
            double jitter = (noise.nextDouble() - 0.5) * noiseAmplitude;
            forecast.add(Observation.forecast(
                lastTimestamp.plus(Duration.ofDays(i)),
                Math.max(0.0, predicted + jitter)));
        }
        return forecast;
    }

    /**
     * Least-squares fit over {@code x = 0..n-1}.
     *
     * @return {@code [slope, intercept]}
     */
    static double[] fitLine(List<Double> values) {
        int n = values.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int x = 0; x < n; x++) {
            double y = values.get(x);
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumX2 += (double) x * x;
        }

        double denominator = n * sumX2 - sumX * sumX;
        double slope = denominator == 0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new double[] { slope, intercept };
    }
}
