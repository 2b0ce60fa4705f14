package com.warehouseanalytics.common.trend;

import com.warehouseanalytics.common.model.TrendAnalysis;
import com.warehouseanalytics.common.model.TrendDirection;
import com.warehouseanalytics.common.model.TrendStrength;
import com.warehouseanalytics.common.stats.StatisticsPrimitives;

import java.util.List;
import java.util.Locale;

/**
 * Pure stateless classifier of directional movement across a window.
 *
 * <h3>Classification logic</h3>
 * <p>The window is split at {@code floor(n/2)}; the relative change of the
 * second-half mean over the first-half mean decides the outcome:
 * <ul>
 *   <li>|change| &lt; 5%   → {@link TrendDirection#STABLE} / {@link TrendStrength#WEAK}</li>
 *   <li>|change| &gt; 20%  → {@link TrendStrength#STRONG}</li>
 *   <li>|change| &gt; 10%  → {@link TrendStrength#MODERATE}</li>
 *   <li>otherwise          → {@link TrendStrength#WEAK}</li>
 * </ul>
 *
 * <p>Confidence falls as dispersion grows relative to the recent mean and is
 * clamped to [50, 95]. Fewer than two points yield a zero-confidence stable
 * result rather than an error.
 *
 * <p>No logging. No side-effects.
 */
public final class TrendDetector {

    private static final int MIN_POINTS = 2;

    private static final double STABLE_THRESHOLD_PCT   = 5.0;
    private static final double MODERATE_THRESHOLD_PCT = 10.0;
    private static final double STRONG_THRESHOLD_PCT   = 20.0;

    private static final double MIN_CONFIDENCE = 50.0;
    private static final double MAX_CONFIDENCE = 95.0;

    private TrendDetector() {}

    /**
     * @param values observation values, oldest-first
     * @return the trend classification; never null
     */
    public static TrendAnalysis detect(List<Double> values) {
        if (values == null || values.size() < MIN_POINTS) {
            return TrendAnalysis.insufficientData();
        }

        int mid = values.size() / 2;
        double firstAvg  = StatisticsPrimitives.mean(values.subList(0, mid));
        double secondAvg = StatisticsPrimitives.mean(values.subList(mid, values.size()));

        // percentage change from a zero baseline is undefined; "+ 0.0" folds -0.0 into 0.0
        double changePercent = firstAvg == 0 ? 0.0 : (secondAvg - firstAvg) / firstAvg * 100 + 0.0;

        TrendDirection direction = classifyDirection(changePercent);
        TrendStrength strength   = classifyStrength(changePercent);
        double confidence = computeConfidence(StatisticsPrimitives.standardDeviation(values), secondAvg);

        return new TrendAnalysis(direction, strength, confidence, changePercent,
            describe(direction, strength, changePercent));
    }

    // ── Classification ─────────────────────────────────────────────

    static TrendDirection classifyDirection(double changePercent) {
        if (Math.abs(changePercent) < STABLE_THRESHOLD_PCT) return TrendDirection.STABLE;
        return changePercent > 0 ? TrendDirection.UP : TrendDirection.DOWN;
    }

    static TrendStrength classifyStrength(double changePercent) {
        double absChange = Math.abs(changePercent);
        if (absChange > STRONG_THRESHOLD_PCT)   return TrendStrength.STRONG;
        if (absChange > MODERATE_THRESHOLD_PCT) return TrendStrength.MODERATE;
        return TrendStrength.WEAK;
    }

    static double computeConfidence(double stdDev, double secondAvg) {
        double raw = 100 - (stdDev / Math.max(secondAvg, 1.0)) * 10;
        return Math.min(MAX_CONFIDENCE, Math.max(MIN_CONFIDENCE, raw));
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static String describe(TrendDirection direction, TrendStrength strength, double changePercent) {
        String label = switch (direction) {
            case UP     -> "Upward trend";
            case DOWN   -> "Downward trend";
            case STABLE -> "Stable trend";
        };
        return String.format(Locale.ROOT, "%s with %s strength (%+.1f%% change)",
            label, strength.code(), changePercent);
    }
}
