package com.warehouseanalytics.common.insight;

import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.Anomaly;
import com.warehouseanalytics.common.model.AnomalySeverity;
import com.warehouseanalytics.common.model.Insight;
import com.warehouseanalytics.common.model.InsightImportance;
import com.warehouseanalytics.common.model.InsightType;
import com.warehouseanalytics.common.model.Observation;
import com.warehouseanalytics.common.model.TrendAnalysis;
import com.warehouseanalytics.common.model.TrendDirection;
import com.warehouseanalytics.common.stats.StatisticsPrimitives;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthesizes trend, anomaly and raw-window results into prioritized findings.
 *
 * <p>Output order is fixed and each kind appears at most once:
 * <ol>
 *   <li>trend insight, when trend confidence exceeds {@value #TREND_CONFIDENCE_THRESHOLD}</li>
 *   <li>critical-anomaly insight, when at least one anomaly is critical</li>
 *   <li>recent-pattern insight, when the mean of the last {@value #RECENT_POINTS} points
 *       differs from the window mean by more than 15%</li>
 * </ol>
 */
public final class InsightGenerator {

    static final String TREND_INSIGHT_ID    = "trend-analysis";
    static final String ANOMALY_INSIGHT_ID  = "critical-anomalies";
    static final String PATTERN_INSIGHT_ID  = "recent-pattern-change";

    static final double TREND_CONFIDENCE_THRESHOLD = 70.0;
    static final int RECENT_POINTS = 7;
    private static final double PATTERN_CHANGE_RATIO = 0.15;

    private static final List<String> GROWTH_RECOMMENDATIONS = List.of(
        "Consider increasing inventory to meet growing demand",
        "Analyze factors contributing to growth",
        "Plan for capacity expansion");

    private static final List<String> DECLINE_RECOMMENDATIONS = List.of(
        "Investigate causes of decline",
        "Consider promotional strategies",
        "Review pricing and market conditions");

    private static final List<String> STABILITY_RECOMMENDATIONS = List.of(
        "Monitor for any changes in pattern",
        "Maintain current operational levels");

    private static final List<String> ANOMALY_RECOMMENDATIONS = List.of(
        "Investigate root causes immediately",
        "Check data quality and collection processes",
        "Review operational changes during anomaly periods",
        "Implement monitoring alerts for similar patterns");

    private static final List<String> PATTERN_RECOMMENDATIONS = List.of(
        "Analyze recent operational changes",
        "Review external factors affecting performance",
        "Consider adjusting forecasts and plans");

    private InsightGenerator() {}

    /**
     * @param observations window the trend and anomalies were computed from, oldest-first
     * @param anomalies    detector output (may be empty)
     * @param trend        detector output
     * @param config       invocation configuration
     * @param generatedAt  timestamp stamped on every insight
     * @return zero to three insights in priority order
     */
    public static List<Insight> generate(List<Observation> observations,
                                         List<Anomaly> anomalies,
                                         TrendAnalysis trend,
                                         AnalyticsConfig config,
                                         Instant generatedAt) {
        List<Insight> insights = new ArrayList<>(3);

        if (trend.confidence() > TREND_CONFIDENCE_THRESHOLD) {
            insights.add(trendInsight(trend, generatedAt));
        }

        List<Anomaly> critical = anomalies.stream()
            .filter(a -> a.severity() == AnomalySeverity.CRITICAL)
            .toList();
        if (!critical.isEmpty()) {
            insights.add(criticalAnomalyInsight(critical, generatedAt));
        }

        if (config.enablePatternRecognition() && !observations.isEmpty()) {
            Insight pattern = recentPatternInsight(observations, generatedAt);
            if (pattern != null) insights.add(pattern);
        }

        return insights;
    }

    // ── Individual insights ────────────────────────────────────────

    private static Insight trendInsight(TrendAnalysis trend, Instant generatedAt) {
        String title = switch (trend.direction()) {
            case UP     -> "Growth Detected";
            case DOWN   -> "Decline Detected";
            case STABLE -> "Stability Detected";
        };
        InsightImportance importance = switch (trend.strength()) {
            case STRONG   -> InsightImportance.HIGH;
            case MODERATE -> InsightImportance.MEDIUM;
            case WEAK     -> InsightImportance.LOW;
        };
        List<String> recommendations = switch (trend.direction()) {
            case UP     -> GROWTH_RECOMMENDATIONS;
            case DOWN   -> DECLINE_RECOMMENDATIONS;
            case STABLE -> STABILITY_RECOMMENDATIONS;
        };
        return new Insight(TREND_INSIGHT_ID, InsightType.TREND, title, trend.description(),
            importance, trend.direction() != TrendDirection.STABLE, recommendations, null, generatedAt);
    }

    private static Insight criticalAnomalyInsight(List<Anomaly> critical, Instant generatedAt) {
        int count = critical.size();
        String title = count + " Critical Anomal" + (count == 1 ? "y" : "ies") + " Detected";
        return new Insight(ANOMALY_INSIGHT_ID, InsightType.ANOMALY, title,
            "Significant deviations from expected patterns require immediate attention",
            InsightImportance.CRITICAL, true, ANOMALY_RECOMMENDATIONS, critical, generatedAt);
    }

    /** Returns null when the recent mean is within 15% of the window mean, or the window mean is zero. */
    private static Insight recentPatternInsight(List<Observation> observations, Instant generatedAt) {
        List<Double> values = observations.stream().map(Observation::value).toList();
        double overallAvg = StatisticsPrimitives.mean(values);
        if (overallAvg == 0) return null;

        List<Double> recent = values.subList(Math.max(0, values.size() - RECENT_POINTS), values.size());
        double recentAvg = StatisticsPrimitives.mean(recent);
        if (Math.abs(recentAvg - overallAvg) / Math.abs(overallAvg) <= PATTERN_CHANGE_RATIO) return null;

        String relation = recentAvg > overallAvg ? "significantly higher" : "significantly lower";
        return new Insight(PATTERN_INSIGHT_ID, InsightType.PATTERN, "Recent Pattern Change Detected",
            "Recent values are " + relation + " than historical average",
            InsightImportance.MEDIUM, true, PATTERN_RECOMMENDATIONS, null, generatedAt);
    }
}
