package com.warehouseanalytics.common.engine;

import com.warehouseanalytics.common.forecast.NoiseSource;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.AnalyticsResult;
import com.warehouseanalytics.common.model.Anomaly;
import com.warehouseanalytics.common.model.AnomalySeverity;
import com.warehouseanalytics.common.model.AnomalyType;
import com.warehouseanalytics.common.model.Insight;
import com.warehouseanalytics.common.model.InsightType;
import com.warehouseanalytics.common.model.Observation;
import com.warehouseanalytics.common.model.Sensitivity;
import com.warehouseanalytics.common.model.TimeWindow;
import com.warehouseanalytics.common.model.TrendDirection;
import com.warehouseanalytics.common.model.TrendStrength;
import com.warehouseanalytics.common.model.WindowMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsEngineTest {

    private static final Instant JAN_1 = Instant.parse("2024-01-01T00:00:00Z");
    private static final double EPS = 1e-9;

    private static AnalyticsEngine engineAt(String now) {
        return new AnalyticsEngine(Clock.fixed(Instant.parse(now), ZoneOffset.UTC), NoiseSource::none);
    }

    /** One observation per day starting 2024-01-01. */
    private static List<Observation> daily(double... values) {
        List<Observation> observations = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            observations.add(Observation.of(JAN_1.plusSeconds(86_400L * i), values[i]));
        }
        return observations;
    }

    @Nested
    @DisplayName("end-to-end scenarios")
    class Scenarios {

        @Test
        @DisplayName("ten identical points → stable, no anomalies, average 100")
        void identicalPoints() {
            double[] values = new double[10];
            Arrays.fill(values, 100);

            AnalyticsResult result = engineAt("2024-01-10T12:00:00Z")
                .analyze(daily(values), AnalyticsConfig.defaults());

            assertEquals(TrendDirection.STABLE, result.trend().direction());
            assertEquals(TrendStrength.WEAK, result.trend().strength());
            assertEquals(0.0, result.trend().changePercent(), EPS);
            assertTrue(result.anomalies().isEmpty());
            assertEquals(100.0, result.metrics().average(), EPS);
            assertEquals(0.0, result.metrics().variance(), EPS);
            assertEquals(10, result.metrics().count());
        }

        @Test
        @DisplayName("linear rise 10..140 → strong uptrend, forecast continues the line")
        void linearRise() {
            double[] values = new double[14];
            for (int i = 0; i < 14; i++) values[i] = 10 * (i + 1);

            AnalyticsResult result = engineAt("2024-01-14T12:00:00Z")
                .analyze(daily(values), AnalyticsConfig.defaults());

            assertEquals(TrendDirection.UP, result.trend().direction());
            assertEquals(TrendStrength.STRONG, result.trend().strength());
            assertEquals(7, result.forecast().size());
            for (int k = 0; k < 7; k++) {
                double expected = 150 + 10 * k;
                Observation point = result.forecast().get(k);
                assertEquals(expected, point.value(), expected * 0.10);
                assertTrue(point.isForecast());
            }
        }

        @Test
        @DisplayName("one 10x point in a stable window of 12 → exactly one high spike")
        void singleSpike() {
            double[] values = new double[12];
            Arrays.fill(values, 10);
            values[9] = 100;

            AnalyticsResult result = engineAt("2024-01-12T12:00:00Z")
                .analyze(daily(values), AnalyticsConfig.defaults());

            assertEquals(1, result.anomalies().size());
            Anomaly anomaly = result.anomalies().get(0);
            assertEquals(AnomalyType.SPIKE, anomaly.type());
            assertTrue(anomaly.severity() == AnomalySeverity.HIGH
                    || anomaly.severity() == AnomalySeverity.CRITICAL,
                "severity was " + anomaly.severity());
            assertEquals(new WindowMetrics(12, 210, 17.5, 10, 100, result.metrics().variance()),
                result.metrics());
        }

        @Test
        @DisplayName("no observations → zero-valued bundle, no exception")
        void emptyInput() {
            AnalyticsEngine engine = engineAt("2024-01-10T12:00:00Z");
            assertEquals(AnalyticsResult.empty(), engine.analyze(List.of(), AnalyticsConfig.defaults()));
            assertEquals(AnalyticsResult.empty(), engine.analyze(null, AnalyticsConfig.defaults()));
        }
    }

    @Nested
    @DisplayName("window selection")
    class WindowSelection {

        @Test
        @DisplayName("cutoff is inclusive, future observations are dropped")
        void boundaries() {
            AnalyticsEngine engine = engineAt("2024-01-10T12:00:00Z");
            List<Observation> observations = List.of(
                Observation.of("2024-01-03T11:59:59Z", 1),
                Observation.of("2024-01-03T12:00:00Z", 2),
                Observation.of("2024-01-10T12:00:00Z", 3),
                Observation.of("2024-01-10T12:00:01Z", 4));

            List<Observation> window = engine.selectWindow(observations, TimeWindow.SEVEN_DAYS);

            assertEquals(List.of(2.0, 3.0), window.stream().map(Observation::value).toList());
        }

        @Test
        @DisplayName("observations older than the window do not reach the metrics")
        void oldDataIgnored() {
            List<Observation> observations = new ArrayList<>(daily(1000, 1000));
            observations.addAll(List.of(
                Observation.of("2024-03-01", 5),
                Observation.of("2024-03-02", 7)));

            AnalyticsResult result = engineAt("2024-03-02T12:00:00Z")
                .analyze(observations, AnalyticsConfig.defaults().withTimeWindow(TimeWindow.SEVEN_DAYS));

            assertEquals(2, result.metrics().count());
            assertEquals(12.0, result.metrics().total(), EPS);
        }

        @Test
        @DisplayName("window with nothing inside → empty bundle")
        void allOutside() {
            AnalyticsResult result = engineAt("2025-01-01T00:00:00Z")
                .analyze(daily(1, 2, 3), AnalyticsConfig.defaults());
            assertEquals(AnalyticsResult.empty(), result);
        }

        @Test
        @DisplayName("null entries are skipped, not dereferenced")
        void nullEntries() {
            AnalyticsEngine engine = engineAt("2024-01-10T12:00:00Z");
            List<Observation> observations = Arrays.asList(null, Observation.of("2024-01-09", 5), null);

            assertEquals(1, engine.selectWindow(observations, TimeWindow.SEVEN_DAYS).size());
            assertEquals(1, engine.analyze(observations, AnalyticsConfig.defaults()).metrics().count());
            assertEquals(AnalyticsResult.empty(),
                engine.analyze(Arrays.asList((Observation) null), AnalyticsConfig.defaults()));
        }

        @Test
        @DisplayName("explicit instant overrides the engine clock for window and insights")
        void explicitInstant() {
            AnalyticsEngine engine = engineAt("2030-01-01T00:00:00Z");
            Instant now = Instant.parse("2024-01-10T12:00:00Z");
            double[] values = new double[10];
            Arrays.fill(values, 100);
            List<Observation> observations = daily(values);

            AnalyticsResult result = engine.analyze(observations, AnalyticsConfig.defaults(), insight -> { }, now);

            assertEquals(10, result.metrics().count());
            assertEquals(10, engine.selectWindow(observations, TimeWindow.THIRTY_DAYS, now).size());
            assertTrue(result.insights().stream().allMatch(i -> now.equals(i.timestamp())));
        }
    }

    @Nested
    @DisplayName("configuration flags")
    class Flags {

        @Test
        @DisplayName("forecasting disabled → empty forecast")
        void forecastingOff() {
            AnalyticsConfig config = new AnalyticsConfig(TimeWindow.THIRTY_DAYS, Sensitivity.MEDIUM,
                false, true, true, 7);
            AnalyticsResult result = engineAt("2024-01-10T12:00:00Z")
                .analyze(daily(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), config);
            assertTrue(result.forecast().isEmpty());
        }

        @Test
        @DisplayName("anomaly detection disabled → no anomalies and no anomaly insight")
        void anomaliesOff() {
            double[] values = new double[12];
            Arrays.fill(values, 10);
            values[9] = 100;
            AnalyticsConfig config = new AnalyticsConfig(TimeWindow.THIRTY_DAYS, Sensitivity.HIGH,
                true, false, true, 7);

            AnalyticsResult result = engineAt("2024-01-12T12:00:00Z").analyze(daily(values), config);

            assertTrue(result.anomalies().isEmpty());
            assertTrue(result.insights().stream().noneMatch(i -> i.type() == InsightType.ANOMALY));
        }

        @Test
        @DisplayName("forecast length follows forecastPeriods")
        void forecastLength() {
            AnalyticsResult result = engineAt("2024-01-10T12:00:00Z")
                .analyze(daily(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), AnalyticsConfig.defaults().withForecastPeriods(30));
            assertEquals(30, result.forecast().size());
        }
    }

    @Test
    @DisplayName("seeded noise factory → identical results across calls")
    void seededDeterminism() {
        AnalyticsEngine engine = new AnalyticsEngine(
            Clock.fixed(Instant.parse("2024-01-14T12:00:00Z"), ZoneOffset.UTC), () -> NoiseSource.seeded(42L));
        List<Observation> observations = daily(12, 15, 11, 18, 20, 17, 22, 25, 21, 27, 30, 26, 31, 35);

        assertEquals(engine.analyze(observations, AnalyticsConfig.defaults()),
            engine.analyze(observations, AnalyticsConfig.defaults()));
    }

    @Test
    @DisplayName("sink receives every insight in result order")
    void sinkOrder() {
        double[] values = new double[14];
        for (int i = 0; i < 14; i++) values[i] = 10 * (i + 1);
        List<Insight> seen = new ArrayList<>();

        AnalyticsResult result = engineAt("2024-01-14T12:00:00Z")
            .analyze(daily(values), AnalyticsConfig.defaults(), seen::add);

        assertFalse(seen.isEmpty());
        assertEquals(result.insights(), seen);
    }

    @Test
    @DisplayName("metrics on a single observation")
    void singlePointMetrics() {
        WindowMetrics metrics = AnalyticsEngine.computeMetrics(List.of(42.0));
        assertEquals(new WindowMetrics(1, 42, 42, 42, 42, 0), metrics);
    }
}
