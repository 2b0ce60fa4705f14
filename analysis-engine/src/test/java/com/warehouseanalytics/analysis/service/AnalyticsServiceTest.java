package com.warehouseanalytics.analysis.service;

import com.warehouseanalytics.analysis.dto.AnalyticsRequest;
import com.warehouseanalytics.analysis.dto.ConfigOverrides;
import com.warehouseanalytics.analysis.logger.InsightFlowLogger;
import com.warehouseanalytics.common.engine.AnalyticsEngine;
import com.warehouseanalytics.common.exception.InvalidArgumentException;
import com.warehouseanalytics.common.forecast.NoiseSource;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.AnalyticsResult;
import com.warehouseanalytics.common.model.Observation;
import com.warehouseanalytics.common.model.Sensitivity;
import com.warehouseanalytics.common.model.TimeWindow;
import com.warehouseanalytics.common.model.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-14T12:00:00Z");

    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new AnalyticsService(new AnalyticsEngine(clock, NoiseSource::none),
            AnalyticsConfig.defaults(), new InsightFlowLogger(), clock);
    }

    /** 10, 20, ... one per day from 2024-01-01. */
    private static List<Observation> rising(int days) {
        List<Observation> observations = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            observations.add(Observation.of(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(86_400L * i),
                10.0 * (i + 1)));
        }
        return observations;
    }

    @Test
    @DisplayName("analyze with no overrides → engine defaults")
    void analyzeDefaults() {
        StepVerifier.create(service.analyze(new AnalyticsRequest(rising(14), null), "trace-1"))
            .assertNext(result -> {
                assertEquals(TrendDirection.UP, result.trend().direction());
                assertEquals(7, result.forecast().size());
                assertEquals(14, result.metrics().count());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("overrides are applied on top of the defaults")
    void analyzeOverrides() {
        ConfigOverrides overrides = new ConfigOverrides("7d", "high", null, null, null, 3);

        StepVerifier.create(service.analyze(new AnalyticsRequest(rising(14), overrides), "trace-2"))
            .assertNext(result -> {
                assertEquals(3, result.forecast().size());
                // 2024-01-07T12:00 .. 2024-01-14T12:00 → Jan 8..14
                assertEquals(7, result.metrics().count());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("missing observations → zero-valued bundle")
    void analyzeEmpty() {
        StepVerifier.create(service.analyze(new AnalyticsRequest(null, null), "trace-3"))
            .expectNext(AnalyticsResult.empty())
            .verifyComplete();
    }

    @Test
    @DisplayName("invalid override → InvalidArgumentException signal")
    void analyzeInvalidOverride() {
        ConfigOverrides overrides = new ConfigOverrides(null, "extreme", null, null, null, null);

        StepVerifier.create(service.analyze(new AnalyticsRequest(rising(14), overrides), "trace-4"))
            .expectError(InvalidArgumentException.class)
            .verify();
    }

    @Test
    @DisplayName("export carries effective config, windowed data, result and clock time")
    void export() {
        List<Observation> observations = new ArrayList<>(rising(14));
        observations.add(0, Observation.of("2023-06-01", 999));
        ConfigOverrides overrides = new ConfigOverrides(null, "low", null, null, null, null);

        StepVerifier.create(service.export(new AnalyticsRequest(observations, overrides), "trace-5"))
            .assertNext(export -> {
                assertEquals(Sensitivity.LOW, export.config().sensitivity());
                assertEquals(TimeWindow.THIRTY_DAYS, export.config().timeWindow());
                assertEquals(14, export.data().size());
                assertEquals(14, export.analytics().metrics().count());
                assertEquals(NOW, export.timestamp());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("export on a moving clock → data, metrics and timestamp share one instant")
    void exportUsesSingleInstant() {
        Instant start = Instant.parse("2024-01-08T00:00:00Z");
        Clock ticking = new TickingClock(start);
        AnalyticsService tickingService = new AnalyticsService(new AnalyticsEngine(ticking, NoiseSource::none),
            AnalyticsConfig.defaults(), new InsightFlowLogger(), ticking);
        // first observation sits exactly on the 7-day cutoff of the first clock read
        List<Observation> observations = List.of(
            Observation.of("2024-01-01T00:00:00Z", 40),
            Observation.of("2024-01-07T00:00:00Z", 50));
        ConfigOverrides overrides = new ConfigOverrides("7d", null, null, null, null, null);

        StepVerifier.create(tickingService.export(new AnalyticsRequest(observations, overrides), "trace-6"))
            .assertNext(export -> {
                assertEquals(2, export.data().size());
                assertEquals(export.data().size(), export.analytics().metrics().count());
                assertEquals(start, export.timestamp());
            })
            .verifyComplete();
    }

    /** Advances one second on every read. */
    private static final class TickingClock extends Clock {

        private final Instant start;
        private final AtomicLong reads = new AtomicLong();

        TickingClock(Instant start) {
            this.start = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return start.plusSeconds(reads.getAndIncrement());
        }
    }
}
