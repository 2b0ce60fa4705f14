package com.warehouseanalytics.analysis.service;

import com.warehouseanalytics.analysis.dto.AnalyticsExport;
import com.warehouseanalytics.analysis.dto.AnalyticsRequest;
import com.warehouseanalytics.analysis.logger.InsightFlowLogger;
import com.warehouseanalytics.common.engine.AnalyticsEngine;
import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.AnalyticsResult;
import com.warehouseanalytics.common.model.Observation;
import com.warehouseanalytics.common.trace.TraceContextUtil;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Runs the analytics engine for HTTP callers.
 *
 * <p>The engine is CPU-bound and synchronous, so each call is shifted onto
 * {@code boundedElastic} to keep the event loop free. Request configuration is
 * overlaid on the configured defaults; invalid values surface as an error signal
 * carrying {@code InvalidArgumentException}.
 */
@Service
public class AnalyticsService {

    private final AnalyticsEngine engine;
    private final AnalyticsConfig defaultConfig;
    private final InsightFlowLogger flowLogger;
    private final Clock clock;

    public AnalyticsService(AnalyticsEngine engine,
                            AnalyticsConfig defaultConfig,
                            InsightFlowLogger flowLogger,
                            Clock clock) {
        this.engine = engine;
        this.defaultConfig = defaultConfig;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    public Mono<AnalyticsResult> analyze(AnalyticsRequest request, String traceId) {
        Mono<AnalyticsResult> pipeline = Mono.fromCallable(() -> run(request, traceId))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(result -> flowLogger.logResult(result, traceId));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    public Mono<AnalyticsExport> export(AnalyticsRequest request, String traceId) {
        Mono<AnalyticsExport> pipeline = Mono.fromCallable(() -> {
                AnalyticsConfig config = request.configOrNone().applyTo(defaultConfig);
                List<Observation> observations = request.observationsOrEmpty();
                // one instant for the analysis window, the exported data and the timestamp
                Instant now = clock.instant();
                AnalyticsResult result = run(observations, config, traceId, now);
                List<Observation> window = engine.selectWindow(observations, config.timeWindow(), now);
                return new AnalyticsExport(config, window, result, now);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(InsightFlowLogger.EXPORT_ASSEMBLED));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    // ── Helpers ────────────────────────────────────────────────────

    private AnalyticsResult run(AnalyticsRequest request, String traceId) {
        AnalyticsConfig config = request.configOrNone().applyTo(defaultConfig);
        return run(request.observationsOrEmpty(), config, traceId, clock.instant());
    }

    private AnalyticsResult run(List<Observation> observations, AnalyticsConfig config, String traceId,
                                Instant now) {
        flowLogger.logRequest(traceId, observations.size(), config);
        return engine.analyze(observations, config, insight -> flowLogger.logInsight(insight, traceId), now);
    }
}
