package com.warehouseanalytics.analysis.logger;

import com.warehouseanalytics.common.model.AnalyticsConfig;
import com.warehouseanalytics.common.model.AnalyticsResult;
import com.warehouseanalytics.common.model.Insight;
import com.warehouseanalytics.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.Locale;
import java.util.function.Consumer;

/**
 * Observability for one analytics request. Pure side-effects; never alters results.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}  : configuration resolved, observations accepted</li>
 *   <li>{@link #INSIGHT_GENERATED} : once per insight, via the engine's insight sink</li>
 *   <li>{@link #ANALYSIS_COMPLETED}: result bundle assembled</li>
 *   <li>{@link #EXPORT_ASSEMBLED}  : export document built (export requests only)</li>
 * </ol>
 *
 * <p>Inside reactive chains use {@link #stage(String)} with {@code doOnEach}; it reads the
 * trace id from the Reactor Context. Elsewhere pass the trace id explicitly.
 */
@Component
public class InsightFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(InsightFlowLogger.class);

    public static final String REQUEST_RECEIVED   = "REQUEST_RECEIVED";
    public static final String INSIGHT_GENERATED  = "INSIGHT_GENERATED";
    public static final String ANALYSIS_COMPLETED = "ANALYSIS_COMPLETED";
    public static final String EXPORT_ASSEMBLED   = "EXPORT_ASSEMBLED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[Analytics] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logRequest(String traceId, int observationCount, AnalyticsConfig config) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[Analytics] stage={} observations={} timeWindow={} sensitivity={} "
                     + "forecasting={} anomalyDetection={} forecastPeriods={} traceId={}",
                     REQUEST_RECEIVED, observationCount, config.timeWindow().code(),
                     config.sensitivity().code(), config.enableForecasting(),
                     config.enableAnomalyDetection(), config.forecastPeriods(), traceId)
        );
    }

    /**
     * Insight sink used by the service. Critical findings are logged at WARN.
     */
    public void logInsight(Insight insight, String traceId) {
        TraceContextUtil.withMdc(traceId, () -> {
            switch (insight.importance()) {
                case CRITICAL -> log.warn("[Analytics] stage={} id={} importance={} title=\"{}\" traceId={}",
                    INSIGHT_GENERATED, insight.id(), insight.importance().code(), insight.title(), traceId);
                default -> log.info("[Analytics] stage={} id={} importance={} title=\"{}\" traceId={}",
                    INSIGHT_GENERATED, insight.id(), insight.importance().code(), insight.title(), traceId);
            }
        });
    }

    public void logResult(AnalyticsResult result, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[Analytics] stage={} trend={}/{} confidence={} anomalies={} forecast={} insights={} "
                     + "count={} traceId={}",
                     ANALYSIS_COMPLETED, result.trend().direction().code(), result.trend().strength().code(),
                     String.format(Locale.ROOT, "%.1f", result.trend().confidence()), result.anomalies().size(),
                     result.forecast().size(), result.insights().size(), result.metrics().count(), traceId)
        );
    }
}
