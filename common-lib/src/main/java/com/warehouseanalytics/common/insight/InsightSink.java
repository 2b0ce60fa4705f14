package com.warehouseanalytics.common.insight;

import com.warehouseanalytics.common.model.Insight;

/**
 * Per-call listener for generated insights.
 *
 * <p>Invoked synchronously, once per insight, in generation order. The engine
 * keeps no reference to the sink after the call returns. Exceptions thrown by
 * the sink propagate to the caller of the engine.
 */
@FunctionalInterface
public interface InsightSink {

    void onInsight(Insight insight);

    static InsightSink noop() {
        return insight -> { };
    }
}
