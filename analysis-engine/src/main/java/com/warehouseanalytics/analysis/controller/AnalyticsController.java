package com.warehouseanalytics.analysis.controller;

import com.warehouseanalytics.analysis.dto.AnalyticsExport;
import com.warehouseanalytics.analysis.dto.AnalyticsRequest;
import com.warehouseanalytics.analysis.service.AnalyticsService;
import com.warehouseanalytics.common.model.AnalyticsResult;
import com.warehouseanalytics.common.trace.TraceContextUtil;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.ZoneOffset;

@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @PostMapping
    public Mono<ResponseEntity<AnalyticsResult>> analyze(
            @RequestBody AnalyticsRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceIdHeader,
            ServerWebExchange exchange) {
        String traceId = bindTraceId(traceIdHeader, exchange);
        return analyticsService.analyze(request, traceId)
            .map(result -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(result));
    }

    @PostMapping("/export")
    public Mono<ResponseEntity<AnalyticsExport>> export(
            @RequestBody AnalyticsRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceIdHeader,
            ServerWebExchange exchange) {
        String traceId = bindTraceId(traceIdHeader, exchange);
        return analyticsService.export(request, traceId)
            .map(export -> ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                    .filename("analytics_" + LocalDate.ofInstant(export.timestamp(), ZoneOffset.UTC) + ".json")
                    .build()
                    .toString())
                .body(export));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static String bindTraceId(String traceIdHeader, ServerWebExchange exchange) {
        String traceId = TraceContextUtil.resolveTraceId(traceIdHeader);
        exchange.getAttributes().put(TraceContextUtil.TRACE_ID_KEY, traceId);
        return traceId;
    }
}
