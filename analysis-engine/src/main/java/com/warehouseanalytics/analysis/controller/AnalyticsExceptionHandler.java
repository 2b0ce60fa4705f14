package com.warehouseanalytics.analysis.controller;

import com.warehouseanalytics.analysis.dto.ErrorResponse;
import com.warehouseanalytics.common.exception.InsufficientDataException;
import com.warehouseanalytics.common.exception.InvalidArgumentException;
import com.warehouseanalytics.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice
public class AnalyticsExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsExceptionHandler.class);

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(InvalidArgumentException ex,
                                                               ServerWebExchange exchange) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex, exchange);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientData(InsufficientDataException ex,
                                                                ServerWebExchange exchange) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_DATA", ex, exchange);
    }

    // malformed body, including unparseable observation timestamps
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException ex,
                                                              ServerWebExchange exchange) {
        Throwable cause = ex.getMostSpecificCause();
        String message = cause instanceof InvalidArgumentException ? cause.getMessage() : ex.getReason();
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", message, exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, RuntimeException ex,
                                                ServerWebExchange exchange) {
        return build(status, code, ex.getMessage(), exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                ServerWebExchange exchange) {
        String traceId = exchange.getAttributeOrDefault(TraceContextUtil.TRACE_ID_KEY, "unknown");
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[Analytics] Request rejected. code={} message={} traceId={}", code, message, traceId)
        );
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, traceId));
    }
}
