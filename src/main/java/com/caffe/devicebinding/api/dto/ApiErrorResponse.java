package com.caffe.devicebinding.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error body of every failed request.
 *
 * <pre>
 * {
 *   "error": "DEVICE_MISMATCH",
 *   "message": "This account is bound to another device",
 *   "traceId": "abc-123",
 *   "timestamp": "2026-01-11T18:30:00Z",
 *   "details": { "observerId": "OBS-1042", "resetPending": false }
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {

    private final String error;
    private final String message;
    private final String traceId;
    private final Instant timestamp;
    private final Map<String, Object> details;

    public ApiErrorResponse(String error, String message, String traceId) {
        this(error, message, traceId, null);
    }

    public ApiErrorResponse(String error, String message, String traceId, Map<String, Object> details) {
        this.error = error;
        this.message = message;
        this.traceId = traceId;
        this.timestamp = Instant.now();
        this.details = details;
    }

    public String getError() { return error; }
    public String getMessage() { return message; }
    public String getTraceId() { return traceId; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, Object> getDetails() { return details; }
}
