package com.murmur.observability;

import java.util.UUID;

/**
 * Immutable correlation context that flows through a request or a causal chain of events.
 *
 * <p>Inbound HTTP requests and consumed events both establish a {@code CorrelationContext}; its
 * values are pushed into the SLF4J MDC so every log line carries them.
 *
 * @param correlationId identifier of the causal chain (a send, its fan-out and its receipts)
 * @param userId authenticated user performing the action, null for system work
 * @param deviceId client device, null when not tied to a connection
 * @param requestId identifier of this request or delivery; one correlation spans many
 * @param spanId current OpenTelemetry span ID, null if tracing is not active
 * @param traceId current OpenTelemetry trace ID, null if tracing is not active
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String deviceId,
        String requestId,
        String spanId,
        String traceId) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_DEVICE_ID = "deviceId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SPAN_ID = "spanId";
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation id. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    /** Context for {@code correlationId}, or a fresh chain when it is null or blank. */
    public static CorrelationContext ofNullable(String correlationId) {
        return of(correlationId == null || correlationId.isBlank() ? UUID.randomUUID().toString() : correlationId);
    }

    public CorrelationContext withRequestId(String newRequestId) {
        return new CorrelationContext(correlationId, userId, deviceId, newRequestId, spanId, traceId);
    }

    public CorrelationContext withUser(String newUserId, String newDeviceId) {
        return new CorrelationContext(correlationId, newUserId, newDeviceId, requestId, spanId, traceId);
    }
}
