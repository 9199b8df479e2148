package com.murmur.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that attaches the current correlation
 * context to every span. SDK setup (exporter, sampler) belongs to the hosting service.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** A helper whose spans are discarded, for wiring without a configured SDK. */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("murmur"));
    }

    /**
     * Runs {@code work} within a new span of the given kind. Runtime exceptions mark the span as
     * failed and are rethrown unchanged.
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        Span span = start(spanName, kind, attributes);
        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #inSpan(String, SpanKind, Map, Supplier)}. */
    public void runInSpan(String spanName, SpanKind kind, Map<String, String> attributes, Runnable work) {
        inSpan(spanName, kind, attributes, () -> {
            work.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }

    private Span start(String spanName, SpanKind kind, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach((key, value) -> {
            if (value != null) {
                builder.setAttribute(key, value);
            }
        });
        Span span = builder.startSpan();
        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.userId() != null) {
                span.setAttribute("user.id", ctx.userId());
            }
            if (ctx.deviceId() != null) {
                span.setAttribute("device.id", ctx.deviceId());
            }
        });
        return span;
    }
}
