package com.murmur.observability;

import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 *
 * <p>Setting a context populates every MDC key it has a value for; clearing removes them all.
 * Work handed to another thread loses the context unless it is wrapped with {@link #wrap(Runnable)}
 * or run through {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Correlation id of the current thread's context, if any. */
    public static Optional<String> currentCorrelationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /** Clears the context and removes all MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code runnable} with {@code context} set, then restores the previous context (or
     * clears if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            restore(previous);
        }
    }

    /** Callable variant of {@link #runWithContext(CorrelationContext, Runnable)}. */
    public static <T> T callWithContext(CorrelationContext context, Callable<T> callable) throws Exception {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return callable.call();
        } finally {
            restore(previous);
        }
    }

    /**
     * Captures the caller's context so that {@code runnable} sees it on whichever thread it runs.
     * Returns the runnable unchanged when no context is set.
     */
    public static Runnable wrap(Runnable runnable) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return runnable;
        }
        return () -> runWithContext(captured, runnable);
    }

    private static void restore(CorrelationContext previous) {
        if (previous != null) {
            set(previous);
        } else {
            clear();
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
        setMdc(CorrelationContext.MDC_DEVICE_ID, ctx.deviceId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_SPAN_ID, ctx.spanId());
        setMdc(CorrelationContext.MDC_TRACE_ID, ctx.traceId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_DEVICE_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SPAN_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }
}
