package com.warden.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags spans with the
 * current {@link CorrelationContext}.
 * <p>
 * SDK setup (exporters, sampling) is left to the process; with the no-op
 * OpenTelemetry instance every span is discarded.
 */
public final class SpanHelper {

    static final String ATTR_CORRELATION_ID = "correlation.id";
    static final String ATTR_PROJECT_ID = "project.id";
    static final String ATTR_SUBJECT = "user.subject";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} in a new span. Runtime exceptions are recorded on the
     * span and rethrown unchanged.
     *
     * @param spanName   span name, for example the RPC method
     * @param kind       span kind
     * @param attributes extra span attributes
     * @param work       the work to execute
     * @return the work's result
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.projectId() != null) {
                span.setAttribute(ATTR_PROJECT_ID, ctx.projectId());
            }
            if (ctx.subject() != null) {
                span.setAttribute(ATTR_SUBJECT, ctx.subject());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Runs {@code work} in a new internal span. */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    public Tracer tracer() {
        return tracer;
    }
}
