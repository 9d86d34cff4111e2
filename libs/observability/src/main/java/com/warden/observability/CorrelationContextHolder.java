package com.warden.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Thread-local holder for {@link CorrelationContext} that keeps SLF4J MDC in step.
 * <p>
 * gRPC may run the callbacks of one call on different executor threads, so
 * callers set the context at the start of each callback and clear it at the end
 * (see {@link #runWithContext(CorrelationContext, Runnable)}).
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates MDC.
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

    /** Returns the current thread's correlation context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Returns the current correlation id, if a context is set. */
    public static Optional<String> correlationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /**
     * Replaces the current context with {@code change} applied to it.
     * Does nothing when no context is set.
     */
    public static void update(UnaryOperator<CorrelationContext> change) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(change.apply(current));
        }
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_METHOD);
        MDC.remove(CorrelationContext.MDC_SUBJECT);
        MDC.remove(CorrelationContext.MDC_PROJECT_ID);
    }

    /**
     * Runs {@code runnable} with the given context set, then restores the
     * previous context (or clears if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_METHOD, ctx.method());
        putOrRemove(CorrelationContext.MDC_SUBJECT, ctx.subject());
        putOrRemove(CorrelationContext.MDC_PROJECT_ID, ctx.projectId());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
