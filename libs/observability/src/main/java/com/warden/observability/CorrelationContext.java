package com.warden.observability;

/**
 * Immutable per-call correlation data, mirrored into SLF4J MDC so every log
 * line of a call can be tied together.
 * <p>
 * The context starts with a correlation id and the RPC method, and is enriched
 * as the call is authenticated ({@code subject}) and scoped to a project
 * ({@code projectId}).
 *
 * @param correlationId id shared by every log line and event caused by one call
 * @param method        full RPC method name (nullable outside RPC handling)
 * @param subject       authenticated caller subject (nullable before authentication)
 * @param projectId     resolved target project (nullable until resolved)
 */
public record CorrelationContext(
        String correlationId,
        String method,
        String subject,
        String projectId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the RPC method. */
    public static final String MDC_METHOD = "rpcMethod";

    /** MDC key for the caller subject. */
    public static final String MDC_SUBJECT = "subject";

    /** MDC key for the project. */
    public static final String MDC_PROJECT_ID = "projectId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context for a newly received call. */
    public static CorrelationContext forCall(String correlationId, String method) {
        return new CorrelationContext(correlationId, method, null, null);
    }

    public CorrelationContext withSubject(String subject) {
        return new CorrelationContext(correlationId, method, subject, projectId);
    }

    public CorrelationContext withProjectId(String projectId) {
        return new CorrelationContext(correlationId, method, subject, projectId);
    }
}
