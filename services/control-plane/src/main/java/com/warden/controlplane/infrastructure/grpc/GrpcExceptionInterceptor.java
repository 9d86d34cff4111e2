package com.warden.controlplane.infrastructure.grpc;

import com.warden.controlplane.domain.ServiceException;
import com.warden.security.ProjectAccessDeniedException;
import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC server interceptor that maps Java exceptions to gRPC status codes.
 *
 * <p>Handlers and the pipeline interceptors fail a call by closing it with {@code UNKNOWN} and the
 * exception as cause. This interceptor replaces that status:
 *
 * <ul>
 *   <li>{@link ServiceException} → the code of its {@link
 *       com.warden.controlplane.domain.ErrorKind} with its message; the cause of a
 *       non-user-visible exception is logged, never returned
 *   <li>{@link ProjectAccessDeniedException} → {@code PERMISSION_DENIED}
 *   <li>{@link IllegalArgumentException} → {@code INVALID_ARGUMENT}
 *   <li>{@link IllegalStateException} → {@code FAILED_PRECONDITION}
 *   <li>{@link StatusRuntimeException} → preserves the original status
 *   <li>All other exceptions → {@code INTERNAL "Internal server error"}
 * </ul>
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall<ReqT, RespT> wrappedCall =
                new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        if (status.getCode() == Status.Code.UNKNOWN && status.getCause() != null) {
                            status = mapException(status.getCause());
                        }
                        super.close(status, trailers);
                    }
                };

        return next.startCall(wrappedCall, headers);
    }

    /** Maps an exception to the status returned to the caller. Package-private for testing. */
    Status mapException(Throwable throwable) {
        if (throwable instanceof ServiceException service) {
            return mapServiceException(service);
        }
        if (throwable instanceof ProjectAccessDeniedException denied) {
            log.debug("gRPC permission denied on project {}: {}",
                    denied.projectId(), denied.getMessage());
            return Status.PERMISSION_DENIED.withDescription(denied.getMessage());
        }
        if (throwable instanceof IllegalArgumentException) {
            log.warn("gRPC bad request: {}", throwable.getMessage());
            return Status.INVALID_ARGUMENT
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof IllegalStateException) {
            log.warn("gRPC failed precondition: {}", throwable.getMessage());
            return Status.FAILED_PRECONDITION
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }

    private static Status mapServiceException(ServiceException e) {
        Status status = toStatus(e);
        if (e.userVisible()) {
            log.debug("gRPC {}: {}", status.getCode(), e.getMessage());
        } else {
            log.error("gRPC {}: {}", status.getCode(), e.getMessage(), e.getCause());
        }
        return status.withDescription(e.getMessage());
    }

    private static Status toStatus(ServiceException e) {
        return switch (e.kind()) {
            case AUTH_FAILED -> Status.UNAUTHENTICATED;
            case FORBIDDEN -> Status.PERMISSION_DENIED;
            case BAD_REQUEST -> Status.INVALID_ARGUMENT;
            case NOT_FOUND -> Status.NOT_FOUND;
            case CONFLICT -> Status.ALREADY_EXISTS;
            case PRECONDITION -> Status.FAILED_PRECONDITION;
            case EXHAUSTED -> Status.RESOURCE_EXHAUSTED;
            case UNAVAILABLE -> Status.UNAVAILABLE;
            case INTERNAL -> Status.INTERNAL;
            case UNKNOWN -> Status.UNKNOWN;
        };
    }
}
