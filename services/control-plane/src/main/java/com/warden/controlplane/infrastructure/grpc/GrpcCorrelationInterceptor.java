package com.warden.controlplane.infrastructure.grpc;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * gRPC server interceptor that propagates correlation IDs from metadata.
 *
 * <p>Reads {@code x-correlation-id}, or generates a UUID when absent, and installs a {@link
 * CorrelationContext} on {@link CorrelationContextHolder} around every step of the call: the
 * start of the call and each listener callback. Callbacks of one call may run on different
 * executor threads, so the context is set before each callback and cleared after it. Changes
 * made by downstream interceptors, such as the authenticated subject or the resolved project,
 * are carried over to later callbacks.
 *
 * <p>Must be the outermost interceptor.
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> CORRELATION_ID_KEY =
            Metadata.Key.of("x-correlation-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String correlationId = headers.get(CORRELATION_ID_KEY);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        var state =
                new AtomicReference<>(
                        CorrelationContext.forCall(
                                correlationId, call.getMethodDescriptor().getFullMethodName()));

        ServerCall.Listener<ReqT> delegate =
                withContext(state, () -> next.startCall(call, headers));

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                run(state, () -> super.onMessage(message));
            }

            @Override
            public void onHalfClose() {
                run(state, super::onHalfClose);
            }

            @Override
            public void onCancel() {
                run(state, super::onCancel);
            }

            @Override
            public void onComplete() {
                run(state, super::onComplete);
            }

            @Override
            public void onReady() {
                run(state, super::onReady);
            }
        };
    }

    private static void run(AtomicReference<CorrelationContext> state, Runnable step) {
        withContext(
                state,
                () -> {
                    step.run();
                    return null;
                });
    }

    private static <T> T withContext(
            AtomicReference<CorrelationContext> state, Supplier<T> step) {
        CorrelationContextHolder.set(state.get());
        try {
            return step.get();
        } finally {
            CorrelationContextHolder.get().ifPresent(state::set);
            CorrelationContextHolder.clear();
        }
    }
}
