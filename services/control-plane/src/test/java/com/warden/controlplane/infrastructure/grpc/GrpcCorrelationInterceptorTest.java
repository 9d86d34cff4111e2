package com.warden.controlplane.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.warden.controlplane.config.ControlPlaneConfig;
import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GrpcCorrelationInterceptor")
class GrpcCorrelationInterceptorTest {

    private static final String METHOD = "warden.v1.TestService/Echo";

    private final GrpcCorrelationInterceptor interceptor = new GrpcCorrelationInterceptor();

    private ServerCall<String, String> call;
    private ServerCallHandler<String, String> handler;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        JsonMarshaller<String> marshaller =
                new JsonMarshaller<>(ControlPlaneConfig.jsonMapper(), String.class);
        MethodDescriptor<String, String> descriptor =
                MethodDescriptor.<String, String>newBuilder()
                        .setType(MethodDescriptor.MethodType.UNARY)
                        .setFullMethodName(METHOD)
                        .setRequestMarshaller(marshaller)
                        .setResponseMarshaller(marshaller)
                        .build();
        call = mock(ServerCall.class);
        when(call.getMethodDescriptor()).thenReturn(descriptor);
        handler = mock(ServerCallHandler.class);
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("extracts correlation ID from gRPC metadata")
    void extractsCorrelationIdFromMetadata() {
        var metadata = new Metadata();
        metadata.put(GrpcCorrelationInterceptor.CORRELATION_ID_KEY, "grpc-test-123");
        AtomicReference<CorrelationContext> seen = captureOnStart();

        interceptor.interceptCall(call, metadata, handler);

        assertThat(seen.get().correlationId()).isEqualTo("grpc-test-123");
        assertThat(seen.get().method()).isEqualTo(METHOD);
    }

    @Test
    @DisplayName("generates correlation ID when absent from metadata")
    void generatesCorrelationIdWhenAbsent() {
        AtomicReference<CorrelationContext> seen = captureOnStart();

        interceptor.interceptCall(call, new Metadata(), handler);

        assertThat(seen.get().correlationId()).isNotBlank();
    }

    @Test
    @DisplayName("clears the thread's context once the call has started")
    void clearsAfterStart() {
        captureOnStart();

        interceptor.interceptCall(call, new Metadata(), handler);

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }

    @Test
    @DisplayName("carries changes made while starting into later callbacks")
    void carriesChangesIntoCallbacks() {
        AtomicReference<CorrelationContext> onMessage = new AtomicReference<>();
        when(handler.startCall(any(), any()))
                .thenAnswer(
                        invocation -> {
                            CorrelationContextHolder.update(ctx -> ctx.withSubject("alice"));
                            return new ServerCall.Listener<String>() {
                                @Override
                                public void onMessage(String message) {
                                    onMessage.set(CorrelationContextHolder.get().orElseThrow());
                                }
                            };
                        });
        var metadata = new Metadata();
        metadata.put(GrpcCorrelationInterceptor.CORRELATION_ID_KEY, "grpc-test-456");

        ServerCall.Listener<String> listener = interceptor.interceptCall(call, metadata, handler);
        listener.onMessage("{}");

        assertThat(onMessage.get().correlationId()).isEqualTo("grpc-test-456");
        assertThat(onMessage.get().subject()).isEqualTo("alice");
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }

    private AtomicReference<CorrelationContext> captureOnStart() {
        AtomicReference<CorrelationContext> seen = new AtomicReference<>();
        when(handler.startCall(any(), any()))
                .thenAnswer(
                        invocation -> {
                            seen.set(CorrelationContextHolder.get().orElseThrow());
                            return new ServerCall.Listener<String>() {};
                        });
        return seen;
    }
}
