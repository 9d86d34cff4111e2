package com.warden.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.config.ControlPlaneConfig;
import com.warden.controlplane.config.GrpcServerConfig;
import com.warden.controlplane.domain.PermissionResolver;
import com.warden.controlplane.domain.ProjectContextResolver;
import com.warden.controlplane.infrastructure.grpc.GrpcServerLifecycle;
import com.warden.controlplane.infrastructure.grpc.GrpcServiceBinder;
import com.warden.controlplane.infrastructure.grpc.GrpcServiceBinder.BoundService;
import com.warden.controlplane.infrastructure.grpc.JsonMarshaller;
import com.warden.database.Store;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import com.warden.security.RpcPolicyIndex;
import com.warden.security.testing.TestTokenFactory;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Server;
import io.grpc.ServerServiceDefinition;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.MetadataUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Serves handler objects in-process behind the full interceptor pipeline, with tokens from {@link
 * TestTokenFactory}.
 */
public final class InProcessControlPlane implements AutoCloseable {

    private final ObjectMapper mapper = ControlPlaneConfig.jsonMapper();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final Server server;
    private final ManagedChannel channel;

    public InProcessControlPlane(Store store, Object... handlers) {
        GrpcServiceBinder binder =
                new GrpcServiceBinder(
                        mapper, new SpanHelper(OpenTelemetry.noop().getTracer("test")));
        List<ServerServiceDefinition> definitions = new ArrayList<>();
        Map<String, Method> methods = new HashMap<>();
        for (Object handler : handlers) {
            BoundService bound = binder.bind(handler);
            definitions.add(bound.definition());
            methods.putAll(bound.methods());
        }
        RpcPolicyIndex policies = RpcPolicyIndex.fromMethods(methods);
        List<ServerServiceDefinition> intercepted =
                GrpcServerLifecycle.intercept(
                        definitions,
                        GrpcServerConfig.interceptors(
                                policies,
                                TestTokenFactory.validator(),
                                new PermissionResolver(store),
                                new ProjectContextResolver(store),
                                new MetricFactory(meters, "test")));

        String name = InProcessServerBuilder.generateName();
        InProcessServerBuilder builder = InProcessServerBuilder.forName(name).directExecutor();
        intercepted.forEach(builder::addService);
        try {
            server = builder.build().start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
    }

    public SimpleMeterRegistry meters() {
        return meters;
    }

    /**
     * Calls {@code service/method} as the holder of {@code token}.
     *
     * @param token bearer token, or null for an anonymous call
     * @throws io.grpc.StatusRuntimeException when the call fails
     */
    @SuppressWarnings("unchecked")
    public <R> R call(
            String service, String method, Object request, Class<R> responseType, String token) {
        Metadata headers = new Metadata();
        if (token != null) {
            headers.put(
                    Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER),
                    "Bearer " + token);
        }
        Channel authenticated =
                ClientInterceptors.intercept(
                        channel, MetadataUtils.newAttachHeadersInterceptor(headers));
        MethodDescriptor<Object, R> descriptor =
                MethodDescriptor.<Object, R>newBuilder()
                        .setType(MethodDescriptor.MethodType.UNARY)
                        .setFullMethodName(MethodDescriptor.generateFullMethodName(service, method))
                        .setRequestMarshaller(
                                new JsonMarshaller<>(mapper, (Class<Object>) request.getClass()))
                        .setResponseMarshaller(new JsonMarshaller<>(mapper, responseType))
                        .build();
        return ClientCalls.blockingUnaryCall(
                authenticated, descriptor, CallOptions.DEFAULT, request);
    }

    @Override
    public void close() throws InterruptedException {
        channel.shutdownNow();
        server.shutdownNow();
        server.awaitTermination(5, TimeUnit.SECONDS);
    }
}
