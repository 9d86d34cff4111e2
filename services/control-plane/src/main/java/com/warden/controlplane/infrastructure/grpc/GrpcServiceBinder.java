package com.warden.controlplane.infrastructure.grpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.ServiceException;
import com.warden.observability.SpanHelper;
import io.grpc.MethodDescriptor;
import io.grpc.ServerMethodDefinition;
import io.grpc.ServerServiceDefinition;
import io.grpc.stub.ServerCalls;
import io.opentelemetry.api.trace.SpanKind;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a {@link GrpcService} handler object into a {@link ServerServiceDefinition}.
 *
 * <p>Each {@link GrpcMethod} becomes a unary method with JSON-encoded messages. The handler runs
 * inside a server span; a {@link RuntimeException} it throws is handed to the response observer,
 * which closes the call with {@code UNKNOWN} carrying the exception as cause. {@link
 * GrpcExceptionInterceptor} maps that to the final status.
 */
public final class GrpcServiceBinder {

    private final ObjectMapper mapper;
    private final SpanHelper spans;

    public GrpcServiceBinder(ObjectMapper mapper, SpanHelper spans) {
        this.mapper = mapper;
        this.spans = spans;
    }

    /**
     * A bound service with its handler methods, keyed by full method name.
     *
     * @param methods input for {@link com.warden.security.RpcPolicyIndex#fromMethods(Map)}
     */
    public record BoundService(ServerServiceDefinition definition, Map<String, Method> methods) {}

    public BoundService bind(Object handler) {
        GrpcService service = handler.getClass().getAnnotation(GrpcService.class);
        if (service == null) {
            throw new IllegalArgumentException(
                    handler.getClass().getName() + " is not annotated with @GrpcService");
        }
        ServerServiceDefinition.Builder builder = ServerServiceDefinition.builder(service.value());
        Map<String, Method> methods = new LinkedHashMap<>();
        Method[] candidates = handler.getClass().getMethods();
        Arrays.sort(candidates, Comparator.comparing(Method::getName));
        for (Method method : candidates) {
            GrpcMethod rpc = method.getAnnotation(GrpcMethod.class);
            if (rpc == null) {
                continue;
            }
            if (method.getParameterCount() != 1 || method.getReturnType() == void.class) {
                throw new IllegalArgumentException(
                        "gRPC method " + method + " must take one request and return a response");
            }
            String fullName = MethodDescriptor.generateFullMethodName(service.value(), rpc.value());
            builder.addMethod(
                    define(
                            fullName,
                            method.getParameterTypes()[0],
                            method.getReturnType(),
                            handler,
                            method));
            methods.put(fullName, method);
        }
        return new BoundService(builder.build(), Map.copyOf(methods));
    }

    private <ReqT, RespT> ServerMethodDefinition<ReqT, RespT> define(
            String fullName,
            Class<ReqT> requestType,
            Class<RespT> responseType,
            Object handler,
            Method method) {
        MethodDescriptor<ReqT, RespT> descriptor =
                MethodDescriptor.<ReqT, RespT>newBuilder()
                        .setType(MethodDescriptor.MethodType.UNARY)
                        .setFullMethodName(fullName)
                        .setRequestMarshaller(new JsonMarshaller<>(mapper, requestType))
                        .setResponseMarshaller(new JsonMarshaller<>(mapper, responseType))
                        .build();
        ServerCalls.UnaryMethod<ReqT, RespT> unary =
                (request, observer) -> {
                    RespT response;
                    try {
                        response =
                                spans.inSpan(
                                        fullName,
                                        SpanKind.SERVER,
                                        Map.of("rpc.system", "grpc", "rpc.method", fullName),
                                        () -> invoke(handler, method, responseType, request));
                    } catch (RuntimeException e) {
                        observer.onError(e);
                        return;
                    }
                    observer.onNext(response);
                    observer.onCompleted();
                };
        return ServerMethodDefinition.create(descriptor, ServerCalls.asyncUnaryCall(unary));
    }

    private static <RespT> RespT invoke(
            Object handler, Method method, Class<RespT> responseType, Object request) {
        try {
            return responseType.cast(method.invoke(handler, request));
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ServiceException.internal(
                    "handler " + method.getName() + " failed", e.getCause());
        } catch (IllegalAccessException e) {
            throw ServiceException.internal(
                    "handler " + method.getName() + " is not accessible", e);
        }
    }
}
