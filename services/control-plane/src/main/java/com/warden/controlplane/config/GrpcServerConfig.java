package com.warden.controlplane.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.PermissionResolver;
import com.warden.controlplane.domain.ProjectContextResolver;
import com.warden.controlplane.infrastructure.grpc.GrpcAuthenticationInterceptor;
import com.warden.controlplane.infrastructure.grpc.GrpcAuthorizationInterceptor;
import com.warden.controlplane.infrastructure.grpc.GrpcCorrelationInterceptor;
import com.warden.controlplane.infrastructure.grpc.GrpcEntityContextInterceptor;
import com.warden.controlplane.infrastructure.grpc.GrpcExceptionInterceptor;
import com.warden.controlplane.infrastructure.grpc.GrpcLoggingInterceptor;
import com.warden.controlplane.infrastructure.grpc.GrpcServerLifecycle;
import com.warden.controlplane.infrastructure.grpc.GrpcService;
import com.warden.controlplane.infrastructure.grpc.GrpcServiceBinder;
import com.warden.controlplane.infrastructure.grpc.GrpcServiceBinder.BoundService;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import com.warden.security.RpcPolicyIndex;
import com.warden.security.TokenValidator;
import io.grpc.ServerInterceptor;
import io.grpc.ServerServiceDefinition;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds every {@link GrpcService} bean and serves them behind the interceptor pipeline.
 *
 * <p>The policy index is built once from the bound handler methods; a method missing from it gets
 * the default policy.
 */
@Configuration
public class GrpcServerConfig {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerConfig.class);

    @Bean
    public BoundServices boundServices(
            ApplicationContext context, ObjectMapper objectMapper, SpanHelper spanHelper) {
        GrpcServiceBinder binder = new GrpcServiceBinder(objectMapper, spanHelper);
        List<BoundService> bound = new ArrayList<>();
        context.getBeansWithAnnotation(GrpcService.class)
                .values()
                .forEach(handler -> bound.add(binder.bind(handler)));
        return new BoundServices(List.copyOf(bound));
    }

    @Bean
    public RpcPolicyIndex rpcPolicyIndex(BoundServices boundServices) {
        Map<String, Method> methods = new HashMap<>();
        boundServices.services().forEach(service -> methods.putAll(service.methods()));
        RpcPolicyIndex index = RpcPolicyIndex.fromMethods(methods);
        log.info("Indexed policies of {} RPC methods", index.size());
        return index;
    }

    @Bean
    public GrpcServerLifecycle grpcServerLifecycle(
            ControlPlaneProperties properties,
            BoundServices boundServices,
            RpcPolicyIndex rpcPolicyIndex,
            TokenValidator tokenValidator,
            PermissionResolver permissionResolver,
            ProjectContextResolver projectContextResolver,
            MetricFactory metricFactory) {
        return new GrpcServerLifecycle(
                properties.grpcPort(),
                properties.grpcEnabled(),
                boundServices.definitions(),
                interceptors(
                        rpcPolicyIndex,
                        tokenValidator,
                        permissionResolver,
                        projectContextResolver,
                        metricFactory));
    }

    /** The request pipeline, outermost first. */
    public static List<ServerInterceptor> interceptors(
            RpcPolicyIndex policies,
            TokenValidator tokenValidator,
            PermissionResolver permissionResolver,
            ProjectContextResolver projectContextResolver,
            MetricFactory metrics) {
        return List.of(
                new GrpcCorrelationInterceptor(),
                new GrpcLoggingInterceptor(policies, metrics),
                new GrpcExceptionInterceptor(),
                new GrpcAuthenticationInterceptor(policies, tokenValidator, permissionResolver),
                new GrpcEntityContextInterceptor(projectContextResolver),
                new GrpcAuthorizationInterceptor(projectContextResolver));
    }

    /** The bound {@link GrpcService} beans of the application context. */
    public record BoundServices(List<BoundService> services) {

        List<ServerServiceDefinition> definitions() {
            return services.stream().map(BoundService::definition).toList();
        }
    }
}
