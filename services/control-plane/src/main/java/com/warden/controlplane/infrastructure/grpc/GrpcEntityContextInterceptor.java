package com.warden.controlplane.infrastructure.grpc;

import com.warden.controlplane.api.HasProjectContext;
import com.warden.controlplane.domain.ProjectContextResolver;
import com.warden.controlplane.domain.ProjectTarget;
import com.warden.controlplane.domain.ServiceException;
import com.warden.observability.CorrelationContextHolder;
import com.warden.security.MethodPolicy;
import io.grpc.Context;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * Second stage of the context pipeline: for project-targeted methods, resolves the project named by
 * the request into a {@link ProjectTarget}.
 *
 * <p>The request must implement {@link HasProjectContext}. Whether the caller may access the
 * project, and which provider the call acts on, is left to {@link GrpcAuthorizationInterceptor}.
 */
public class GrpcEntityContextInterceptor implements ServerInterceptor {

    private final ProjectContextResolver resolver;

    public GrpcEntityContextInterceptor(ProjectContextResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        MethodPolicy policy = CallContext.policy();
        ServerCall.Listener<ReqT> delegate = next.startCall(call, headers);
        if (policy.anonymous() || !policy.targetsProject()) {
            return delegate;
        }
        return new GatedListener<>(call, delegate) {
            @Override
            protected Context admit(ReqT message) {
                if (!(message instanceof HasProjectContext request)) {
                    throw ServiceException.internal(
                            "request of "
                                    + call.getMethodDescriptor().getFullMethodName()
                                    + " carries no project context");
                }
                ProjectTarget target =
                        resolver.resolveTarget(request.selector(), CallContext.permissions());
                CorrelationContextHolder.update(
                        correlation -> correlation.withProjectId(target.projectId().toString()));
                return Context.current().withValue(CallContext.TARGET, target);
            }
        };
    }
}
