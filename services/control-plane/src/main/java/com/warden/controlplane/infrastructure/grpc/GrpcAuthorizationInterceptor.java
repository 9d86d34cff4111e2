package com.warden.controlplane.infrastructure.grpc;

import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ProjectContextResolver;
import com.warden.controlplane.domain.ProjectTarget;
import com.warden.security.MethodPolicy;
import com.warden.security.ProjectAccessEnforcer;
import io.grpc.Context;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * Last stage of the context pipeline: checks that the caller may act on the target project, as an
 * administrator when the method is {@code ownerOnly}, then resolves the provider into the {@link
 * EntityContext} handlers read. Superadmins always pass.
 */
public class GrpcAuthorizationInterceptor implements ServerInterceptor {

    private final ProjectContextResolver resolver;

    public GrpcAuthorizationInterceptor(ProjectContextResolver resolver) {
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
                ProjectTarget target = CallContext.target();
                ProjectAccessEnforcer.enforce(
                        CallContext.permissions(), target.projectId(), policy.ownerOnly());
                EntityContext entity = resolver.resolveProvider(target);
                return Context.current().withValue(CallContext.ENTITY, entity);
            }
        };
    }
}
