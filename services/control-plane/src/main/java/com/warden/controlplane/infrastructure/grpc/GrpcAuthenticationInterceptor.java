package com.warden.controlplane.infrastructure.grpc;

import com.warden.controlplane.domain.PermissionResolver;
import com.warden.controlplane.domain.ServiceException;
import com.warden.observability.CorrelationContextHolder;
import com.warden.security.BearerTokenExtractor;
import com.warden.security.MethodPolicy;
import com.warden.security.RpcPolicyIndex;
import com.warden.security.TokenClaims;
import com.warden.security.TokenValidationException;
import com.warden.security.TokenValidator;
import com.warden.security.UserPermissions;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage of the context pipeline: attaches the method policy and, unless the method is
 * anonymous, the caller's token claims and permissions.
 *
 * <p>A missing or invalid bearer token fails the call with {@code UNAUTHENTICATED}; a call to a
 * {@code rootAdminOnly} method by anyone but a superadmin fails with {@code PERMISSION_DENIED}.
 */
public class GrpcAuthenticationInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcAuthenticationInterceptor.class);

    static final Metadata.Key<String> AUTHORIZATION_KEY =
            Metadata.Key.of(BearerTokenExtractor.AUTHORIZATION, Metadata.ASCII_STRING_MARSHALLER);

    private final RpcPolicyIndex policies;
    private final TokenValidator tokenValidator;
    private final PermissionResolver permissionResolver;

    public GrpcAuthenticationInterceptor(
            RpcPolicyIndex policies,
            TokenValidator tokenValidator,
            PermissionResolver permissionResolver) {
        this.policies = policies;
        this.tokenValidator = tokenValidator;
        this.permissionResolver = permissionResolver;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        MethodPolicy policy = policies.lookup(call.getMethodDescriptor().getFullMethodName());
        Context context = Context.current().withValue(CallContext.POLICY, policy);
        if (policy.anonymous()) {
            return Contexts.interceptCall(context, call, headers, next);
        }

        Optional<String> token = BearerTokenExtractor.extract(headers.get(AUTHORIZATION_KEY));
        if (token.isEmpty()) {
            return fail(call, ServiceException.authFailed("no auth token"));
        }
        TokenClaims claims;
        try {
            claims = tokenValidator.parseAndValidate(token.get());
        } catch (TokenValidationException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return fail(call, ServiceException.authFailed("invalid auth token"));
        }

        UserPermissions permissions = permissionResolver.resolve(claims);
        if (policy.rootAdminOnly() && !permissions.superadmin()) {
            return fail(
                    call,
                    ServiceException.forbidden("user is not authorized to perform this operation"));
        }
        CorrelationContextHolder.update(correlation -> correlation.withSubject(claims.subject()));

        context =
                context.withValues(
                        CallContext.CLAIMS, claims, CallContext.PERMISSIONS, permissions);
        return Contexts.interceptCall(context, call, headers, next);
    }

    static <ReqT, RespT> ServerCall.Listener<ReqT> fail(
            ServerCall<ReqT, RespT> call, RuntimeException error) {
        call.close(Status.fromThrowable(error), new Metadata());
        return new ServerCall.Listener<>() {};
    }
}
