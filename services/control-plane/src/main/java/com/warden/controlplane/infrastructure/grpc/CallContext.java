package com.warden.controlplane.infrastructure.grpc;

import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ProjectTarget;
import com.warden.controlplane.domain.ServiceException;
import com.warden.security.MethodPolicy;
import com.warden.security.TokenClaims;
import com.warden.security.UserPermissions;
import io.grpc.Context;

/**
 * Per-call values the interceptors attach to the gRPC {@link Context}. Handlers read them through
 * the accessors; only the interceptors in this package can set them.
 */
public final class CallContext {

    static final Context.Key<MethodPolicy> POLICY = Context.key("warden-method-policy");

    static final Context.Key<TokenClaims> CLAIMS = Context.key("warden-token-claims");

    static final Context.Key<UserPermissions> PERMISSIONS = Context.key("warden-permissions");

    static final Context.Key<ProjectTarget> TARGET = Context.key("warden-project-target");

    static final Context.Key<EntityContext> ENTITY = Context.key("warden-entity-context");

    private CallContext() {
        // utility class
    }

    /** Claims of the authenticated caller. */
    public static TokenClaims claims() {
        return require(CLAIMS, "token claims");
    }

    /** Permissions of the authenticated caller. */
    public static UserPermissions permissions() {
        return require(PERMISSIONS, "caller permissions");
    }

    /** Project and provider of a project-scoped call. */
    public static EntityContext entityContext() {
        return require(ENTITY, "entity context");
    }

    /** Project named by a project-scoped call, before authorization. */
    static ProjectTarget target() {
        return require(TARGET, "project target");
    }

    /** Policy of the current method; the default policy outside the interceptor chain. */
    public static MethodPolicy policy() {
        MethodPolicy policy = POLICY.get();
        return policy == null ? MethodPolicy.DEFAULT : policy;
    }

    private static <T> T require(Context.Key<T> key, String what) {
        T value = key.get();
        if (value == null) {
            throw ServiceException.internal(what + " missing from call context");
        }
        return value;
    }
}
