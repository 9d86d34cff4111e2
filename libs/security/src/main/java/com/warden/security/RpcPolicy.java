package com.warden.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the authorization policy of an RPC handler method.
 * <p>
 * Read once at startup into the {@link RpcPolicyIndex}. A handler without this
 * annotation gets {@link MethodPolicy#DEFAULT}.
 *
 * <pre>{@code
 * @RpcPolicy(targetResource = TargetResource.PROJECT, ownerOnly = true)
 * public CreateProjectResponse createProject(CreateProjectRequest request) { ... }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RpcPolicy {

    /** Callable without a token. Skips authentication, entity resolution and authorization. */
    boolean anonymous() default false;

    /** Suppresses per-call logging. */
    boolean noLog() default false;

    TargetResource targetResource() default TargetResource.NONE;

    /** Requires an administrator role binding on the target project. */
    boolean ownerOnly() default false;

    /** Requires the superadmin realm role. */
    boolean rootAdminOnly() default false;
}
