package com.warden.security;

/**
 * Resolved policy for one RPC method.
 *
 * @param anonymous      callable without a token
 * @param noLog          excluded from per-call logging
 * @param targetResource what the method acts on
 * @param ownerOnly      requires administrator rights on the target project
 * @param rootAdminOnly  requires the superadmin realm role
 */
public record MethodPolicy(
        boolean anonymous,
        boolean noLog,
        TargetResource targetResource,
        boolean ownerOnly,
        boolean rootAdminOnly
) {

    /** Policy applied to methods with no declared policy. */
    public static final MethodPolicy DEFAULT =
            new MethodPolicy(false, false, TargetResource.NONE, false, false);

    public MethodPolicy {
        if (targetResource == null) {
            targetResource = TargetResource.NONE;
        }
    }

    /** Converts a declared annotation into a policy value. */
    public static MethodPolicy of(RpcPolicy annotation) {
        return new MethodPolicy(
                annotation.anonymous(),
                annotation.noLog(),
                annotation.targetResource(),
                annotation.ownerOnly(),
                annotation.rootAdminOnly()
        );
    }

    public boolean targetsProject() {
        return targetResource == TargetResource.PROJECT;
    }
}
