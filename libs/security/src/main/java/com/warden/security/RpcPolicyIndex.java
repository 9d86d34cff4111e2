package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only registry of per-RPC policy, keyed by fully-qualified method name
 * (for example {@code "warden.v1.ProfileService/CreateProfile"}).
 * <p>
 * Built once at process start, then shared by every call. Every handler method
 * must declare {@link RpcPolicy}; lookups for names that were never registered
 * return {@link MethodPolicy#DEFAULT}.
 */
public final class RpcPolicyIndex {

    private static final Logger log = LoggerFactory.getLogger(RpcPolicyIndex.class);

    private final Map<String, MethodPolicy> policies;

    private RpcPolicyIndex(Map<String, MethodPolicy> policies) {
        this.policies = Map.copyOf(policies);
    }

    /**
     * Builds the index by reading {@link RpcPolicy} from each handler method.
     *
     * @param handlers handler methods keyed by fully-qualified RPC method name
     * @return the index
     * @throws IllegalStateException if any handler method lacks the annotation
     */
    public static RpcPolicyIndex fromMethods(Map<String, Method> handlers) {
        Map<String, MethodPolicy> policies = new LinkedHashMap<>();
        List<String> undeclared = new ArrayList<>();
        handlers.forEach((fullMethodName, method) -> {
            RpcPolicy annotation = method.getAnnotation(RpcPolicy.class);
            if (annotation == null) {
                undeclared.add(fullMethodName);
                return;
            }
            policies.put(fullMethodName, MethodPolicy.of(annotation));
        });
        if (!undeclared.isEmpty()) {
            Collections.sort(undeclared);
            throw new IllegalStateException("RPC methods without a policy: " + undeclared);
        }
        log.info("RPC policy index built with {} entries", policies.size());
        return new RpcPolicyIndex(policies);
    }

    /** Builds an index from explicit entries. */
    public static RpcPolicyIndex of(Map<String, MethodPolicy> policies) {
        return new RpcPolicyIndex(policies);
    }

    /** Returns the policy for the method, or {@link MethodPolicy#DEFAULT} when none is registered. */
    public MethodPolicy lookup(String fullMethodName) {
        return policies.getOrDefault(fullMethodName, MethodPolicy.DEFAULT);
    }

    public Set<String> methods() {
        return policies.keySet();
    }

    public int size() {
        return policies.size();
    }
}
