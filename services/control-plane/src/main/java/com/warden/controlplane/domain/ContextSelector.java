package com.warden.controlplane.domain;

/**
 * Project and provider as requested by the caller, in both request-context versions.
 *
 * @param v1 legacy context, null when absent
 * @param v2 newer context, null when absent
 */
public record ContextSelector(Requested v1, Requested v2) {

    /** One version of the request context. Blank fields mean "not given". */
    public record Requested(String project, String provider) {}

    public boolean isEmpty() {
        return v1 == null && v2 == null;
    }
}
