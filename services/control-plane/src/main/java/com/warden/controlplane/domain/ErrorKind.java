package com.warden.controlplane.domain;

/**
 * Classification of a failed operation, independent of the transport.
 *
 * <p>{@link #INTERNAL} is for failures of the service's own logic (misconfiguration, broken
 * invariants); {@link #UNKNOWN} is for store or peer failures the service cannot classify.
 */
public enum ErrorKind {
    AUTH_FAILED,
    FORBIDDEN,
    BAD_REQUEST,
    NOT_FOUND,
    CONFLICT,
    PRECONDITION,
    EXHAUSTED,
    UNAVAILABLE,
    INTERNAL,
    UNKNOWN
}
