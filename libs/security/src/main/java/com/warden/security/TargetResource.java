package com.warden.security;

/**
 * The kind of resource an RPC acts on, which decides how far the
 * authorization pipeline runs.
 */
public enum TargetResource {

    /** No resource: authentication only. */
    NONE,

    /** The calling user itself: authentication only. */
    USER,

    /** A project: the entity context is resolved and access to the project checked. */
    PROJECT
}
