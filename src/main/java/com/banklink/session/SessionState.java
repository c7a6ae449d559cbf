package com.banklink.session;

/**
 * Lifecycle states for the active user session.
 */
public enum SessionState {
    /**
     * No user signed in. Credential and cache operations are refused.
     */
    CLOSED,

    /**
     * A user is signed in and owns all cache reads and writes.
     */
    OPEN,

    /**
     * Sign-out in progress. New operations are refused while caches are purged.
     */
    CLOSING
}
