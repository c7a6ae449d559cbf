package com.banklink.oauth;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a bank link, for the authorization flow and for a connection's
 * token refresh cycle.
 */
public enum LinkState {
    /**
     * Nothing in progress and no connection from this flow.
     */
    NO_CONNECTION,

    /**
     * Authorization URL issued, waiting for the consent callback.
     */
    AUTHORIZING,

    /**
     * Callback validated, code being exchanged through the broker.
     */
    EXCHANGING,

    /**
     * Connection holds usable tokens.
     */
    ACTIVE,

    /**
     * Refresh call in flight.
     */
    REFRESHING,

    /**
     * Provider rejected the grant. Connection deleted.
     */
    REVOKED,

    /**
     * Flow aborted by a validation, security or provider error.
     */
    FAILED,

    /**
     * User cancelled the consent session.
     */
    CANCELLED;

    private Set<LinkState> next;

    static {
        NO_CONNECTION.next = EnumSet.of(AUTHORIZING);
        AUTHORIZING.next = EnumSet.of(AUTHORIZING, EXCHANGING, FAILED, CANCELLED);
        EXCHANGING.next = EnumSet.of(ACTIVE, FAILED);
        ACTIVE.next = EnumSet.of(REFRESHING, AUTHORIZING, REVOKED);
        REFRESHING.next = EnumSet.of(ACTIVE, REVOKED);
        REVOKED.next = EnumSet.of(AUTHORIZING);
        FAILED.next = EnumSet.of(AUTHORIZING);
        CANCELLED.next = EnumSet.of(AUTHORIZING);
    }

    public boolean canTransitionTo(LinkState target) {
        return next.contains(target);
    }
}
