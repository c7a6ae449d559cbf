package com.banklink.connections;

import lombok.Value;

/**
 * Published after a connection's tokens are deleted, so cached data and
 * linked accounts for it can be dropped.
 */
@Value
public class ConnectionRemovedEvent {

    public enum Reason {
        DISCONNECTED,
        REVOKED,
        REFRESH_REJECTED
    }

    String connectionId;
    String ownerUserId;
    Reason reason;
}
