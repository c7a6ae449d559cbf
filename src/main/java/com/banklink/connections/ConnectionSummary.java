package com.banklink.connections;

import lombok.Value;

import java.time.Instant;

/**
 * Token-free view of a connection for the UI.
 */
@Value
public class ConnectionSummary {
    String connectionId;
    Instant createdAt;
    Instant expiresAt;
    boolean refreshRequired;
}
