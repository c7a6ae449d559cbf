package com.banklink.connections;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * One OAuth grant for one bank login.
 *
 * Immutable apart from the token triple, which is replaced as a whole by
 * {@link #withTokens(String, String, Instant)} on refresh.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Connection {

    String connectionId;
    String ownerUserId;
    String accessToken;
    String refreshToken;
    Instant expiresAt;
    Instant createdAt;

    public Connection withTokens(String newAccessToken, String newRefreshToken, Instant newExpiresAt) {
        return toBuilder()
            .accessToken(newAccessToken)
            .refreshToken(newRefreshToken)
            .expiresAt(newExpiresAt)
            .build();
    }

    /**
     * True if the access token can be used without refreshing first.
     */
    public boolean isUsableAt(Instant now, Duration buffer) {
        return now.isBefore(expiresAt.minus(buffer));
    }

    public boolean isOwnedBy(String userId) {
        return ownerUserId != null && ownerUserId.equals(userId);
    }

    @Override
    public String toString() {
        return "Connection(" + ConnectionIds.shorten(connectionId) + ", expiresAt=" + expiresAt + ")";
    }
}
