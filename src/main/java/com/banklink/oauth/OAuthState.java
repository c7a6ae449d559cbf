package com.banklink.oauth;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One-time CSRF token bound to a single authorization attempt.
 */
@Value
@Builder
@Jacksonized
public class OAuthState {
    String value;
    Instant createdAt;
    Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "OAuthState(expiresAt=" + expiresAt + ")";
    }
}
