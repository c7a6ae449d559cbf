package com.banklink.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored form of a cached provider response, tagged with the user and
 * connection it was fetched for.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry<T> {
    private String ownerUserId;
    private String connectionId;
    private Instant cachedAt;
    private Instant expiresAt;
    private T payload;

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isStaleAt(Instant now, Duration staleAfter) {
        return Duration.between(cachedAt, now).compareTo(staleAfter) > 0;
    }
}
