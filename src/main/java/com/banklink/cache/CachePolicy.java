package com.banklink.cache;

import lombok.Value;

import java.time.Duration;

/**
 * TTL and staleness threshold for one kind of cached data.
 */
@Value
public class CachePolicy {
    /**
     * Short kind name, also the storage key prefix.
     */
    String name;
    Duration ttl;
    /**
     * Fraction of the TTL after which a served entry triggers a background refresh.
     */
    double staleFraction;

    public Duration staleAfter() {
        return Duration.ofMillis((long) (ttl.toMillis() * staleFraction));
    }
}
