package com.banklink.cache;

import lombok.Value;

import java.time.Instant;

/**
 * Value returned by a cache read, with where it came from.
 */
@Value
public class CachedValue<T> {

    public enum Source {
        /**
         * Fetched from the provider during this call.
         */
        PROVIDER,
        /**
         * Served from a fresh cache entry.
         */
        CACHE,
        /**
         * Forced refresh failed transiently; the previous, unexpired entry was served.
         */
        FALLBACK
    }

    T payload;
    Instant cachedAt;
    Instant expiresAt;
    Source source;
}
