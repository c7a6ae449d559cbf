package com.banklink.cache;

import com.banklink.common.exception.TransientProviderException;
import com.banklink.connections.ConnectionIds;
import com.banklink.session.SessionContext;
import com.banklink.storage.SecureCredentialStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * TTL cache with stale-while-revalidate, persisted encrypted in the secure tier.
 *
 * Entries are keyed {@code <kind>_cache_<connectionId>_<accountId>} and record
 * the user they were fetched for. A read by any other user deletes the entry
 * and reports a miss. Expired entries are never served. Once an entry is
 * older than the policy's stale threshold it is still served, and one
 * background refresh per key is started.
 */
@Slf4j
public class SwrCache<T> implements OwnedCache {

    private final CachePolicy policy;
    private final JavaType entryType;
    private final SecureCredentialStore store;
    private final ObjectMapper objectMapper;
    private final SessionContext session;
    private final Executor refreshExecutor;
    private final Clock clock;

    private final Set<String> refreshesInFlight = ConcurrentHashMap.newKeySet();

    public SwrCache(CachePolicy policy,
                    Class<T> payloadType,
                    SecureCredentialStore store,
                    ObjectMapper objectMapper,
                    SessionContext session,
                    Executor refreshExecutor,
                    Clock clock) {
        this.policy = policy;
        this.entryType = objectMapper.getTypeFactory().constructParametricType(CacheEntry.class, payloadType);
        this.store = store;
        this.objectMapper = objectMapper;
        this.session = session;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
    }

    /**
     * Read through the cache.
     *
     * @param forceRefresh fetch from the provider regardless of the cached entry
     * @param fetcher      provider call for this scope
     */
    public CachedValue<T> get(String connectionId, String accountId, boolean forceRefresh, Supplier<T> fetcher) {
        String userId = session.requireUserId();
        String key = storageKey(connectionId, accountId);

        if (forceRefresh) {
            try {
                return fetchAndStore(key, userId, connectionId, fetcher);
            } catch (TransientProviderException e) {
                Optional<CacheEntry<T>> previous = readOwned(key, userId);
                if (previous.isPresent()) {
                    log.warn("Forced {} refresh failed transiently, serving cached entry", policy.getName());
                    return toValue(previous.get(), CachedValue.Source.FALLBACK);
                }
                throw e;
            }
        }

        Optional<CacheEntry<T>> cached = readOwned(key, userId);
        if (cached.isEmpty()) {
            log.debug("{} cache miss for {}", policy.getName(), ConnectionIds.shorten(connectionId));
            return fetchAndStore(key, userId, connectionId, fetcher);
        }

        CacheEntry<T> entry = cached.get();
        log.debug("{} cache hit for {}", policy.getName(), ConnectionIds.shorten(connectionId));
        if (entry.isStaleAt(clock.instant(), policy.staleAfter())) {
            refreshInBackground(key, userId, connectionId, fetcher);
        }
        return toValue(entry, CachedValue.Source.CACHE);
    }

    /**
     * Cached payload without fetching, if a fresh entry owned by the current user exists.
     */
    public Optional<T> peek(String connectionId, String accountId) {
        String userId = session.requireUserId();
        return readOwned(storageKey(connectionId, accountId), userId).map(CacheEntry::getPayload);
    }

    @Override
    public void invalidate(String connectionId, String accountId) {
        store.delete(storageKey(connectionId, accountId));
    }

    /**
     * Delete the connection's entries. Ids may contain the key separator, so
     * entries are matched on the connection they record, not on the key alone.
     */
    @Override
    public void invalidateConnection(String connectionId) {
        for (String key : store.keys(prefix() + connectionId + "_")) {
            Optional<CacheEntry<T>> entry = parse(key, store.get(key));
            if (entry.isEmpty() || entry.get().getConnectionId() == null
                    || connectionId.equals(entry.get().getConnectionId())) {
                store.delete(key);
            }
        }
        log.debug("{} cache cleared for connection {}", policy.getName(), ConnectionIds.shorten(connectionId));
    }

    /**
     * Delete every entry owned by the user, and any entry that can no longer be read.
     */
    @Override
    public void purgeOwner(String userId) {
        int removed = 0;
        for (String key : store.keys(prefix())) {
            Optional<CacheEntry<T>> entry = parse(key, store.get(key));
            if (entry.isEmpty() || userId.equals(entry.get().getOwnerUserId())) {
                store.delete(key);
                removed++;
            }
        }
        log.debug("{} cache purged {} entries on logout", policy.getName(), removed);
    }

    /**
     * Delete expired and unreadable entries, whoever owns them.
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (String key : store.keys(prefix())) {
            Optional<CacheEntry<T>> entry = parse(key, store.get(key));
            if (entry.isEmpty() || entry.get().isExpiredAt(now)) {
                store.delete(key);
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("{} cache removed {} expired entries", policy.getName(), removed);
        }
        return removed;
    }

    boolean isRefreshInFlight(String connectionId, String accountId) {
        return refreshesInFlight.contains(storageKey(connectionId, accountId));
    }

    String storageKey(String connectionId, String accountId) {
        return prefix() + connectionId + "_" + accountId;
    }

    private String prefix() {
        return policy.getName() + "_cache_";
    }

    private CachedValue<T> fetchAndStore(String key, String userId, String connectionId, Supplier<T> fetcher) {
        T payload = fetcher.get();
        CacheEntry<T> entry = store(key, userId, connectionId, payload);
        return toValue(entry, CachedValue.Source.PROVIDER);
    }

    private CacheEntry<T> store(String key, String userId, String connectionId, T payload) {
        Instant now = clock.instant();
        CacheEntry<T> entry = new CacheEntry<>(userId, connectionId, now, now.plus(policy.getTtl()), payload);
        try {
            store.set(key, objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cache entry is not serializable", e);
        }
        return entry;
    }

    private void refreshInBackground(String key, String userId, String connectionId, Supplier<T> fetcher) {
        if (!refreshesInFlight.add(key)) {
            return;
        }
        try {
            refreshExecutor.execute(() -> {
                try {
                    T payload = fetcher.get();
                    if (session.currentUserId().filter(userId::equals).isPresent()) {
                        store(key, userId, connectionId, payload);
                        log.debug("{} background refresh stored", policy.getName());
                    }
                } catch (RuntimeException e) {
                    log.warn("{} background refresh failed: {}", policy.getName(), e.getMessage());
                } finally {
                    refreshesInFlight.remove(key);
                }
            });
        } catch (RejectedExecutionException e) {
            refreshesInFlight.remove(key);
            log.warn("{} background refresh rejected: {}", policy.getName(), e.getMessage());
        }
    }

    private Optional<CacheEntry<T>> readOwned(String key, String userId) {
        Optional<String> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Optional<CacheEntry<T>> entry = parse(key, raw);
        if (entry.isEmpty()) {
            store.delete(key);
            return Optional.empty();
        }
        if (!userId.equals(entry.get().getOwnerUserId())) {
            log.warn("{} cache entry belongs to another user, discarding", policy.getName());
            store.delete(key);
            return Optional.empty();
        }
        if (entry.get().isExpiredAt(clock.instant())) {
            store.delete(key);
            return Optional.empty();
        }
        return entry;
    }

    private Optional<CacheEntry<T>> parse(String key, Optional<String> raw) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            CacheEntry<T> entry = objectMapper.readValue(raw.get(), entryType);
            if (entry.getOwnerUserId() == null || entry.getCachedAt() == null || entry.getExpiresAt() == null) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} cache entry {}", policy.getName(), key);
            return Optional.empty();
        }
    }

    private CachedValue<T> toValue(CacheEntry<T> entry, CachedValue.Source source) {
        return new CachedValue<>(entry.getPayload(), entry.getCachedAt(), entry.getExpiresAt(), source);
    }
}
