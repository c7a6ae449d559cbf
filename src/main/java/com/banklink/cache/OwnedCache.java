package com.banklink.cache;

/**
 * Eviction operations every per-user cache supports.
 */
public interface OwnedCache {

    void invalidate(String connectionId, String accountId);

    void invalidateConnection(String connectionId);

    void purgeOwner(String userId);
}
