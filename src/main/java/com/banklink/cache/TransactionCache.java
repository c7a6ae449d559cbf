package com.banklink.cache;

import com.banklink.config.BankLinkProperties;
import com.banklink.provider.BankDataService;
import com.banklink.provider.TransactionList;
import com.banklink.session.SessionContext;
import com.banklink.storage.ExpiringRecords;
import com.banklink.storage.SecureCredentialStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Confirmed and pending transactions per account, 6 hour TTL by default.
 */
@Component
public class TransactionCache implements OwnedCache, ExpiringRecords {

    private final SwrCache<TransactionList> cache;
    private final BankDataService bankDataService;

    public TransactionCache(BankLinkProperties properties,
                            BankDataService bankDataService,
                            SecureCredentialStore store,
                            ObjectMapper objectMapper,
                            SessionContext session,
                            @Qualifier("cacheRefreshExecutor") Executor refreshExecutor,
                            Clock clock) {
        this.bankDataService = bankDataService;
        this.cache = new SwrCache<>(
            new CachePolicy("tx", properties.getCache().getTransactionsTtl(), properties.getCache().getStaleFraction()),
            TransactionList.class, store, objectMapper, session, refreshExecutor, clock);
    }

    public CachedValue<TransactionList> get(String connectionId, String accountId, boolean forceRefresh) {
        return cache.get(connectionId, accountId, forceRefresh,
            () -> bankDataService.getTransactions(connectionId, accountId, null, null));
    }

    @Override
    public void invalidate(String connectionId, String accountId) {
        cache.invalidate(connectionId, accountId);
    }

    @Override
    public void invalidateConnection(String connectionId) {
        cache.invalidateConnection(connectionId);
    }

    @Override
    public void purgeOwner(String userId) {
        cache.purgeOwner(userId);
    }

    @Override
    public int purgeExpired() {
        return cache.purgeExpired();
    }
}
