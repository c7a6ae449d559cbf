package com.banklink.cache;

import com.banklink.config.BankLinkProperties;
import com.banklink.provider.AccountBalance;
import com.banklink.provider.BankDataService;
import com.banklink.session.SessionContext;
import com.banklink.storage.ExpiringRecords;
import com.banklink.storage.SecureCredentialStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Account balances, 30 minute TTL by default.
 */
@Component
public class BalanceCache implements OwnedCache, ExpiringRecords {

    private final SwrCache<AccountBalance> cache;
    private final BankDataService bankDataService;

    public BalanceCache(BankLinkProperties properties,
                        BankDataService bankDataService,
                        SecureCredentialStore store,
                        ObjectMapper objectMapper,
                        SessionContext session,
                        @Qualifier("cacheRefreshExecutor") Executor refreshExecutor,
                        Clock clock) {
        this.bankDataService = bankDataService;
        this.cache = new SwrCache<>(
            new CachePolicy("balance", properties.getCache().getBalanceTtl(), properties.getCache().getStaleFraction()),
            AccountBalance.class, store, objectMapper, session, refreshExecutor, clock);
    }

    public CachedValue<AccountBalance> get(String connectionId, String accountId, boolean forceRefresh) {
        return cache.get(connectionId, accountId, forceRefresh,
            () -> bankDataService.getBalance(connectionId, accountId));
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
