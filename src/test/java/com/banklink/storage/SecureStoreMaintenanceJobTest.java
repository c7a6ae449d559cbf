package com.banklink.storage;

import com.banklink.audit.SecurityAuditLogger;
import com.banklink.cache.CachePolicy;
import com.banklink.cache.SwrCache;
import com.banklink.config.BankLinkProperties;
import com.banklink.oauth.OAuthStateStore;
import com.banklink.oauth.UsedCodeRegistry;
import com.banklink.provider.AccountBalance;
import com.banklink.session.SessionContext;
import com.banklink.support.InMemorySecurePersistence;
import com.banklink.support.MutableClock;
import com.banklink.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class SecureStoreMaintenanceJobTest {

    private static final String CONNECTION_ID = "tl_1709287200000_abc123xyz";

    @Mock
    private SecurityAuditLogger auditLogger;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private InMemorySecurePersistence persistence;
    private OAuthStateStore stateStore;
    private UsedCodeRegistry usedCodes;
    private SwrCache<AccountBalance> balances;
    private SecureStoreMaintenanceJob job;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        persistence = new InMemorySecurePersistence();
        BankLinkProperties properties = new BankLinkProperties();
        SecureCredentialStore secureStore = TestStores.secureStore(persistence, auditLogger);
        SessionContext session = new SessionContext(eventPublisher);
        session.open("user-1");

        stateStore = new OAuthStateStore(secureStore, new SecureRandom(), clock, properties);
        usedCodes = new UsedCodeRegistry(secureStore, clock, properties);
        balances = new SwrCache<>(
            new CachePolicy("balance", Duration.ofMinutes(30), 0.5),
            AccountBalance.class, secureStore, TestStores.objectMapper(), session, Runnable::run, clock);
        job = new SecureStoreMaintenanceJob(List.<ExpiringRecords>of(stateStore, usedCodes, balances::purgeExpired));
    }

    @Test
    void testPurgeExpired_ClearsEveryFamilyPastTtl() {
        stateStore.issue("user-1");
        usedCodes.markUsed("auth_code_0123456789abcdef");
        balances.get(CONNECTION_ID, "acc-1", false, () -> AccountBalance.builder()
            .accountId("acc-1")
            .amount(new BigDecimal("10.00"))
            .currency("GBP")
            .build());
        int written = persistence.size();

        clock.advance(Duration.ofMinutes(5));
        job.purgeExpired();
        assertEquals(written, persistence.size());

        clock.advance(Duration.ofMinutes(30));
        job.purgeExpired();

        assertTrue(persistence.keys("oauth_state_").isEmpty());
        assertTrue(persistence.keys("used_code_").isEmpty());
        assertTrue(persistence.keys("balance_cache_").isEmpty());
    }
}
