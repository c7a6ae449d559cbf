package com.banklink.sync;

import com.banklink.accounts.LinkedAccount;
import com.banklink.accounts.LinkedAccountService;
import com.banklink.cache.AccountBalanceService;
import com.banklink.cache.TransactionCache;
import com.banklink.common.exception.ErrorCategory;
import com.banklink.common.exception.NeedsReconnectException;
import com.banklink.common.exception.RateLimitedException;
import com.banklink.common.exception.TransientProviderException;
import com.banklink.config.BankLinkProperties;
import com.banklink.connections.Connection;
import com.banklink.connections.ConnectionStore;
import com.banklink.session.SessionClosedEvent;
import com.banklink.session.SessionContext;
import com.banklink.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncOrchestratorTest {

    private static final String USER = "user-1";
    private static final String CONNECTION_A = "tl_1709287200000_aaaaaaaaa";
    private static final String CONNECTION_B = "tl_1709287200000_bbbbbbbbb";

    @Mock
    private ConnectionStore connectionStore;

    @Mock
    private LinkedAccountService accountService;

    @Mock
    private TransactionCache transactionCache;

    @Mock
    private AccountBalanceService balanceService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private BankLinkProperties properties;
    private SessionContext session;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        properties = new BankLinkProperties();
        session = new SessionContext(eventPublisher);
        session.open(USER);
        orchestrator = new SyncOrchestrator(connectionStore, accountService, transactionCache,
            balanceService, session, properties, clock);
    }

    private Connection connection(String id) {
        return Connection.builder()
            .connectionId(id)
            .ownerUserId(USER)
            .accessToken("a")
            .refreshToken("r")
            .expiresAt(clock.instant().plus(Duration.ofHours(1)))
            .createdAt(clock.instant())
            .build();
    }

    private static LinkedAccount account(String connectionId, String accountId) {
        return new LinkedAccount(USER, connectionId, accountId);
    }

    @Test
    void testPerformSync_NoSession_Skipped() {
        session.close();

        SyncReport report = orchestrator.performSync(true);

        assertEquals(SyncOutcome.SKIPPED_NO_SESSION, report.getOutcome());
        verifyNoInteractions(connectionStore);
    }

    @Test
    void testPerformSync_NoConnections() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of());

        SyncReport report = orchestrator.performSync(false);

        assertEquals(SyncOutcome.NO_CONNECTIONS, report.getOutcome());
        assertNull(orchestrator.status().getLastSyncAt());
    }

    @Test
    void testPerformSync_SyncsAccountsThenTransactionsThenBalances() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A)));
        List<LinkedAccount> accounts = List.of(account(CONNECTION_A, "acc-1"), account(CONNECTION_A, "acc-2"));
        when(accountService.refreshAccounts(CONNECTION_A)).thenReturn(accounts);
        when(balanceService.balancesFor(accounts, true)).thenReturn(List.of(
            new AccountBalanceService.AccountWithBalance(accounts.get(0), null, "GBP", null),
            new AccountBalanceService.AccountWithBalance(accounts.get(1), null, "GBP", null)));

        SyncReport report = orchestrator.performSync(false);

        assertEquals(SyncOutcome.COMPLETED, report.getOutcome());
        assertEquals(1, report.getConnections().size());
        ConnectionSyncResult result = report.getConnections().get(0);
        assertTrue(result.isSuccess());
        assertEquals(2, result.getAccounts());
        assertEquals(0, result.getAccountsWithErrors());
        verify(transactionCache).get(CONNECTION_A, "acc-1", true);
        verify(transactionCache).get(CONNECTION_A, "acc-2", true);
        assertEquals(clock.instant(), orchestrator.status().getLastSyncAt());
        assertSame(report, orchestrator.status().getLastReport());
        assertEquals(SyncState.IDLE, orchestrator.status().getState());
    }

    @Test
    void testPerformSync_OneConnectionFails_OthersContinue() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A), connection(CONNECTION_B)));
        when(accountService.refreshAccounts(CONNECTION_A)).thenThrow(new TransientProviderException("down"));
        List<LinkedAccount> accounts = List.of(account(CONNECTION_B, "acc-1"));
        when(accountService.refreshAccounts(CONNECTION_B)).thenReturn(accounts);
        when(balanceService.balancesFor(accounts, true)).thenReturn(List.of());

        SyncReport report = orchestrator.performSync(false);

        assertEquals(SyncOutcome.COMPLETED, report.getOutcome());
        assertEquals(ErrorCategory.TRANSIENT, report.getConnections().get(0).getFailure());
        ConnectionSyncResult second = report.getConnections().get(1);
        assertTrue(second.isSuccess());
        assertEquals(1, second.getAccountsWithErrors());
    }

    @Test
    void testPerformSync_AccountTransactionErrorCounted() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A)));
        List<LinkedAccount> accounts = List.of(account(CONNECTION_A, "acc-1"), account(CONNECTION_A, "acc-2"));
        when(accountService.refreshAccounts(CONNECTION_A)).thenReturn(accounts);
        when(transactionCache.get(CONNECTION_A, "acc-1", true)).thenThrow(new RateLimitedException("TRANSACTIONS", 20, 30));
        when(balanceService.balancesFor(accounts, true)).thenReturn(List.of(
            new AccountBalanceService.AccountWithBalance(accounts.get(0), null, "GBP", null),
            new AccountBalanceService.AccountWithBalance(accounts.get(1), null, "GBP", null)));

        ConnectionSyncResult result = orchestrator.performSync(false).getConnections().get(0);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getAccountsWithErrors());
        verify(transactionCache).get(CONNECTION_A, "acc-2", true);
    }

    @Test
    void testPerformSync_NeedsReconnectFailsConnection() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A)));
        when(accountService.refreshAccounts(CONNECTION_A)).thenReturn(List.of(account(CONNECTION_A, "acc-1")));
        when(transactionCache.get(CONNECTION_A, "acc-1", true))
            .thenThrow(new NeedsReconnectException(CONNECTION_A, "revoked"));

        ConnectionSyncResult result = orchestrator.performSync(false).getConnections().get(0);

        assertEquals(ErrorCategory.NEEDS_RECONNECT, result.getFailure());
        verify(balanceService, never()).balancesFor(anyList(), anyBoolean());
    }

    @Test
    void testPerformSync_TooSoon_UnlessForced() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A)));
        when(accountService.refreshAccounts(CONNECTION_A)).thenReturn(List.of());
        when(balanceService.balancesFor(List.of(), true)).thenReturn(List.of());

        orchestrator.performSync(false);
        clock.advance(Duration.ofMinutes(59));

        assertEquals(SyncOutcome.SKIPPED_TOO_SOON, orchestrator.performSync(false).getOutcome());
        assertEquals(SyncOutcome.COMPLETED, orchestrator.performSync(true).getOutcome());

        clock.advance(Duration.ofHours(1));
        assertEquals(SyncOutcome.COMPLETED, orchestrator.performSync(false).getOutcome());
        verify(accountService, times(3)).refreshAccounts(CONNECTION_A);
    }

    @Test
    void testPerformSync_WhileRunning_Skipped() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A)));
        AtomicReference<SyncReport> nested = new AtomicReference<>();
        when(accountService.refreshAccounts(CONNECTION_A)).thenAnswer(inv -> {
            assertEquals(SyncState.RUNNING, orchestrator.status().getState());
            nested.set(orchestrator.performSync(true));
            return List.of();
        });
        when(balanceService.balancesFor(List.of(), true)).thenReturn(List.of());

        SyncReport outer = orchestrator.performSync(true);

        assertEquals(SyncOutcome.COMPLETED, outer.getOutcome());
        assertEquals(SyncOutcome.SKIPPED_IN_PROGRESS, nested.get().getOutcome());
        verify(accountService, times(1)).refreshAccounts(anyString());
    }

    @Test
    void testSessionClosed_ResetsLastSync() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A)));
        when(accountService.refreshAccounts(CONNECTION_A)).thenReturn(List.of());
        when(balanceService.balancesFor(List.of(), true)).thenReturn(List.of());
        orchestrator.performSync(false);

        orchestrator.onSessionClosed(new SessionClosedEvent(USER));

        assertNull(orchestrator.status().getLastSyncAt());
        assertNull(orchestrator.status().getLastReport());
    }

    @Test
    void testTimer_DisabledDoesNothing() {
        properties.getSync().setEnabled(false);

        orchestrator.onTimer();

        verifyNoInteractions(connectionStore);
    }

    @Test
    void testAppForeground_RespectsMinInterval() {
        when(connectionStore.findAllOwnedBy(USER)).thenReturn(List.of(connection(CONNECTION_A)));
        when(accountService.refreshAccounts(eq(CONNECTION_A))).thenReturn(List.of());
        when(balanceService.balancesFor(List.of(), true)).thenReturn(List.of());

        orchestrator.onAppForeground(new AppForegroundEvent(Instant.now()));
        orchestrator.onAppForeground(new AppForegroundEvent(Instant.now()));

        verify(accountService, times(1)).refreshAccounts(CONNECTION_A);
    }
}
