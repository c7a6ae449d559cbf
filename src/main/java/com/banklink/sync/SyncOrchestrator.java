package com.banklink.sync;

import com.banklink.accounts.LinkedAccount;
import com.banklink.accounts.LinkedAccountService;
import com.banklink.cache.AccountBalanceService;
import com.banklink.cache.TransactionCache;
import com.banklink.common.exception.BankLinkException;
import com.banklink.common.exception.ErrorCategory;
import com.banklink.config.BankLinkProperties;
import com.banklink.connections.Connection;
import com.banklink.connections.ConnectionIds;
import com.banklink.connections.ConnectionStore;
import com.banklink.session.SessionClosedEvent;
import com.banklink.session.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives full syncs of every connection of the signed-in user: accounts,
 * then transactions, then balances.
 *
 * All triggers (timer, app foreground, manual) go through {@link #performSync},
 * which admits one run at a time.
 */
@Service
@Slf4j
public class SyncOrchestrator {

    private final ConnectionStore connectionStore;
    private final LinkedAccountService accountService;
    private final TransactionCache transactionCache;
    private final AccountBalanceService balanceService;
    private final SessionContext session;
    private final BankLinkProperties properties;
    private final Clock clock;

    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.IDLE);
    private volatile Instant lastSyncAt;
    private volatile SyncReport lastReport;

    public SyncOrchestrator(ConnectionStore connectionStore,
                            LinkedAccountService accountService,
                            TransactionCache transactionCache,
                            AccountBalanceService balanceService,
                            SessionContext session,
                            BankLinkProperties properties,
                            Clock clock) {
        this.connectionStore = connectionStore;
        this.accountService = accountService;
        this.transactionCache = transactionCache;
        this.balanceService = balanceService;
        this.session = session;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Sync all connections unless a sync is running or, when not forced,
     * one completed within the minimum interval.
     */
    public SyncReport performSync(boolean force) {
        Instant now = clock.instant();
        if (session.currentUserId().isEmpty()) {
            return SyncReport.skipped(SyncOutcome.SKIPPED_NO_SESSION, now);
        }
        if (!force && lastSyncAt != null
                && now.isBefore(lastSyncAt.plus(properties.getSync().getMinInterval()))) {
            log.debug("Last sync at {}, skipping", lastSyncAt);
            return SyncReport.skipped(SyncOutcome.SKIPPED_TOO_SOON, now);
        }
        if (!state.compareAndSet(SyncState.IDLE, SyncState.RUNNING)) {
            log.info("Sync already in progress, skipping");
            return SyncReport.skipped(SyncOutcome.SKIPPED_IN_PROGRESS, now);
        }

        try {
            String userId = session.requireUserId();
            List<Connection> connections = connectionStore.findAllOwnedBy(userId);
            if (connections.isEmpty()) {
                log.info("No connections to sync");
                return record(new SyncReport(SyncOutcome.NO_CONNECTIONS, now, clock.instant(), List.of()));
            }

            log.info("Starting sync of {} connection(s)", connections.size());
            List<ConnectionSyncResult> results = new ArrayList<>(connections.size());
            for (Connection connection : connections) {
                results.add(syncConnection(connection.getConnectionId()));
            }

            lastSyncAt = now;
            long failed = results.stream().filter(r -> !r.isSuccess()).count();
            log.info("Sync completed: {} connection(s), {} failed", results.size(), failed);
            return record(new SyncReport(SyncOutcome.COMPLETED, now, clock.instant(), results));
        } finally {
            state.set(SyncState.IDLE);
        }
    }

    public SyncStatus status() {
        return new SyncStatus(state.get(), lastSyncAt, lastReport);
    }

    @Scheduled(fixedDelayString = "${bank-link.sync.interval:PT6H}",
        initialDelayString = "${bank-link.sync.initial-delay:PT2S}")
    public void onTimer() {
        if (!properties.getSync().isEnabled()) {
            return;
        }
        performSync(false);
    }

    @EventListener
    public void onAppForeground(AppForegroundEvent event) {
        log.debug("App came to foreground, checking if sync is needed");
        performSync(false);
    }

    @EventListener
    public void onSessionClosed(SessionClosedEvent event) {
        lastSyncAt = null;
        lastReport = null;
    }

    private ConnectionSyncResult syncConnection(String connectionId) {
        try {
            List<LinkedAccount> accounts = accountService.refreshAccounts(connectionId);

            int accountErrors = 0;
            for (LinkedAccount account : accounts) {
                try {
                    transactionCache.get(connectionId, account.getProviderAccountId(), true);
                } catch (BankLinkException e) {
                    if (e.getCategory() == ErrorCategory.NEEDS_RECONNECT) {
                        throw e;
                    }
                    accountErrors++;
                    log.warn("Transactions for an account of {} failed: {}",
                        ConnectionIds.shorten(connectionId), e.getCategory());
                }
            }

            int withBalance = balanceService.balancesFor(accounts, true).size();
            accountErrors += accounts.size() - withBalance;

            log.info("Synced connection {}", ConnectionIds.shorten(connectionId));
            return new ConnectionSyncResult(connectionId, accounts.size(), accountErrors, null);
        } catch (BankLinkException e) {
            log.warn("Sync of connection {} failed: {}", ConnectionIds.shorten(connectionId), e.getCategory());
            return new ConnectionSyncResult(connectionId, 0, 0, e.getCategory());
        } catch (RuntimeException e) {
            log.error("Unexpected error syncing connection {}", ConnectionIds.shorten(connectionId), e);
            return new ConnectionSyncResult(connectionId, 0, 0, ErrorCategory.TRANSIENT);
        }
    }

    private SyncReport record(SyncReport report) {
        lastReport = report;
        return report;
    }
}
