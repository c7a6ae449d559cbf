package com.banklink.accounts;

import com.banklink.connections.ConnectionIds;
import com.banklink.connections.ConnectionRemovedEvent;
import com.banklink.provider.BankDataService;
import com.banklink.provider.ProviderDTOs;
import com.banklink.session.SessionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps the local list of linked accounts in step with the provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkedAccountService {

    private final LinkedAccountRepository accountRepository;
    private final BankDataService bankDataService;
    private final SessionContext session;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Fetch the connection's accounts and upsert them by provider account id.
     * Accounts the provider no longer returns are removed. The provider call
     * runs outside the write transaction.
     */
    public List<LinkedAccount> refreshAccounts(String connectionId) {
        String userId = session.requireUserId();
        List<ProviderDTOs.Account> remote = bankDataService.listAccounts(connectionId);
        return transactionTemplate.execute(status -> upsert(userId, connectionId, remote));
    }

    private List<LinkedAccount> upsert(String userId, String connectionId, List<ProviderDTOs.Account> remote) {
        Instant now = clock.instant();

        Map<String, LinkedAccount> existing = accountRepository.findByConnectionId(connectionId).stream()
            .collect(Collectors.toMap(LinkedAccount::getProviderAccountId, Function.identity()));
        Set<String> seen = new HashSet<>();

        for (ProviderDTOs.Account account : remote) {
            if (account.getAccountId() == null || !seen.add(account.getAccountId())) {
                continue;
            }
            LinkedAccount entity = existing.getOrDefault(account.getAccountId(),
                new LinkedAccount(userId, connectionId, account.getAccountId()));
            entity.setDisplayName(account.getDisplayName());
            entity.setAccountType(account.getAccountType());
            entity.setCurrency(account.getCurrency());
            entity.setProviderName(account.getProvider() != null ? account.getProvider().getDisplayName() : null);
            entity.setUpdatedAt(now);
            accountRepository.save(entity);
        }

        existing.values().stream()
            .filter(a -> !seen.contains(a.getProviderAccountId()))
            .forEach(accountRepository::delete);

        log.info("Refreshed {} accounts for connection {}", seen.size(), ConnectionIds.shorten(connectionId));
        return accountRepository.findByConnectionId(connectionId);
    }

    @Transactional(readOnly = true)
    public List<LinkedAccount> getAccounts() {
        return accountRepository.findByOwnerUserIdOrderByDisplayNameAsc(session.requireUserId());
    }

    @Transactional(readOnly = true)
    public List<LinkedAccount> getAccounts(String connectionId) {
        String userId = session.requireUserId();
        return accountRepository.findByConnectionId(connectionId).stream()
            .filter(a -> userId.equals(a.getOwnerUserId()))
            .toList();
    }

    @EventListener
    @Transactional
    public void onConnectionRemoved(ConnectionRemovedEvent event) {
        int removed = accountRepository.deleteByConnectionId(event.getConnectionId());
        log.info("Removed {} linked accounts of connection {}", removed, ConnectionIds.shorten(event.getConnectionId()));
    }
}
