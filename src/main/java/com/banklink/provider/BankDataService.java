package com.banklink.provider;

import com.banklink.common.exception.InvalidInputException;
import com.banklink.connections.ConnectionIds;
import com.banklink.oauth.TokenLifecycleManager;
import com.banklink.ratelimit.LocalRateLimiter;
import com.banklink.ratelimit.ProviderEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Reads financial data for a connection.
 *
 * Each call passes the local throttle, obtains a valid access token (refreshing
 * if needed) and then calls the provider. A rejected token revokes the
 * connection and surfaces as NeedsReconnect.
 */
@Service
@Slf4j
public class BankDataService {

    private static final Pattern RESOURCE_ID = Pattern.compile("^[A-Za-z0-9_-]{1,100}$");

    private final ProviderDataClient dataClient;
    private final TokenLifecycleManager tokenManager;
    private final LocalRateLimiter rateLimiter;
    private final TransactionMapper mapper;

    public BankDataService(ProviderDataClient dataClient,
                           TokenLifecycleManager tokenManager,
                           LocalRateLimiter rateLimiter,
                           TransactionMapper mapper) {
        this.dataClient = dataClient;
        this.tokenManager = tokenManager;
        this.rateLimiter = rateLimiter;
        this.mapper = mapper;
    }

    public List<ProviderDTOs.Account> listAccounts(String connectionId) {
        return call(connectionId, ProviderEndpoint.ACCOUNTS, dataClient::listAccounts);
    }

    public AccountBalance getBalance(String connectionId, String accountId) {
        requireResourceId(accountId);
        ProviderDTOs.Balance balance = call(connectionId, ProviderEndpoint.BALANCE,
            token -> dataClient.getBalance(token, accountId));
        return mapper.toBalance(balance, accountId);
    }

    /**
     * Confirmed transactions in the optional date range followed by pending ones.
     */
    public TransactionList getTransactions(String connectionId, String accountId, LocalDate from, LocalDate to) {
        requireResourceId(accountId);
        List<ProviderDTOs.Transaction> confirmed = call(connectionId, ProviderEndpoint.TRANSACTIONS,
            token -> dataClient.getTransactions(token, accountId, from, to));
        List<ProviderDTOs.Transaction> pending = call(connectionId, ProviderEndpoint.TRANSACTIONS,
            token -> dataClient.getPendingTransactions(token, accountId));

        List<BankTransaction> mapped = new ArrayList<>(confirmed.size() + pending.size());
        confirmed.forEach(t -> mapped.add(mapper.toTransaction(t, accountId, false)));
        pending.forEach(t -> mapped.add(mapper.toTransaction(t, accountId, true)));

        log.debug("Fetched {} confirmed and {} pending transactions", confirmed.size(), pending.size());
        return TransactionList.builder()
            .accountId(accountId)
            .transactions(mapped)
            .build();
    }

    public List<ProviderDTOs.Card> listCards(String connectionId) {
        return call(connectionId, ProviderEndpoint.CARDS, dataClient::listCards);
    }

    public AccountBalance getCardBalance(String connectionId, String cardId) {
        requireResourceId(cardId);
        ProviderDTOs.Balance balance = call(connectionId, ProviderEndpoint.CARDS,
            token -> dataClient.getCardBalance(token, cardId));
        return mapper.toBalance(balance, cardId);
    }

    public TransactionList getCardTransactions(String connectionId, String cardId, LocalDate from, LocalDate to) {
        requireResourceId(cardId);
        List<ProviderDTOs.Transaction> transactions = call(connectionId, ProviderEndpoint.CARDS,
            token -> dataClient.getCardTransactions(token, cardId, from, to));
        return TransactionList.builder()
            .accountId(cardId)
            .transactions(transactions.stream()
                .map(t -> mapper.toTransaction(t, cardId, false))
                .toList())
            .build();
    }

    private <T> T call(String connectionId, ProviderEndpoint endpoint, Function<String, T> request) {
        if (!ConnectionIds.isValid(connectionId)) {
            throw new InvalidInputException("Invalid connection id format");
        }
        rateLimiter.acquire(endpoint);
        String accessToken = tokenManager.getValidAccessToken(connectionId);
        try {
            return request.apply(accessToken);
        } catch (ProviderUnauthorizedException e) {
            log.warn("Provider rejected token for {} on {}", ConnectionIds.shorten(connectionId), endpoint);
            throw tokenManager.markRevoked(connectionId);
        }
    }

    private static void requireResourceId(String id) {
        if (id == null || !RESOURCE_ID.matcher(id).matches()) {
            throw new InvalidInputException("Invalid account id format");
        }
    }
}
