package com.banklink.ratelimit;

import com.banklink.common.exception.RateLimitedException;
import com.banklink.config.BankLinkProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client-side throttle per provider endpoint. Fails fast before any network call.
 */
@Component
@Slf4j
public class LocalRateLimiter {

    private final BankLinkProperties properties;
    private final Clock clock;
    private final Map<ProviderEndpoint, FixedWindowCounter> counters = new ConcurrentHashMap<>();

    public LocalRateLimiter(BankLinkProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Count one request against the endpoint's window.
     *
     * @throws RateLimitedException if the window is already full
     */
    public void acquire(ProviderEndpoint endpoint) {
        Instant now = clock.instant();
        Duration window = properties.getRateLimits().getLocalWindow();
        int limit = limitFor(endpoint);
        boolean[] allowed = new boolean[1];

        FixedWindowCounter counter = counters.compute(endpoint, (key, existing) -> {
            FixedWindowCounter current = existing == null
                ? FixedWindowCounter.open(now, window)
                : existing.rollIfExpired(now, window);
            if (current.hasCapacity(limit)) {
                allowed[0] = true;
                return current.increment();
            }
            return current;
        });

        if (!allowed[0]) {
            log.warn("Local rate limit reached for {}", endpoint);
            throw new RateLimitedException(endpoint.name(), limit, counter.secondsUntilReset(now));
        }
    }

    int limitFor(ProviderEndpoint endpoint) {
        BankLinkProperties.RateLimits limits = properties.getRateLimits();
        return switch (endpoint) {
            case ACCOUNTS -> limits.getAccountsPerWindow();
            case BALANCE -> limits.getBalancePerWindow();
            case TRANSACTIONS -> limits.getTransactionsPerWindow();
            case CARDS -> limits.getCardsPerWindow();
        };
    }
}
