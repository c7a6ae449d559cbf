package com.banklink.ratelimit;

import com.banklink.audit.SecurityAuditLogger;
import com.banklink.common.exception.RateLimitedException;
import com.banklink.common.exception.TransientProviderException;
import com.banklink.config.BankLinkProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Server-side per-caller throttle for the token broker.
 *
 * Each check reads the caller's counter row under a pessimistic write lock
 * and updates it in the same transaction, so concurrent requests from one
 * caller cannot both take the last slot. Attempts count whether or not the
 * provider call later succeeds.
 */
@Component
@Slf4j
public class BrokerRateLimiter {

    private final RateLimitCounterRepository counterRepository;
    private final BankLinkProperties properties;
    private final Clock clock;

    public BrokerRateLimiter(RateLimitCounterRepository counterRepository,
                             BankLinkProperties properties, Clock clock) {
        this.counterRepository = counterRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws RateLimitedException if the caller's window for the operation is full
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, noRollbackFor = RateLimitedException.class)
    public void acquire(BrokerOperation operation, String callerId) {
        Instant now = clock.instant();
        Duration window = properties.getRateLimits().getBrokerWindow();
        int limit = limitFor(operation);
        String bucketKey = operation.name() + ":" + SecurityAuditLogger.hashUserId(callerId);

        Optional<RateLimitCounter> locked = counterRepository.findForUpdate(bucketKey);
        RateLimitCounter row;
        if (locked.isPresent()) {
            row = locked.get();
        } else {
            row = insertOrLock(bucketKey, now, window);
        }

        FixedWindowCounter current = row.toWindow().rollIfExpired(now, window);
        if (!current.hasCapacity(limit)) {
            row.apply(current);
            log.warn("Broker rate limit reached for {} by caller {}", operation, SecurityAuditLogger.hashUserId(callerId));
            throw new RateLimitedException(operation.name().toLowerCase(), limit, current.secondsUntilReset(now));
        }
        row.apply(current.increment());
        counterRepository.save(row);
    }

    private RateLimitCounter insertOrLock(String bucketKey, Instant now, Duration window) {
        try {
            return counterRepository.saveAndFlush(new RateLimitCounter(bucketKey, FixedWindowCounter.open(now, window)));
        } catch (DataIntegrityViolationException e) {
            // Another request created the row first; this transaction cannot continue.
            throw new TransientProviderException("Concurrent rate limit update, retry the request", e);
        }
    }

    int limitFor(BrokerOperation operation) {
        return switch (operation) {
            case EXCHANGE -> properties.getRateLimits().getExchangePerWindow();
            case REFRESH -> properties.getRateLimits().getRefreshPerWindow();
        };
    }
}
