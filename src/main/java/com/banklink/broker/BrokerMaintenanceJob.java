package com.banklink.broker;

import com.banklink.audit.SecurityEventRepository;
import com.banklink.config.BankLinkProperties;
import com.banklink.ratelimit.RateLimitCounterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Purges expired consumed-code markers, ended rate-limit windows and
 * audit events past their retention.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrokerMaintenanceJob {

    private final ConsumedAuthorizationCodeRepository codeRepository;
    private final RateLimitCounterRepository counterRepository;
    private final SecurityEventRepository eventRepository;
    private final BankLinkProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${bank-link.broker.cleanup-interval:PT1H}",
        initialDelayString = "${bank-link.broker.cleanup-interval:PT1H}")
    @Transactional
    public void purgeExpired() {
        Instant now = clock.instant();
        int codes = codeRepository.deleteExpired(now);
        int counters = counterRepository.deleteEndedBefore(now);
        int events = eventRepository.deleteOlderThan(now.minus(properties.getBroker().getAuditRetention()));
        log.info("Broker maintenance: removed {} code markers, {} rate windows, {} audit events",
            codes, counters, events);
    }
}
