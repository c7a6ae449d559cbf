package com.banklink.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Purges expired OAuth states, used-code markers and cache entries from the secure tier.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecureStoreMaintenanceJob {

    private final List<ExpiringRecords> recordFamilies;

    @Scheduled(fixedDelayString = "${bank-link.storage.cleanup-interval:PT1H}",
        initialDelayString = "${bank-link.storage.cleanup-interval:PT1H}")
    public void purgeExpired() {
        int removed = 0;
        for (ExpiringRecords family : recordFamilies) {
            removed += family.purgeExpired();
        }
        log.info("Secure store maintenance: removed {} expired records", removed);
    }
}
