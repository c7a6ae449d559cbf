package com.banklink.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Records security events for the OAuth flow, the broker and secure storage.
 *
 * Only the event type, a hashed user id, the outcome and an enum failure
 * reason are recorded. Persistence errors are logged and do not fail the
 * audited operation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecurityAuditLogger {

    static final String ANONYMOUS = "anonymous";

    private final SecurityEventRepository eventRepository;
    private final Clock clock;

    public void success(SecurityEventType eventType, String userId) {
        record(eventType, userId, true, null);
    }

    public void failure(SecurityEventType eventType, String userId, AuditFailureReason reason) {
        record(eventType, userId, false, reason);
    }

    private void record(SecurityEventType eventType, String userId, boolean success,
                        AuditFailureReason reason) {
        String userHash = hashUserId(userId);
        Instant now = clock.instant();

        log.info("[SecurityEvent] type={} user={} success={} reason={}",
            eventType, userHash, success, reason);

        try {
            eventRepository.save(new SecurityEvent(eventType, userHash, success, reason, now));
        } catch (DataAccessException e) {
            log.error("Failed to persist security event {}: {}", eventType, e.getMessage());
        }
    }

    public static String hashUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            return ANONYMOUS;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(userId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
