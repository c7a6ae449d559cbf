package com.banklink.broker;

import com.banklink.audit.SecurityAuditLogger;
import com.banklink.common.exception.ReplayDetectedException;
import com.banklink.config.BankLinkProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;

/**
 * One-time consumption of authorization codes on the broker side,
 * independent of the client's own replay guard.
 */
@Component
@RequiredArgsConstructor
public class CodeConsumptionGuard {

    private final ConsumedAuthorizationCodeRepository codeRepository;
    private final BankLinkProperties properties;
    private final Clock clock;

    /**
     * Record the code as consumed.
     *
     * @throws ReplayDetectedException if the code was consumed before and its marker has not expired
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void consume(String code, String callerId) {
        String codeHash = sha256(code);
        Instant now = clock.instant();

        var existing = codeRepository.findById(codeHash);
        if (existing.isPresent()) {
            if (existing.get().getExpiresAt().isAfter(now)) {
                throw new ReplayDetectedException("Code has already been used");
            }
            codeRepository.delete(existing.get());
            codeRepository.flush();
        }

        try {
            codeRepository.saveAndFlush(new ConsumedAuthorizationCode(
                codeHash,
                SecurityAuditLogger.hashUserId(callerId),
                now,
                now.plus(properties.getOauth().getUsedCodeTtl())));
        } catch (DataIntegrityViolationException e) {
            throw new ReplayDetectedException("Code has already been used");
        }
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
