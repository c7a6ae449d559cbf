package com.banklink.oauth;

import com.banklink.config.BankLinkProperties;
import com.banklink.storage.ExpiringRecords;
import com.banklink.storage.SecureCredentialStore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Client-side replay guard for authorization codes.
 *
 * Markers are persisted in the secure tier under the SHA-256 of the code,
 * so they survive restarts and the code itself is never stored.
 */
@Component
public class UsedCodeRegistry implements ExpiringRecords {

    static final String KEY_PREFIX = "used_code_";

    private final SecureCredentialStore secureStore;
    private final Clock clock;
    private final BankLinkProperties properties;

    public UsedCodeRegistry(SecureCredentialStore secureStore, Clock clock, BankLinkProperties properties) {
        this.secureStore = secureStore;
        this.clock = clock;
        this.properties = properties;
    }

    public boolean isUsed(String code) {
        String key = keyFor(code);
        Optional<UsedCodeMarker> marker = secureStore.getJson(key, UsedCodeMarker.class);
        if (marker.isEmpty()) {
            return false;
        }
        if (!clock.instant().isBefore(marker.get().getExpiresAt())) {
            secureStore.delete(key);
            return false;
        }
        return true;
    }

    public void markUsed(String code) {
        Instant now = clock.instant();
        secureStore.setJson(keyFor(code), UsedCodeMarker.builder()
            .usedAt(now)
            .expiresAt(now.plus(properties.getOauth().getUsedCodeTtl()))
            .build());
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (String key : secureStore.keys(KEY_PREFIX)) {
            Optional<UsedCodeMarker> marker = secureStore.getJson(key, UsedCodeMarker.class);
            if (marker.isEmpty() || marker.get().getExpiresAt() == null
                    || !now.isBefore(marker.get().getExpiresAt())) {
                secureStore.delete(key);
                removed++;
            }
        }
        return removed;
    }

    static String keyFor(String code) {
        return KEY_PREFIX + sha256(code);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Value
    @Builder
    @Jacksonized
    public static class UsedCodeMarker {
        Instant usedAt;
        Instant expiresAt;
    }
}
