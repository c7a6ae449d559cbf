package com.banklink.oauth;

import com.banklink.common.exception.CsrfFailureException;
import com.banklink.config.BankLinkProperties;
import com.banklink.storage.ExpiringRecords;
import com.banklink.storage.SecureCredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Issues and consumes the pending OAuth state for each user.
 *
 * A user has at most one pending state; issuing a new one replaces it.
 * {@link #consume} deletes the stored value whatever the outcome.
 */
@Component
@Slf4j
public class OAuthStateStore implements ExpiringRecords {

    static final String KEY_PREFIX = "oauth_state_";
    private static final int STATE_BYTES = 32;

    private final SecureCredentialStore secureStore;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final BankLinkProperties properties;

    public OAuthStateStore(SecureCredentialStore secureStore, SecureRandom secureRandom,
                           Clock clock, BankLinkProperties properties) {
        this.secureStore = secureStore;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.properties = properties;
    }

    public OAuthState issue(String userId) {
        byte[] bytes = new byte[STATE_BYTES];
        secureRandom.nextBytes(bytes);
        Instant now = clock.instant();
        OAuthState state = OAuthState.builder()
            .value(Base64.getUrlEncoder().withoutPadding().encodeToString(bytes))
            .createdAt(now)
            .expiresAt(now.plus(properties.getOauth().getStateTtl()))
            .build();
        secureStore.setJson(KEY_PREFIX + userId, state);
        return state;
    }

    /**
     * Validate the presented state against the pending one and delete it.
     *
     * @throws CsrfFailureException if nothing is pending, the pending value
     *                              expired, or the values differ
     */
    public void consume(String userId, String presented) {
        String key = KEY_PREFIX + userId;
        Optional<OAuthState> pending = secureStore.getJson(key, OAuthState.class);
        secureStore.delete(key);

        if (pending.isEmpty()) {
            throw new CsrfFailureException("No pending authorization for this callback");
        }
        if (pending.get().isExpiredAt(clock.instant())) {
            throw new CsrfFailureException("Authorization state expired");
        }
        if (presented == null || !MessageDigest.isEqual(
                pending.get().getValue().getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8))) {
            throw new CsrfFailureException("Authorization state mismatch");
        }
    }

    public void discard(String userId) {
        secureStore.delete(KEY_PREFIX + userId);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (String key : secureStore.keys(KEY_PREFIX)) {
            Optional<OAuthState> state = secureStore.getJson(key, OAuthState.class);
            if (state.isEmpty() || state.get().getExpiresAt() == null || state.get().isExpiredAt(now)) {
                secureStore.delete(key);
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} expired authorization states", removed);
        }
        return removed;
    }

    public boolean hasPending(String userId) {
        return secureStore.getJson(KEY_PREFIX + userId, OAuthState.class)
            .filter(s -> !s.isExpiredAt(clock.instant()))
            .isPresent();
    }
}
