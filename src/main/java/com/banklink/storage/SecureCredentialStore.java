package com.banklink.storage;

import com.banklink.audit.AuditFailureReason;
import com.banklink.audit.SecurityAuditLogger;
import com.banklink.audit.SecurityEventType;
import com.banklink.common.exception.StorageUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Encrypted key/value store for tokens, OAuth state, used-code markers and
 * cached financial data.
 *
 * Values are encrypted with the installation key before reaching
 * {@link SecurePersistence}. If the primitive is unavailable every operation
 * fails with {@link StorageUnavailableException}; nothing is written in clear.
 * A value that cannot be decrypted reads as absent so the caller re-authenticates
 * or refetches. Legacy plaintext JSON is returned as-is and re-encrypted in place.
 */
@Component
@Slf4j
public class SecureCredentialStore {

    private final SecurePersistence persistence;
    private final TokenCipher cipher;
    private final InstallationKeyProvider keyProvider;
    private final ObjectMapper objectMapper;
    private final SecurityAuditLogger auditLogger;

    public SecureCredentialStore(SecurePersistence persistence, TokenCipher cipher,
                                 InstallationKeyProvider keyProvider, ObjectMapper objectMapper,
                                 SecurityAuditLogger auditLogger) {
        this.persistence = persistence;
        this.cipher = cipher;
        this.keyProvider = keyProvider;
        this.objectMapper = objectMapper;
        this.auditLogger = auditLogger;
    }

    public void set(String key, String value) {
        validateKey(key);
        guarded(() -> {
            persistence.write(key, cipher.encrypt(value, key, keyProvider.currentKey()));
            return null;
        });
    }

    public Optional<String> get(String key) {
        validateKey(key);
        Optional<String> stored = guarded(() -> persistence.read(key));
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        String raw = stored.get();
        if (TokenCipher.isCiphertext(raw)) {
            try {
                return Optional.of(cipher.decrypt(raw, key, keyProvider.currentKey()));
            } catch (TokenCipher.DecryptionException e) {
                log.warn("Secure record {} could not be decrypted, treating as absent: {}", key, e.getMessage());
                auditLogger.failure(SecurityEventType.SECURE_STORAGE_ERROR, null, AuditFailureReason.DECRYPTION_FAILED);
                return Optional.empty();
            }
        }

        if (TokenCipher.isLegacyPlaintext(raw)) {
            log.info("Secure record {} is legacy plaintext, re-encrypting", key);
            set(key, raw);
            return Optional.of(raw);
        }

        log.warn("Secure record {} has an unrecognised format, treating as absent", key);
        return Optional.empty();
    }

    public void delete(String key) {
        validateKey(key);
        guarded(() -> {
            persistence.delete(key);
            return null;
        });
    }

    public List<String> keys(String prefix) {
        return guarded(() -> persistence.keys(prefix));
    }

    public <T> void setJson(String key, T value) {
        try {
            set(key, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for " + key + " is not serializable", e);
        }
    }

    public <T> Optional<T> getJson(String key, Class<T> type) {
        return get(key).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, type));
            } catch (JsonProcessingException e) {
                log.warn("Secure record {} is not a valid {}, treating as absent", key, type.getSimpleName());
                return Optional.empty();
            }
        });
    }

    private <T> T guarded(StorageCall<T> call) {
        try {
            return call.run();
        } catch (StorageUnavailableException e) {
            auditLogger.failure(SecurityEventType.SECURE_STORAGE_ERROR, null, AuditFailureReason.STORAGE_UNAVAILABLE);
            throw e;
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank() || key.length() > 255) {
            throw new IllegalArgumentException("Invalid secure storage key");
        }
        if (InstallationKeyProvider.KEY_RECORD.equals(key)) {
            throw new IllegalArgumentException("Reserved secure storage key");
        }
    }

    @FunctionalInterface
    private interface StorageCall<T> {
        T run();
    }
}
