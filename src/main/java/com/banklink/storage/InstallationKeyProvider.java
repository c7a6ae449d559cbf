package com.banklink.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Per-installation AES-256 key.
 *
 * Generated once and kept in the secure persistence primitive. If the stored
 * key is lost a new one is generated, which makes every existing ciphertext
 * unreadable; readers treat that as "absent".
 */
@Component
@Slf4j
public class InstallationKeyProvider {

    static final String KEY_RECORD = "installation_key";
    private static final int KEY_BYTES = 32;

    private final SecurePersistence persistence;
    private final SecureRandom secureRandom;

    private volatile SecretKey cachedKey;

    public InstallationKeyProvider(SecurePersistence persistence, SecureRandom secureRandom) {
        this.persistence = persistence;
        this.secureRandom = secureRandom;
    }

    public SecretKey currentKey() {
        SecretKey key = cachedKey;
        if (key != null) {
            return key;
        }
        synchronized (this) {
            if (cachedKey == null) {
                cachedKey = loadOrGenerate();
            }
            return cachedKey;
        }
    }

    /**
     * Replace the installation key. All previously written ciphertext becomes unreadable.
     */
    public synchronized void rotate() {
        cachedKey = generateAndStore();
        log.warn("Installation key rotated, existing encrypted records are no longer readable");
    }

    private SecretKey loadOrGenerate() {
        Optional<String> stored = persistence.read(KEY_RECORD);
        if (stored.isPresent()) {
            try {
                byte[] bytes = Base64.getDecoder().decode(stored.get());
                if (bytes.length == KEY_BYTES) {
                    return new SecretKeySpec(bytes, "AES");
                }
            } catch (IllegalArgumentException e) {
                log.warn("Stored installation key is not valid Base64");
            }
            log.warn("Stored installation key is unusable, generating a new one");
        }
        return generateAndStore();
    }

    private SecretKey generateAndStore() {
        byte[] bytes = new byte[KEY_BYTES];
        secureRandom.nextBytes(bytes);
        persistence.write(KEY_RECORD, Base64.getEncoder().encodeToString(bytes));
        log.info("Generated new installation key");
        return new SecretKeySpec(bytes, "AES");
    }
}
