package com.banklink.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for values in the secure tier.
 *
 * Format: "v1:" + Base64(IV (12 bytes) + ciphertext + tag (16 bytes)).
 * The record key is bound as associated data, so a ciphertext copied under
 * another key fails authentication.
 */
@Component
public class TokenCipher {

    static final String PREFIX = "v1:";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final ObjectMapper JSON = new ObjectMapper();

    private final SecureRandom secureRandom;

    public TokenCipher(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String encrypt(String plaintext, String recordKey, SecretKey key) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(recordKey.getBytes(StandardCharsets.UTF_8));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);
            return PREFIX + Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws DecryptionException if the value is malformed, was written under
     *                             another key, or was tampered with
     */
    public String decrypt(String stored, String recordKey, SecretKey key) {
        if (!isCiphertext(stored)) {
            throw new DecryptionException("Value is not in ciphertext format");
        }
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(stored.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext is not valid Base64", e);
        }
        if (combined.length < IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new DecryptionException("Ciphertext too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, combined, 0, IV_LENGTH));
            cipher.updateAAD(recordKey.getBytes(StandardCharsets.UTF_8));
            byte[] plaintext = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-GCM decryption failed", e);
        }
    }

    public static boolean isCiphertext(String stored) {
        return stored != null && stored.startsWith(PREFIX);
    }

    /**
     * Values written before encryption was introduced are bare JSON documents.
     */
    public static boolean isLegacyPlaintext(String stored) {
        if (stored == null) {
            return false;
        }
        String trimmed = stored.strip();
        boolean bracketed = (trimmed.startsWith("{") && trimmed.endsWith("}"))
            || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (!bracketed) {
            return false;
        }
        try {
            JSON.readTree(trimmed);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    public static class DecryptionException extends RuntimeException {
        public DecryptionException(String message) {
            super(message);
        }

        public DecryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
