package com.banklink.storage;

import java.util.List;
import java.util.Optional;

/**
 * The platform's secure persistence primitive (keychain equivalent).
 *
 * Implementations must throw {@link com.banklink.common.exception.StorageUnavailableException}
 * when the primitive cannot be used. Callers never fall back to another store.
 */
public interface SecurePersistence {

    void write(String key, String value);

    Optional<String> read(String key);

    void delete(String key);

    /**
     * List stored keys that start with the given prefix.
     */
    List<String> keys(String prefix);

    /**
     * Health check for the primitive.
     *
     * @return true if reads and writes can currently be served
     */
    boolean isAvailable();
}
