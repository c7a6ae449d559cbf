package com.banklink.connections;

import com.banklink.storage.NonSensitiveStore;
import com.banklink.storage.SecureCredentialStore;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persists connections. Tokens live in the secure tier; only the list of
 * known ids goes to the non-sensitive tier.
 */
@Component
@Slf4j
public class ConnectionStore {

    static final String TOKEN_KEY_PREFIX = "connection_tokens_";
    static final String IDS_KEY = "connection_ids";

    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };

    private final SecureCredentialStore secureStore;
    private final NonSensitiveStore plainStore;
    private final Object idListLock = new Object();

    public ConnectionStore(SecureCredentialStore secureStore, NonSensitiveStore plainStore) {
        this.secureStore = secureStore;
        this.plainStore = plainStore;
    }

    public void save(Connection connection) {
        secureStore.setJson(TOKEN_KEY_PREFIX + connection.getConnectionId(), connection);
        synchronized (idListLock) {
            Set<String> ids = new LinkedHashSet<>(ids());
            if (ids.add(connection.getConnectionId())) {
                plainStore.setJson(IDS_KEY, new ArrayList<>(ids));
            }
        }
    }

    public Optional<Connection> find(String connectionId) {
        return secureStore.getJson(TOKEN_KEY_PREFIX + connectionId, Connection.class);
    }

    public void delete(String connectionId) {
        secureStore.delete(TOKEN_KEY_PREFIX + connectionId);
        synchronized (idListLock) {
            List<String> ids = new ArrayList<>(ids());
            if (ids.remove(connectionId)) {
                plainStore.setJson(IDS_KEY, ids);
            }
        }
        log.info("Connection {} removed from storage", ConnectionIds.shorten(connectionId));
    }

    public List<String> ids() {
        return plainStore.getJson(IDS_KEY, ID_LIST).orElseGet(List::of);
    }

    /**
     * All readable connections. Ids whose token record is missing or can no
     * longer be decrypted are skipped.
     */
    public List<Connection> findAll() {
        List<Connection> connections = new ArrayList<>();
        for (String id : ids()) {
            Optional<Connection> connection = find(id);
            if (connection.isPresent()) {
                connections.add(connection.get());
            } else {
                log.warn("Connection {} has no readable token record, skipping", ConnectionIds.shorten(id));
            }
        }
        return connections;
    }

    public List<Connection> findAllOwnedBy(String userId) {
        return findAll().stream()
            .filter(c -> c.isOwnedBy(userId))
            .toList();
    }
}
