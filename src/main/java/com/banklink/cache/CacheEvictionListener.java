package com.banklink.cache;

import com.banklink.connections.ConnectionRemovedEvent;
import com.banklink.session.SessionClosedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drops cached data when a connection goes away or the user signs out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheEvictionListener {

    private final List<OwnedCache> caches;

    @EventListener
    public void onConnectionRemoved(ConnectionRemovedEvent event) {
        caches.forEach(cache -> cache.invalidateConnection(event.getConnectionId()));
    }

    @EventListener
    public void onSessionClosed(SessionClosedEvent event) {
        caches.forEach(cache -> cache.purgeOwner(event.getUserId()));
        log.info("Cached financial data purged on sign-out");
    }
}
