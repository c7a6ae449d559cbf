package com.banklink.session;

import com.banklink.common.exception.InvalidInputException;
import com.banklink.common.exception.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Explicit holder for the signed-in user.
 *
 * Every component that needs the current user asks this object instead of
 * reading process-wide state. Transitions:
 * CLOSED -> OPEN on open(), OPEN -> CLOSING -> CLOSED on close().
 */
@Component
@Slf4j
public class SessionContext {

    private final ApplicationEventPublisher eventPublisher;

    private SessionState state = SessionState.CLOSED;
    private String userId;

    public SessionContext(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * Open a session for the given user. An open session for a different
     * user is closed first so its cached data is purged.
     */
    public void open(String newUserId) {
        if (newUserId == null || newUserId.isBlank()) {
            throw new InvalidInputException("User id is required to open a session");
        }
        String previous;
        synchronized (this) {
            if (state == SessionState.OPEN && newUserId.equals(userId)) {
                return;
            }
            previous = state == SessionState.OPEN ? userId : null;
        }
        if (previous != null) {
            close();
        }
        synchronized (this) {
            if (state == SessionState.CLOSING) {
                throw new UnauthenticatedException("Session is closing");
            }
            this.userId = newUserId;
            this.state = SessionState.OPEN;
        }
        log.info("Session opened");
    }

    /**
     * Close the current session. Idempotent.
     */
    public void close() {
        String closingUser;
        synchronized (this) {
            if (state != SessionState.OPEN) {
                return;
            }
            state = SessionState.CLOSING;
            closingUser = userId;
        }
        try {
            eventPublisher.publishEvent(new SessionClosedEvent(closingUser));
        } finally {
            synchronized (this) {
                userId = null;
                state = SessionState.CLOSED;
            }
            log.info("Session closed");
        }
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized Optional<String> currentUserId() {
        return state == SessionState.OPEN ? Optional.of(userId) : Optional.empty();
    }

    public String requireUserId() {
        return currentUserId()
            .orElseThrow(() -> new UnauthenticatedException("No open session"));
    }
}
