package com.banklink.session;

import com.banklink.common.exception.InvalidInputException;
import com.banklink.common.exception.UnauthenticatedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionContextTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SessionContext session;

    @BeforeEach
    void setUp() {
        session = new SessionContext(eventPublisher);
    }

    @Test
    void testClosedByDefault() {
        assertEquals(SessionState.CLOSED, session.getState());
        assertTrue(session.currentUserId().isEmpty());
        assertThrows(UnauthenticatedException.class, session::requireUserId);
    }

    @Test
    void testOpenThenClose_PublishesClosedEvent() {
        session.open("user-1");
        assertEquals("user-1", session.requireUserId());

        session.close();

        ArgumentCaptor<SessionClosedEvent> event = ArgumentCaptor.forClass(SessionClosedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals("user-1", event.getValue().getUserId());
        assertEquals(SessionState.CLOSED, session.getState());
    }

    @Test
    void testSwitchUser_ClosesPreviousFirst() {
        session.open("user-1");
        session.open("user-2");

        ArgumentCaptor<SessionClosedEvent> event = ArgumentCaptor.forClass(SessionClosedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals("user-1", event.getValue().getUserId());
        assertEquals("user-2", session.requireUserId());
    }

    @Test
    void testReopenSameUser_NoEvent() {
        session.open("user-1");
        session.open("user-1");

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void testClose_Idempotent() {
        session.close();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void testOpen_BlankUserRejected() {
        assertThrows(InvalidInputException.class, () -> session.open(" "));
    }
}
