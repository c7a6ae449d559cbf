package com.banklink.audit;

import com.banklink.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecurityAuditLoggerTest {

    @Mock
    private SecurityEventRepository eventRepository;

    private SecurityAuditLogger auditLogger;

    @BeforeEach
    void setUp() {
        auditLogger = new SecurityAuditLogger(eventRepository, MutableClock.startingAt("2024-03-01T10:00:00Z"));
    }

    @Test
    void testHashUserId_StableAndOpaque() {
        String hash = SecurityAuditLogger.hashUserId("alice@example.com");

        assertEquals(16, hash.length());
        assertEquals(hash, SecurityAuditLogger.hashUserId("alice@example.com"));
        assertNotEquals(hash, SecurityAuditLogger.hashUserId("bob@example.com"));
        assertFalse(hash.contains("alice"));
        assertEquals("anonymous", SecurityAuditLogger.hashUserId(null));
    }

    @Test
    void testFailure_RecordsReasonAndHashedUser() {
        auditLogger.failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, "alice@example.com", AuditFailureReason.CODE_REPLAY);

        ArgumentCaptor<SecurityEvent> event = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(eventRepository).save(event.capture());
        assertEquals(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, event.getValue().getEventType());
        assertEquals(SecurityAuditLogger.hashUserId("alice@example.com"), event.getValue().getUserHash());
        assertFalse(event.getValue().isSuccess());
        assertEquals(AuditFailureReason.CODE_REPLAY, event.getValue().getFailureReason());
    }

    @Test
    void testPersistenceFailure_DoesNotPropagate() {
        when(eventRepository.save(any(SecurityEvent.class)))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        assertDoesNotThrow(() -> auditLogger.success(SecurityEventType.CONNECTION_CREATED, "alice@example.com"));
    }
}
