package com.banklink.oauth;

import com.banklink.audit.SecurityAuditLogger;
import com.banklink.common.exception.CsrfFailureException;
import com.banklink.config.BankLinkProperties;
import com.banklink.storage.SecureCredentialStore;
import com.banklink.support.InMemorySecurePersistence;
import com.banklink.support.MutableClock;
import com.banklink.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.SecureRandom;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class OAuthStateStoreTest {

    @Mock
    private SecurityAuditLogger auditLogger;

    private MutableClock clock;
    private InMemorySecurePersistence persistence;
    private OAuthStateStore stateStore;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        persistence = new InMemorySecurePersistence();
        SecureCredentialStore secureStore = TestStores.secureStore(persistence, auditLogger);
        stateStore = new OAuthStateStore(secureStore, new SecureRandom(), clock, new BankLinkProperties());
    }

    @Test
    void testIssue_ProducesUrlSafe256BitValue() {
        OAuthState state = stateStore.issue("user-1");

        // 32 bytes, base64url without padding
        assertEquals(43, state.getValue().length());
        assertTrue(state.getValue().matches("^[A-Za-z0-9_-]+$"));
        assertEquals(clock.instant().plus(Duration.ofMinutes(10)), state.getExpiresAt());
        assertTrue(stateStore.hasPending("user-1"));
    }

    @Test
    void testConsume_MatchingState_Succeeds() {
        OAuthState state = stateStore.issue("user-1");

        assertDoesNotThrow(() -> stateStore.consume("user-1", state.getValue()));
        assertFalse(stateStore.hasPending("user-1"));
    }

    @Test
    void testConsume_SameStateTwice_SecondFails() {
        OAuthState state = stateStore.issue("user-1");
        stateStore.consume("user-1", state.getValue());

        assertThrows(CsrfFailureException.class, () -> stateStore.consume("user-1", state.getValue()));
    }

    @Test
    void testConsume_Mismatch_FailsAndDiscardsPending() {
        OAuthState state = stateStore.issue("user-1");

        assertThrows(CsrfFailureException.class, () -> stateStore.consume("user-1", "forged"));
        // the genuine value is gone too
        assertThrows(CsrfFailureException.class, () -> stateStore.consume("user-1", state.getValue()));
    }

    @Test
    void testConsume_Expired_Fails() {
        OAuthState state = stateStore.issue("user-1");
        clock.advance(Duration.ofMinutes(10));

        assertFalse(stateStore.hasPending("user-1"));
        assertThrows(CsrfFailureException.class, () -> stateStore.consume("user-1", state.getValue()));
    }

    @Test
    void testIssue_ReplacesEarlierState() {
        OAuthState first = stateStore.issue("user-1");
        OAuthState second = stateStore.issue("user-1");

        assertNotEquals(first.getValue(), second.getValue());
        assertThrows(CsrfFailureException.class, () -> stateStore.consume("user-1", first.getValue()));
    }

    @Test
    void testConsume_OtherUsersState_Fails() {
        OAuthState state = stateStore.issue("user-1");

        assertThrows(CsrfFailureException.class, () -> stateStore.consume("user-2", state.getValue()));
        assertTrue(stateStore.hasPending("user-1"));
    }

    @Test
    void testConsume_NullState_Fails() {
        stateStore.issue("user-1");

        assertThrows(CsrfFailureException.class, () -> stateStore.consume("user-1", null));
    }

    @Test
    void testPurgeExpired_RemovesAbandonedStates() {
        stateStore.issue("user-1");
        clock.advance(Duration.ofMinutes(8));
        stateStore.issue("user-2");
        clock.advance(Duration.ofMinutes(3));

        assertEquals(1, stateStore.purgeExpired());

        assertNull(persistence.raw(OAuthStateStore.KEY_PREFIX + "user-1"));
        assertTrue(stateStore.hasPending("user-2"));
    }
}
