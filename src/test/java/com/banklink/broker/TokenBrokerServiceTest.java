package com.banklink.broker;

import com.banklink.audit.AuditFailureReason;
import com.banklink.audit.SecurityAuditLogger;
import com.banklink.audit.SecurityEventType;
import com.banklink.common.exception.AuthorizationDeniedException;
import com.banklink.common.exception.BrokerConfigurationException;
import com.banklink.common.exception.InvalidInputException;
import com.banklink.common.exception.NeedsReconnectException;
import com.banklink.common.exception.RateLimitedException;
import com.banklink.common.exception.ReplayDetectedException;
import com.banklink.common.exception.TransientProviderException;
import com.banklink.common.exception.UnauthenticatedException;
import com.banklink.config.BankLinkProperties;
import com.banklink.connections.ConnectionIds;
import com.banklink.ratelimit.BrokerOperation;
import com.banklink.ratelimit.BrokerRateLimiter;
import com.banklink.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenBrokerServiceTest {

    private static final String CALLER = "user-1";
    private static final String CODE = "auth_code_0123456789abcdef";
    private static final String STATE = "state_0123456789abcdefghij";
    private static final String REFRESH_TOKEN = "refresh_token_0123456789";
    private static final String CONNECTION_ID = "tl_1709287200000_abc123xyz";

    @Mock
    private ProviderTokenClient providerTokenClient;

    @Mock
    private BrokerRateLimiter rateLimiter;

    @Mock
    private CodeConsumptionGuard codeGuard;

    @Mock
    private SecurityAuditLogger auditLogger;

    private BankLinkProperties properties;
    private TokenBrokerService brokerService;

    @BeforeEach
    void setUp() {
        properties = new BankLinkProperties();
        properties.getProvider().setClientId("client-123");
        properties.getBroker().setClientSecret("secret-456");
        brokerService = new TokenBrokerService(providerTokenClient, rateLimiter, codeGuard, auditLogger,
            properties, new SecureRandom(), MutableClock.startingAt("2024-03-01T10:00:00Z"));
    }

    private static ProviderTokenResponse tokens(Long expiresIn) {
        ProviderTokenResponse response = new ProviderTokenResponse();
        response.setAccessToken("access-1");
        response.setRefreshToken("refresh-1");
        response.setExpiresIn(expiresIn);
        return response;
    }

    private ExchangeTokenRequest exchangeRequest() {
        return new ExchangeTokenRequest(CODE, "banklink://oauth-callback", STATE);
    }

    @Test
    void testExchange_Success_GeneratesConnectionId() {
        when(providerTokenClient.exchangeCode(CODE, "banklink://oauth-callback")).thenReturn(tokens(3600L));

        ExchangeTokenResponse response = brokerService.exchange(CALLER, exchangeRequest());

        assertTrue(ConnectionIds.isValid(response.getConnectionId()));
        assertTrue(response.getConnectionId().startsWith("tl_1709287200000_"));
        assertEquals("access-1", response.getAccessToken());
        assertEquals(3600, response.getExpiresIn());
        verify(auditLogger).success(SecurityEventType.TOKEN_EXCHANGE_SUCCESS, CALLER);
    }

    @Test
    void testExchange_MissingExpiry_DefaultsToOneHour() {
        when(providerTokenClient.exchangeCode(anyString(), anyString())).thenReturn(tokens(null));

        assertEquals(3600, brokerService.exchange(CALLER, exchangeRequest()).getExpiresIn());
    }

    @Test
    void testExchange_NoCaller_Unauthenticated() {
        assertThrows(UnauthenticatedException.class, () -> brokerService.exchange(" ", exchangeRequest()));

        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, null, AuditFailureReason.UNAUTHORIZED);
        verifyNoInteractions(rateLimiter, codeGuard, providerTokenClient);
    }

    @Test
    void testExchange_InvalidInputs_RejectedBeforeRateLimit() {
        assertThrows(InvalidInputException.class,
            () -> brokerService.exchange(CALLER, new ExchangeTokenRequest(null, "banklink://x", STATE)));
        assertThrows(InvalidInputException.class,
            () -> brokerService.exchange(CALLER, new ExchangeTokenRequest("bad code", "banklink://x", STATE)));
        assertThrows(InvalidInputException.class,
            () -> brokerService.exchange(CALLER, new ExchangeTokenRequest(CODE, "https://evil.example", STATE)));
        assertThrows(InvalidInputException.class,
            () -> brokerService.exchange(CALLER, new ExchangeTokenRequest(CODE, "banklink://x", null)));
        assertThrows(InvalidInputException.class,
            () -> brokerService.exchange(CALLER, new ExchangeTokenRequest(CODE, "banklink://x", "short")));

        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, CALLER, AuditFailureReason.MISSING_PARAMETERS);
        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, CALLER, AuditFailureReason.INVALID_CODE_FORMAT);
        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, CALLER, AuditFailureReason.INVALID_REDIRECT_URI);
        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, CALLER, AuditFailureReason.MISSING_STATE);
        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, CALLER, AuditFailureReason.INVALID_STATE_FORMAT);
        verifyNoInteractions(rateLimiter, codeGuard, providerTokenClient);
    }

    @Test
    void testExchange_RateLimitCheckedBeforeCodeConsumed() {
        when(providerTokenClient.exchangeCode(anyString(), anyString())).thenReturn(tokens(3600L));

        brokerService.exchange(CALLER, exchangeRequest());

        InOrder order = inOrder(rateLimiter, codeGuard, providerTokenClient);
        order.verify(rateLimiter).acquire(BrokerOperation.EXCHANGE, CALLER);
        order.verify(codeGuard).consume(CODE, CALLER);
        order.verify(providerTokenClient).exchangeCode(CODE, "banklink://oauth-callback");
    }

    @Test
    void testExchange_RateLimited_CodeNotConsumed() {
        doThrow(new RateLimitedException("exchange", 5, 1200)).when(rateLimiter).acquire(BrokerOperation.EXCHANGE, CALLER);

        RateLimitedException e = assertThrows(RateLimitedException.class,
            () -> brokerService.exchange(CALLER, exchangeRequest()));

        assertEquals(1200, e.getRetryAfterSeconds());
        verifyNoInteractions(codeGuard, providerTokenClient);
        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, CALLER, AuditFailureReason.RATE_LIMIT_EXCEEDED);
    }

    @Test
    void testExchange_ReplayedCode_NoProviderCall() {
        doThrow(new ReplayDetectedException("used")).when(codeGuard).consume(CODE, CALLER);

        assertThrows(ReplayDetectedException.class, () -> brokerService.exchange(CALLER, exchangeRequest()));

        verifyNoInteractions(providerTokenClient);
        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_ATTEMPT, CALLER, AuditFailureReason.CODE_REPLAY);
    }

    @Test
    void testExchange_MissingSecret_ConfigurationError() {
        properties.getBroker().setClientSecret(null);

        assertThrows(BrokerConfigurationException.class, () -> brokerService.exchange(CALLER, exchangeRequest()));
        verifyNoInteractions(providerTokenClient);
    }

    @Test
    void testExchange_Provider4xx_IsDeniedWithProviderError() {
        when(providerTokenClient.exchangeCode(anyString(), anyString()))
            .thenThrow(new ProviderTokenException(400, "invalid_grant", null));

        AuthorizationDeniedException e = assertThrows(AuthorizationDeniedException.class,
            () -> brokerService.exchange(CALLER, exchangeRequest()));

        assertEquals("invalid_grant", e.getMessage());
        verify(auditLogger).failure(SecurityEventType.TOKEN_EXCHANGE_FAILURE, CALLER, AuditFailureReason.INVALID_REQUEST);
    }

    @Test
    void testExchange_Provider5xx_IsTransient() {
        when(providerTokenClient.exchangeCode(anyString(), anyString()))
            .thenThrow(new ProviderTokenException(503, null, null));

        assertThrows(TransientProviderException.class, () -> brokerService.exchange(CALLER, exchangeRequest()));
    }

    @Test
    void testExchange_ExpiryOutOfRange_IsTransient() {
        when(providerTokenClient.exchangeCode(anyString(), anyString())).thenReturn(tokens(86401L));

        assertThrows(TransientProviderException.class, () -> brokerService.exchange(CALLER, exchangeRequest()));
    }

    @Test
    void testRefresh_Success() {
        when(providerTokenClient.refresh(REFRESH_TOKEN)).thenReturn(tokens(1800L));

        RefreshTokenResponse response = brokerService.refresh(CALLER, new RefreshTokenRequest(REFRESH_TOKEN, CONNECTION_ID));

        assertEquals("access-1", response.getAccessToken());
        assertEquals("refresh-1", response.getRefreshToken());
        assertEquals(1800, response.getExpiresIn());
        verify(rateLimiter).acquire(BrokerOperation.REFRESH, CALLER);
    }

    @Test
    void testRefresh_InvalidInputs() {
        assertThrows(InvalidInputException.class,
            () -> brokerService.refresh(CALLER, new RefreshTokenRequest("short", CONNECTION_ID)));
        assertThrows(InvalidInputException.class,
            () -> brokerService.refresh(CALLER, new RefreshTokenRequest(REFRESH_TOKEN, "conn-1")));
        assertThrows(InvalidInputException.class,
            () -> brokerService.refresh(CALLER, new RefreshTokenRequest(REFRESH_TOKEN, null)));

        verify(rateLimiter, never()).acquire(any(), any());
    }

    @Test
    void testRefresh_GrantRejected_NeedsReconnect() {
        when(providerTokenClient.refresh(REFRESH_TOKEN)).thenThrow(new ProviderTokenException(400, "invalid_grant", null));

        NeedsReconnectException e = assertThrows(NeedsReconnectException.class,
            () -> brokerService.refresh(CALLER, new RefreshTokenRequest(REFRESH_TOKEN, CONNECTION_ID)));

        assertEquals(CONNECTION_ID, e.getConnectionId());
        verify(auditLogger).failure(eq(SecurityEventType.TOKEN_REFRESH_FAILURE), eq(CALLER), any());
    }

    @Test
    void testRefresh_NetworkFailure_IsTransient() {
        when(providerTokenClient.refresh(REFRESH_TOKEN)).thenThrow(new ProviderTokenException(0, null, null));

        assertThrows(TransientProviderException.class,
            () -> brokerService.refresh(CALLER, new RefreshTokenRequest(REFRESH_TOKEN, CONNECTION_ID)));
    }

    @Test
    void testRefresh_MissingExpiry_IsTransient() {
        when(providerTokenClient.refresh(REFRESH_TOKEN)).thenReturn(tokens(null));

        assertThrows(TransientProviderException.class,
            () -> brokerService.refresh(CALLER, new RefreshTokenRequest(REFRESH_TOKEN, CONNECTION_ID)));
    }

    @Test
    void testRedirectAllowList() {
        assertTrue(brokerService.isAllowedRedirect("banklink://oauth-callback"));
        assertTrue(brokerService.isAllowedRedirect("com.banklink.app://oauth-callback"));
        assertFalse(brokerService.isAllowedRedirect("https://banklink.example"));
        assertFalse(brokerService.isAllowedRedirect("banklinkx://oauth-callback"));
    }
}
