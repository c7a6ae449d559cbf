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
import com.banklink.oauth.AuthorizationCodes;
import com.banklink.ratelimit.BrokerOperation;
import com.banklink.ratelimit.BrokerRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Backend token broker: holds the client secret and performs the
 * code-for-token and refresh-token exchanges on behalf of authenticated callers.
 *
 * Every input is validated before the provider is contacted, each rejection
 * is audited with its reason, and no code, token or secret is ever logged.
 */
@Service
@Slf4j
public class TokenBrokerService {

    private static final Pattern REFRESH_TOKEN_FORMAT = Pattern.compile("^[A-Za-z0-9._-]+$");
    private static final int MIN_STATE_LENGTH = 20;
    private static final int MAX_STATE_LENGTH = 200;
    private static final int MIN_REFRESH_TOKEN_LENGTH = 20;
    private static final int MAX_REFRESH_TOKEN_LENGTH = 2000;
    private static final long MAX_EXPIRES_IN = 86400;
    private static final long DEFAULT_EXPIRES_IN = 3600;

    private final ProviderTokenClient providerTokenClient;
    private final BrokerRateLimiter rateLimiter;
    private final CodeConsumptionGuard codeGuard;
    private final SecurityAuditLogger auditLogger;
    private final BankLinkProperties properties;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public TokenBrokerService(ProviderTokenClient providerTokenClient,
                              BrokerRateLimiter rateLimiter,
                              CodeConsumptionGuard codeGuard,
                              SecurityAuditLogger auditLogger,
                              BankLinkProperties properties,
                              SecureRandom secureRandom,
                              Clock clock) {
        this.providerTokenClient = providerTokenClient;
        this.rateLimiter = rateLimiter;
        this.codeGuard = codeGuard;
        this.auditLogger = auditLogger;
        this.properties = properties;
        this.secureRandom = secureRandom;
        this.clock = clock;
    }

    public ExchangeTokenResponse exchange(String callerId, ExchangeTokenRequest request) {
        SecurityEventType attempt = SecurityEventType.TOKEN_EXCHANGE_ATTEMPT;

        if (callerId == null || callerId.isBlank()) {
            auditLogger.failure(attempt, null, AuditFailureReason.UNAUTHORIZED);
            throw new UnauthenticatedException("User must be authenticated");
        }
        if (isBlank(request.getCode()) || isBlank(request.getRedirectUri())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.MISSING_PARAMETERS);
            throw new InvalidInputException("Code and redirectUri are required");
        }
        if (!AuthorizationCodes.isValidFormat(request.getCode())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_CODE_FORMAT);
            throw new InvalidInputException("Invalid code format");
        }
        if (!isAllowedRedirect(request.getRedirectUri())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_REDIRECT_URI);
            throw new InvalidInputException("Invalid redirect URI");
        }
        if (isBlank(request.getState())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.MISSING_STATE);
            throw new InvalidInputException("State parameter is required");
        }
        if (request.getState().length() < MIN_STATE_LENGTH || request.getState().length() > MAX_STATE_LENGTH) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_STATE_FORMAT);
            throw new InvalidInputException("Invalid state parameter format");
        }
        acquire(BrokerOperation.EXCHANGE, callerId, attempt);
        try {
            codeGuard.consume(request.getCode(), callerId);
        } catch (ReplayDetectedException e) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.CODE_REPLAY);
            throw e;
        }
        requireConfiguration(callerId, attempt);

        ProviderTokenResponse tokens;
        try {
            tokens = providerTokenClient.exchangeCode(request.getCode(), request.getRedirectUri());
        } catch (ProviderTokenException e) {
            auditLogger.failure(SecurityEventType.TOKEN_EXCHANGE_FAILURE, callerId, reasonFor(e));
            if (e.getStatus() >= 400 && e.getStatus() < 500) {
                throw new AuthorizationDeniedException(e.getProviderError() != null
                    ? e.getProviderError()
                    : "Failed to exchange authorization code");
            }
            throw new TransientProviderException("Provider token endpoint unavailable", e);
        }

        if (tokens == null || isBlank(tokens.getAccessToken()) || isBlank(tokens.getRefreshToken())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_TOKEN_RESPONSE);
            throw new TransientProviderException("Invalid token response from provider");
        }
        long expiresIn = tokens.getExpiresIn() == null ? DEFAULT_EXPIRES_IN : tokens.getExpiresIn();
        if (expiresIn <= 0 || expiresIn > MAX_EXPIRES_IN) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_TOKEN_RESPONSE);
            throw new TransientProviderException("Invalid expiration time in token response");
        }

        String connectionId = ConnectionIds.generate(clock, secureRandom);
        auditLogger.success(SecurityEventType.TOKEN_EXCHANGE_SUCCESS, callerId);
        log.info("Token exchange succeeded, connection {}", ConnectionIds.shorten(connectionId));
        return new ExchangeTokenResponse(connectionId, tokens.getAccessToken(), tokens.getRefreshToken(), expiresIn);
    }

    public RefreshTokenResponse refresh(String callerId, RefreshTokenRequest request) {
        SecurityEventType attempt = SecurityEventType.TOKEN_REFRESH_ATTEMPT;

        if (callerId == null || callerId.isBlank()) {
            auditLogger.failure(attempt, null, AuditFailureReason.UNAUTHORIZED);
            throw new UnauthenticatedException("User must be authenticated");
        }
        if (isBlank(request.getRefreshToken()) || isBlank(request.getConnectionId())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.MISSING_PARAMETERS);
            throw new InvalidInputException("Refresh token and connectionId are required");
        }
        if (!isValidRefreshToken(request.getRefreshToken())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_REFRESH_TOKEN_FORMAT);
            throw new InvalidInputException("Invalid refresh token format");
        }
        if (!ConnectionIds.isValid(request.getConnectionId())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_CONNECTION_ID_FORMAT);
            throw new InvalidInputException("Invalid connection ID format");
        }
        acquire(BrokerOperation.REFRESH, callerId, attempt);
        requireConfiguration(callerId, attempt);

        ProviderTokenResponse tokens;
        try {
            tokens = providerTokenClient.refresh(request.getRefreshToken());
        } catch (ProviderTokenException e) {
            auditLogger.failure(SecurityEventType.TOKEN_REFRESH_FAILURE, callerId, reasonFor(e));
            if (e.isGrantRejected()) {
                throw new NeedsReconnectException(request.getConnectionId(),
                    "Refresh token rejected by provider", e);
            }
            throw new TransientProviderException("Provider token endpoint unavailable", e);
        }

        if (tokens == null || isBlank(tokens.getAccessToken()) || isBlank(tokens.getRefreshToken())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_TOKEN_RESPONSE);
            throw new TransientProviderException("Invalid token response from provider");
        }
        if (tokens.getExpiresIn() == null || tokens.getExpiresIn() <= 0 || tokens.getExpiresIn() > MAX_EXPIRES_IN) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.INVALID_TOKEN_RESPONSE);
            throw new TransientProviderException("Invalid expiration time in token response");
        }

        auditLogger.success(SecurityEventType.TOKEN_REFRESH_SUCCESS, callerId);
        log.info("Token refresh succeeded for connection {}", ConnectionIds.shorten(request.getConnectionId()));
        return new RefreshTokenResponse(tokens.getAccessToken(), tokens.getRefreshToken(), tokens.getExpiresIn());
    }

    private void acquire(BrokerOperation operation, String callerId, SecurityEventType attempt) {
        try {
            rateLimiter.acquire(operation, callerId);
        } catch (RateLimitedException e) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.RATE_LIMIT_EXCEEDED);
            throw e;
        }
    }

    private void requireConfiguration(String callerId, SecurityEventType attempt) {
        if (isBlank(properties.getProvider().getClientId()) || isBlank(properties.getBroker().getClientSecret())) {
            auditLogger.failure(attempt, callerId, AuditFailureReason.SERVER_CONFIG_ERROR);
            log.error("Token broker is missing the provider client id or secret");
            throw new BrokerConfigurationException("Server configuration error");
        }
    }

    boolean isAllowedRedirect(String redirectUri) {
        return properties.getOauth().getAllowedSchemes().stream()
            .anyMatch(scheme -> redirectUri.startsWith(scheme + "://"));
    }

    static boolean isValidRefreshToken(String refreshToken) {
        return refreshToken.length() >= MIN_REFRESH_TOKEN_LENGTH
            && refreshToken.length() <= MAX_REFRESH_TOKEN_LENGTH
            && REFRESH_TOKEN_FORMAT.matcher(refreshToken).matches();
    }

    private static AuditFailureReason reasonFor(ProviderTokenException e) {
        return switch (e.getStatus()) {
            case 400 -> AuditFailureReason.INVALID_REQUEST;
            case 401 -> AuditFailureReason.UNAUTHORIZED;
            case 403 -> AuditFailureReason.FORBIDDEN;
            case 0 -> AuditFailureReason.PROVIDER_UNAVAILABLE;
            default -> e.getStatus() >= 500
                ? AuditFailureReason.PROVIDER_UNAVAILABLE
                : AuditFailureReason.UNKNOWN_ERROR;
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
