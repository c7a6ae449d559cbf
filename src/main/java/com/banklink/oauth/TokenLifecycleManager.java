package com.banklink.oauth;

import com.banklink.audit.AuditFailureReason;
import com.banklink.audit.SecurityAuditLogger;
import com.banklink.audit.SecurityEventType;
import com.banklink.broker.ExchangeTokenRequest;
import com.banklink.broker.ExchangeTokenResponse;
import com.banklink.broker.RefreshTokenRequest;
import com.banklink.broker.RefreshTokenResponse;
import com.banklink.broker.TokenBrokerClient;
import com.banklink.common.exception.AuthorizationCancelledException;
import com.banklink.common.exception.AuthorizationDeniedException;
import com.banklink.common.exception.BankLinkException;
import com.banklink.common.exception.ConnectionNotFoundException;
import com.banklink.common.exception.CsrfFailureException;
import com.banklink.common.exception.InvalidInputException;
import com.banklink.common.exception.NeedsReconnectException;
import com.banklink.common.exception.ReplayDetectedException;
import com.banklink.common.exception.TransientProviderException;
import com.banklink.config.BankLinkProperties;
import com.banklink.connections.Connection;
import com.banklink.connections.ConnectionIds;
import com.banklink.connections.ConnectionRemovedEvent;
import com.banklink.connections.ConnectionStore;
import com.banklink.connections.ConnectionSummary;
import com.banklink.session.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the OAuth authorization flow and the token lifecycle of every connection.
 *
 * Validation and security checks on a callback all run before the broker is
 * called. Refresh is single-flight per connection: concurrent callers share
 * one broker call and its outcome.
 */
@Service
@Slf4j
public class TokenLifecycleManager {

    private final BankLinkProperties properties;
    private final SessionContext session;
    private final OAuthStateStore stateStore;
    private final UsedCodeRegistry usedCodes;
    private final ConnectionStore connectionStore;
    private final TokenBrokerClient broker;
    private final SecurityAuditLogger auditLogger;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, LinkStateMachine> flows = new ConcurrentHashMap<>();
    private final Map<String, LinkStateMachine> connectionStates = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Connection>> inFlightRefreshes = new ConcurrentHashMap<>();

    public TokenLifecycleManager(BankLinkProperties properties,
                                 SessionContext session,
                                 OAuthStateStore stateStore,
                                 UsedCodeRegistry usedCodes,
                                 ConnectionStore connectionStore,
                                 TokenBrokerClient broker,
                                 SecurityAuditLogger auditLogger,
                                 ApplicationEventPublisher eventPublisher,
                                 Clock clock) {
        this.properties = properties;
        this.session = session;
        this.stateStore = stateStore;
        this.usedCodes = usedCodes;
        this.connectionStore = connectionStore;
        this.broker = broker;
        this.auditLogger = auditLogger;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Issue a fresh state and the provider authorization URL embedding it.
     * Any earlier pending state for the user is replaced.
     */
    public AuthorizationRequest buildAuthorizationRequest() {
        String userId = session.requireUserId();
        LinkStateMachine flow = flowFor(userId);
        flow.transitionTo(LinkState.AUTHORIZING);

        OAuthState state = stateStore.issue(userId);
        BankLinkProperties.OAuth oauth = properties.getOauth();
        String url = UriComponentsBuilder.fromHttpUrl(properties.getProvider().resolveAuthBaseUrl())
            .path("/")
            .queryParam("response_type", "code")
            .queryParam("client_id", properties.getProvider().getClientId())
            .queryParam("scope", String.join(" ", oauth.getScopes()))
            .queryParam("redirect_uri", oauth.getRedirectUri())
            .queryParam("providers", String.join(" ", oauth.getProviders()))
            .queryParam("state", state.getValue())
            .encode()
            .toUriString();

        auditLogger.success(SecurityEventType.OAUTH_FLOW_STARTED, userId);
        log.info("Authorization flow started");
        return new AuthorizationRequest(url, state.getValue());
    }

    public ConnectionSummary handleCallbackUri(String uri) {
        BankLinkProperties.OAuth oauth = properties.getOauth();
        CallbackUri callback = CallbackUri.parse(uri, oauth.getAllowedSchemes(), oauth.getCallbackHost());
        return handleCallback(callback.getCode(), callback.getState(), callback.getError());
    }

    /**
     * Complete the authorization flow from the consent callback.
     *
     * @throws AuthorizationDeniedException    provider returned {@code error}
     * @throws AuthorizationCancelledException the user cancelled this attempt
     * @throws InvalidInputException           code missing or malformed
     * @throws ReplayDetectedException         code already exchanged
     * @throws CsrfFailureException            state missing, expired or mismatched
     */
    public ConnectionSummary handleCallback(String code, String state, String error) {
        String userId = session.requireUserId();
        LinkStateMachine flow = flowFor(userId);

        if (error != null && !error.isBlank()) {
            abort(userId, flow, AuditFailureReason.PROVIDER_DENIED);
            throw new AuthorizationDeniedException(error);
        }
        if (flow.getState() == LinkState.CANCELLED) {
            stateStore.discard(userId);
            throw new AuthorizationCancelledException("Authorization was cancelled");
        }
        if (!AuthorizationCodes.isValidFormat(code)) {
            abort(userId, flow, AuditFailureReason.INVALID_CODE_FORMAT);
            throw new InvalidInputException("Invalid authorization code format");
        }
        if (usedCodes.isUsed(code)) {
            abort(userId, flow, AuditFailureReason.CODE_REPLAY);
            throw new ReplayDetectedException("Authorization code has already been used");
        }
        try {
            stateStore.consume(userId, state);
        } catch (CsrfFailureException e) {
            flow.tryTransitionTo(LinkState.FAILED);
            auditLogger.failure(SecurityEventType.OAUTH_FLOW_FAILED, userId, AuditFailureReason.CSRF_STATE_REJECTED);
            throw e;
        }

        // A valid state can outlive the in-memory flow across a restart.
        if (flow.getState() != LinkState.AUTHORIZING) {
            flow.transitionTo(LinkState.AUTHORIZING);
        }
        flow.transitionTo(LinkState.EXCHANGING);

        Connection connection;
        try {
            connection = exchangeAndStore(userId, code, state);
        } catch (RuntimeException e) {
            flow.tryTransitionTo(LinkState.FAILED);
            auditLogger.failure(SecurityEventType.OAUTH_FLOW_FAILED, userId, reasonFor(e));
            throw e;
        }
        flow.transitionTo(LinkState.ACTIVE);

        auditLogger.success(SecurityEventType.CONNECTION_CREATED, userId);
        auditLogger.success(SecurityEventType.OAUTH_FLOW_COMPLETED, userId);
        log.info("Connection {} created", ConnectionIds.shorten(connection.getConnectionId()));
        return toSummary(connection);
    }

    private Connection exchangeAndStore(String userId, String code, String state) {
        ExchangeTokenResponse tokens = broker.exchange(userId,
            new ExchangeTokenRequest(code, properties.getOauth().getRedirectUri(), state));
        if (tokens == null || !ConnectionIds.isValid(tokens.getConnectionId())
                || tokens.getAccessToken() == null || tokens.getRefreshToken() == null) {
            throw new TransientProviderException("Token broker returned an incomplete response");
        }

        Instant now = clock.instant();
        Connection connection = Connection.builder()
            .connectionId(tokens.getConnectionId())
            .ownerUserId(userId)
            .accessToken(tokens.getAccessToken())
            .refreshToken(tokens.getRefreshToken())
            .expiresAt(now.plusSeconds(tokens.getExpiresIn()))
            .createdAt(now)
            .build();
        connectionStore.save(connection);
        usedCodes.markUsed(code);
        connectionStates.put(connection.getConnectionId(),
            new LinkStateMachine(connectionSubject(connection.getConnectionId()), LinkState.ACTIVE));
        return connection;
    }

    /**
     * Abandon the pending authorization attempt. A callback that arrives for
     * it afterwards is rejected as cancelled.
     */
    public void cancelAuthorization() {
        String userId = session.requireUserId();
        stateStore.discard(userId);
        if (flowFor(userId).tryTransitionTo(LinkState.CANCELLED)) {
            auditLogger.failure(SecurityEventType.OAUTH_FLOW_FAILED, userId, AuditFailureReason.USER_CANCELLED);
            log.info("Authorization flow cancelled by user");
        }
    }

    public LinkState currentFlowState() {
        return flowFor(session.requireUserId()).getState();
    }

    /**
     * Access token for the connection, refreshed first if it is within the
     * refresh buffer of its expiry.
     */
    public String getValidAccessToken(String connectionId) {
        String userId = session.requireUserId();
        Connection connection = loadOwned(connectionId, userId);
        if (connection.isUsableAt(clock.instant(), properties.getOauth().getRefreshBuffer())) {
            return connection.getAccessToken();
        }
        return singleFlightRefresh(connectionId, userId, false).getAccessToken();
    }

    /**
     * Refresh the connection's tokens now, joining a refresh already in flight.
     */
    public ConnectionSummary refresh(String connectionId) {
        String userId = session.requireUserId();
        loadOwned(connectionId, userId);
        return toSummary(singleFlightRefresh(connectionId, userId, true));
    }

    public void disconnect(String connectionId) {
        String userId = session.requireUserId();
        Connection connection = loadOwned(connectionId, userId);
        removeConnection(connection, ConnectionRemovedEvent.Reason.DISCONNECTED);
        auditLogger.success(SecurityEventType.CONNECTION_DELETED, userId);
        log.info("Connection {} disconnected", ConnectionIds.shorten(connectionId));
    }

    /**
     * Called when a data endpoint rejects the access token. Deletes the connection.
     *
     * @return the error to raise to the caller
     */
    public NeedsReconnectException markRevoked(String connectionId) {
        connectionStore.find(connectionId).ifPresent(connection -> {
            removeConnection(connection, ConnectionRemovedEvent.Reason.REVOKED);
            auditLogger.success(SecurityEventType.TOKEN_REVOKED, connection.getOwnerUserId());
        });
        log.warn("Connection {} revoked by provider", ConnectionIds.shorten(connectionId));
        return new NeedsReconnectException(connectionId, "Bank connection was revoked, please reconnect");
    }

    public List<ConnectionSummary> listConnections() {
        String userId = session.requireUserId();
        return connectionStore.findAllOwnedBy(userId).stream()
            .map(this::toSummary)
            .toList();
    }

    private Connection singleFlightRefresh(String connectionId, String userId, boolean force) {
        CompletableFuture<Connection> mine = new CompletableFuture<>();
        CompletableFuture<Connection> existing = inFlightRefreshes.putIfAbsent(connectionId, mine);
        if (existing != null) {
            log.debug("Joining in-flight refresh for {}", ConnectionIds.shorten(connectionId));
            return await(existing);
        }
        try {
            Connection result = refreshNow(connectionId, userId, force);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlightRefreshes.remove(connectionId, mine);
        }
    }

    private Connection refreshNow(String connectionId, String userId, boolean force) {
        Connection current = loadOwned(connectionId, userId);
        if (!force && current.isUsableAt(clock.instant(), properties.getOauth().getRefreshBuffer())) {
            // Another caller refreshed it between our read and taking the flight.
            return current;
        }

        LinkStateMachine machine = connectionStateFor(connectionId);
        machine.transitionTo(LinkState.REFRESHING);

        Connection refreshed;
        try {
            RefreshTokenResponse tokens = broker.refresh(userId,
                new RefreshTokenRequest(current.getRefreshToken(), connectionId));
            if (tokens == null || tokens.getAccessToken() == null || tokens.getRefreshToken() == null) {
                throw new TransientProviderException("Token broker returned an incomplete refresh response");
            }
            refreshed = current.withTokens(
                tokens.getAccessToken(),
                tokens.getRefreshToken(),
                clock.instant().plusSeconds(tokens.getExpiresIn()));
            connectionStore.save(refreshed);
        } catch (NeedsReconnectException e) {
            machine.transitionTo(LinkState.REVOKED);
            removeConnection(current, ConnectionRemovedEvent.Reason.REFRESH_REJECTED);
            auditLogger.success(SecurityEventType.TOKEN_REVOKED, userId);
            log.warn("Refresh token for {} rejected, connection removed", ConnectionIds.shorten(connectionId));
            throw new NeedsReconnectException(connectionId, "Bank connection expired, please reconnect", e);
        } finally {
            machine.tryTransitionTo(LinkState.ACTIVE);
        }
        log.info("Connection {} refreshed, expires at {}", ConnectionIds.shorten(connectionId), refreshed.getExpiresAt());
        return refreshed;
    }

    private static Connection await(CompletableFuture<Connection> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private Connection loadOwned(String connectionId, String userId) {
        if (!ConnectionIds.isValid(connectionId)) {
            throw new InvalidInputException("Invalid connection id format");
        }
        return connectionStore.find(connectionId)
            .filter(c -> c.isOwnedBy(userId))
            .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    private void removeConnection(Connection connection, ConnectionRemovedEvent.Reason reason) {
        connectionStates.remove(connection.getConnectionId());
        connectionStore.delete(connection.getConnectionId());
        eventPublisher.publishEvent(new ConnectionRemovedEvent(
            connection.getConnectionId(), connection.getOwnerUserId(), reason));
    }

    private void abort(String userId, LinkStateMachine flow, AuditFailureReason reason) {
        stateStore.discard(userId);
        flow.tryTransitionTo(LinkState.FAILED);
        auditLogger.failure(SecurityEventType.OAUTH_FLOW_FAILED, userId, reason);
    }

    private LinkStateMachine flowFor(String userId) {
        return flows.computeIfAbsent(userId,
            id -> new LinkStateMachine("authorization flow", LinkState.NO_CONNECTION));
    }

    private LinkStateMachine connectionStateFor(String connectionId) {
        return connectionStates.computeIfAbsent(connectionId,
            id -> new LinkStateMachine(connectionSubject(id), LinkState.ACTIVE));
    }

    private static String connectionSubject(String connectionId) {
        return "connection " + ConnectionIds.shorten(connectionId);
    }

    private ConnectionSummary toSummary(Connection connection) {
        return new ConnectionSummary(
            connection.getConnectionId(),
            connection.getCreatedAt(),
            connection.getExpiresAt(),
            !connection.isUsableAt(clock.instant(), properties.getOauth().getRefreshBuffer()));
    }

    private static AuditFailureReason reasonFor(RuntimeException failure) {
        if (!(failure instanceof BankLinkException e)) {
            return AuditFailureReason.UNKNOWN_ERROR;
        }
        return switch (e.getCategory()) {
            case RATE_LIMITED -> AuditFailureReason.RATE_LIMIT_EXCEEDED;
            case REPLAY_DETECTED -> AuditFailureReason.CODE_REPLAY;
            case INVALID_INPUT -> AuditFailureReason.INVALID_REQUEST;
            case AUTHORIZATION_DENIED -> AuditFailureReason.PROVIDER_DENIED;
            case TRANSIENT -> AuditFailureReason.PROVIDER_UNAVAILABLE;
            case STORAGE_UNAVAILABLE -> AuditFailureReason.STORAGE_UNAVAILABLE;
            case CONFIGURATION -> AuditFailureReason.SERVER_CONFIG_ERROR;
            case UNAUTHENTICATED -> AuditFailureReason.UNAUTHORIZED;
            default -> AuditFailureReason.UNKNOWN_ERROR;
        };
    }
}
