package com.banklink.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Caller-visible error taxonomy.
 *
 * Each category fixes whether the condition may be retried and which HTTP
 * status the REST layer answers with. Only TRANSIENT is retryable.
 */
public enum ErrorCategory {

    /**
     * Malformed code, state or identifier. Never sent over the network.
     */
    INVALID_INPUT(HttpStatus.BAD_REQUEST, false),

    /**
     * OAuth state missing, expired or mismatched. Security event, flow aborted.
     */
    CSRF_FAILURE(HttpStatus.BAD_REQUEST, false),

    /**
     * Authorization code already exchanged.
     */
    REPLAY_DETECTED(HttpStatus.CONFLICT, false),

    /**
     * Local or broker throttle exceeded. Advise backoff, never auto-retried.
     */
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, false),

    /**
     * Refresh token rejected by the provider. Connection deleted, user must re-link.
     */
    NEEDS_RECONNECT(HttpStatus.GONE, false),

    /**
     * Network failure or provider 5xx. Safe to retry with backoff.
     */
    TRANSIENT(HttpStatus.SERVICE_UNAVAILABLE, true),

    /**
     * Secure persistence primitive missing. Fatal for token operations.
     */
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, false),

    /**
     * Provider returned an error on the authorization callback.
     */
    AUTHORIZATION_DENIED(HttpStatus.FORBIDDEN, false),

    /**
     * User cancelled the consent session.
     */
    CANCELLED(HttpStatus.CONFLICT, false),

    NOT_FOUND(HttpStatus.NOT_FOUND, false),

    /**
     * No open session, or no caller identity on a broker call.
     */
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, false),

    CONFIGURATION(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorCategory(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
