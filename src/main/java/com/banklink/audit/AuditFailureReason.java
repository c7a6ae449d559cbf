package com.banklink.audit;

/**
 * Failure categories recorded on audit events.
 *
 * Audit rows only ever carry one of these names, so codes, tokens and
 * provider messages cannot leak into the audit trail.
 */
public enum AuditFailureReason {
    UNAUTHORIZED,
    MISSING_PARAMETERS,
    INVALID_CODE_FORMAT,
    INVALID_REDIRECT_URI,
    MISSING_STATE,
    INVALID_STATE_FORMAT,
    INVALID_REFRESH_TOKEN_FORMAT,
    INVALID_CONNECTION_ID_FORMAT,
    CSRF_STATE_REJECTED,
    CODE_REPLAY,
    RATE_LIMIT_EXCEEDED,
    SERVER_CONFIG_ERROR,
    INVALID_TOKEN_RESPONSE,
    INVALID_REQUEST,
    FORBIDDEN,
    PROVIDER_UNAVAILABLE,
    PROVIDER_DENIED,
    USER_CANCELLED,
    DECRYPTION_FAILED,
    STORAGE_UNAVAILABLE,
    UNKNOWN_ERROR
}
