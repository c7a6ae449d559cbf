package com.banklink.audit;

/**
 * Security audit event types. Names are stable: they are persisted.
 */
public enum SecurityEventType {
    TOKEN_EXCHANGE_ATTEMPT,
    TOKEN_EXCHANGE_SUCCESS,
    TOKEN_EXCHANGE_FAILURE,
    TOKEN_REFRESH_ATTEMPT,
    TOKEN_REFRESH_SUCCESS,
    TOKEN_REFRESH_FAILURE,
    OAUTH_FLOW_STARTED,
    OAUTH_FLOW_COMPLETED,
    OAUTH_FLOW_FAILED,
    CONNECTION_CREATED,
    CONNECTION_DELETED,
    TOKEN_REVOKED,
    SECURE_STORAGE_ERROR
}
