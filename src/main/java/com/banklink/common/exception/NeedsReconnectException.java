package com.banklink.common.exception;

/**
 * Thrown when the provider rejects a refresh token or revokes access.
 * The connection has already been deleted when this reaches the caller.
 */
public class NeedsReconnectException extends BankLinkException {

    private final String connectionId;

    public NeedsReconnectException(String connectionId, String message) {
        super(ErrorCategory.NEEDS_RECONNECT, message);
        this.connectionId = connectionId;
    }

    public NeedsReconnectException(String connectionId, String message, Throwable cause) {
        super(ErrorCategory.NEEDS_RECONNECT, message, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
