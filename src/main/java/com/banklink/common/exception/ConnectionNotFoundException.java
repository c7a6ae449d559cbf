package com.banklink.common.exception;

/**
 * Thrown when a connection cannot be found (never created, deleted, or unreadable).
 */
public class ConnectionNotFoundException extends BankLinkException {

    public ConnectionNotFoundException(String connectionId) {
        super(ErrorCategory.NOT_FOUND, "Connection not found: " + connectionId);
    }
}
