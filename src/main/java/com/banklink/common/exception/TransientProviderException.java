package com.banklink.common.exception;

/**
 * Network failure or provider-side 5xx. Safe to retry later.
 */
public class TransientProviderException extends BankLinkException {

    public TransientProviderException(String message) {
        super(ErrorCategory.TRANSIENT, message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
    }
}
