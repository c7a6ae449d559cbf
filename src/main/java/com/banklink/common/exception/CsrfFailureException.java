package com.banklink.common.exception;

/**
 * Thrown when the OAuth state on a callback is missing, expired or does not
 * match the pending authorization attempt.
 */
public class CsrfFailureException extends BankLinkException {

    public CsrfFailureException(String message) {
        super(ErrorCategory.CSRF_FAILURE, message);
    }
}
