package com.banklink.common.exception;

/**
 * The user cancelled the consent session. Terminal, not an error to retry.
 */
public class AuthorizationCancelledException extends BankLinkException {

    public AuthorizationCancelledException(String message) {
        super(ErrorCategory.CANCELLED, message);
    }
}
