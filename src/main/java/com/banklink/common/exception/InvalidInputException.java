package com.banklink.common.exception;

/**
 * Thrown when a code, state, identifier or URI fails format validation.
 * Raised before any network call is made.
 */
public class InvalidInputException extends BankLinkException {

    public InvalidInputException(String message) {
        super(ErrorCategory.INVALID_INPUT, message);
    }
}
