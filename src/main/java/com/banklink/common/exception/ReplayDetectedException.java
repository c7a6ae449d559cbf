package com.banklink.common.exception;

/**
 * Thrown when an authorization code that was already exchanged is presented again.
 */
public class ReplayDetectedException extends BankLinkException {

    public ReplayDetectedException(String message) {
        super(ErrorCategory.REPLAY_DETECTED, message);
    }
}
