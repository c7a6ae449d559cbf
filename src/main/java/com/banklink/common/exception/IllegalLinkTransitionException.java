package com.banklink.common.exception;

/**
 * Thrown when attempting a link state transition that the state machine forbids.
 */
public class IllegalLinkTransitionException extends BankLinkException {

    public IllegalLinkTransitionException(String subject, String currentState, String targetState) {
        super(ErrorCategory.INVALID_INPUT, String.format("Cannot move %s from state %s to %s",
            subject, currentState, targetState));
    }
}
