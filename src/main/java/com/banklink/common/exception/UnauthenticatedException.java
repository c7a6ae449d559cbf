package com.banklink.common.exception;

public class UnauthenticatedException extends BankLinkException {

    public UnauthenticatedException(String message) {
        super(ErrorCategory.UNAUTHENTICATED, message);
    }
}
