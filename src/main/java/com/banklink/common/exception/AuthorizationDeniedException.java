package com.banklink.common.exception;

/**
 * The provider answered the authorization request with an error, or refused
 * to exchange the code. The provider's error string is kept verbatim.
 */
public class AuthorizationDeniedException extends BankLinkException {

    public AuthorizationDeniedException(String providerError) {
        super(ErrorCategory.AUTHORIZATION_DENIED, providerError);
    }
}
