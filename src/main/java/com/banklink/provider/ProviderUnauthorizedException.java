package com.banklink.provider;

/**
 * The data API rejected the access token (401/403).
 */
public class ProviderUnauthorizedException extends RuntimeException {

    public ProviderUnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
