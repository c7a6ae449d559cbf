package com.banklink.broker;

/**
 * Raised by {@link ProviderTokenClient} when the token endpoint fails.
 * The broker decides how each status maps onto the caller-visible taxonomy.
 */
public class ProviderTokenException extends RuntimeException {

    private final int status;
    private final String providerError;

    public ProviderTokenException(int status, String providerError, Throwable cause) {
        super("Provider token endpoint failed with status " + status, cause);
        this.status = status;
        this.providerError = providerError;
    }

    /**
     * HTTP status, or 0 when no response was received.
     */
    public int getStatus() {
        return status;
    }

    public String getProviderError() {
        return providerError;
    }

    public boolean isGrantRejected() {
        return status == 400 || status == 401 || status == 403;
    }
}
