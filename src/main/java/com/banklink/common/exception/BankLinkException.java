package com.banklink.common.exception;

/**
 * Base exception for all bank link exceptions.
 */
public class BankLinkException extends RuntimeException {

    private final ErrorCategory category;

    public BankLinkException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public BankLinkException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return category.isRetryable();
    }

    /**
     * Rebuild a typed exception from a category received over the wire.
     * Used by the remote broker client so callers see the same taxonomy
     * whether the broker runs in-process or behind HTTP.
     */
    public static BankLinkException of(ErrorCategory category, String message) {
        return switch (category) {
            case INVALID_INPUT -> new InvalidInputException(message);
            case CSRF_FAILURE -> new CsrfFailureException(message);
            case REPLAY_DETECTED -> new ReplayDetectedException(message);
            case RATE_LIMITED -> new RateLimitedException(message, 0);
            case NEEDS_RECONNECT -> new NeedsReconnectException(null, message);
            case TRANSIENT -> new TransientProviderException(message);
            case STORAGE_UNAVAILABLE -> new StorageUnavailableException(message);
            case AUTHORIZATION_DENIED -> new AuthorizationDeniedException(message);
            case CANCELLED -> new AuthorizationCancelledException(message);
            case UNAUTHENTICATED -> new UnauthenticatedException(message);
            default -> new BankLinkException(category, message);
        };
    }
}
