package com.banklink.common.exception;

/**
 * Thrown when a fixed-window throttle is exhausted.
 */
public class RateLimitedException extends BankLinkException {

    private final long retryAfterSeconds;

    public RateLimitedException(String message, long retryAfterSeconds) {
        super(ErrorCategory.RATE_LIMITED, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateLimitedException(String bucket, int limit, long retryAfterSeconds) {
        this(String.format("Rate limit exceeded for %s: max %d per window, retry in %ds",
            bucket, limit, retryAfterSeconds), retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
