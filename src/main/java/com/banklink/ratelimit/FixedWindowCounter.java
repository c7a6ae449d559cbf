package com.banklink.ratelimit;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable fixed-window counter. The window opens on the first request and
 * resets once {@code now} is past its end.
 */
@Value
public class FixedWindowCounter {

    Instant windowStart;
    Instant windowEnd;
    int count;

    public static FixedWindowCounter open(Instant now, Duration window) {
        return new FixedWindowCounter(now, now.plus(window), 0);
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(windowEnd);
    }

    /**
     * Counter to use for a request at {@code now}: this one, or a fresh
     * window if this one has ended.
     */
    public FixedWindowCounter rollIfExpired(Instant now, Duration window) {
        return isExpiredAt(now) ? open(now, window) : this;
    }

    public boolean hasCapacity(int limit) {
        return count < limit;
    }

    public FixedWindowCounter increment() {
        return new FixedWindowCounter(windowStart, windowEnd, count + 1);
    }

    public long secondsUntilReset(Instant now) {
        long seconds = Duration.between(now, windowEnd).toSeconds();
        return Math.max(1, seconds + 1);
    }
}
