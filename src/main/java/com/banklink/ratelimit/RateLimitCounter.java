package com.banklink.ratelimit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Broker-side fixed-window counter for one (operation, caller) pair.
 */
@Entity
@Table(name = "rate_limit_counters")
@Data
@NoArgsConstructor
public class RateLimitCounter {

    /**
     * {@code <operation>:<caller hash>}.
     */
    @Id
    @Column(name = "bucket_key", length = 128)
    private String bucketKey;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "window_end", nullable = false)
    private Instant windowEnd;

    @Column(nullable = false)
    private int count;

    public RateLimitCounter(String bucketKey, FixedWindowCounter window) {
        this.bucketKey = bucketKey;
        apply(window);
    }

    public FixedWindowCounter toWindow() {
        return new FixedWindowCounter(windowStart, windowEnd, count);
    }

    public void apply(FixedWindowCounter window) {
        this.windowStart = window.getWindowStart();
        this.windowEnd = window.getWindowEnd();
        this.count = window.getCount();
    }
}
