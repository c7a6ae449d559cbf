package com.banklink.sync;

import lombok.Value;

import java.time.Instant;

/**
 * The app returned to the foreground.
 */
@Value
public class AppForegroundEvent {
    Instant occurredAt;
}
