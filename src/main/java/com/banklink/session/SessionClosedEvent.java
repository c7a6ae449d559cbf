package com.banklink.session;

import lombok.Value;

/**
 * Published after a user's session is closed (sign-out or user switch).
 */
@Value
public class SessionClosedEvent {
    String userId;
}
