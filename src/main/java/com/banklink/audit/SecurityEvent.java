package com.banklink.audit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only security audit record.
 *
 * Holds the event type, a hash of the user id, the outcome and an optional
 * failure category. Never holds codes, tokens, secrets or financial data.
 */
@Entity
@Table(name = "security_events", indexes = {
    @Index(name = "idx_security_event_type", columnList = "event_type"),
    @Index(name = "idx_security_event_occurred_at", columnList = "occurred_at")
})
@Data
@NoArgsConstructor
public class SecurityEvent {

    @Id
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private SecurityEventType eventType;

    /**
     * Truncated SHA-256 of the user id, or "anonymous".
     */
    @Column(name = "user_hash", nullable = false)
    private String userHash;

    private boolean success;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason")
    private AuditFailureReason failureReason;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    public SecurityEvent(SecurityEventType eventType, String userHash, boolean success,
                         AuditFailureReason failureReason, Instant occurredAt) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.userHash = userHash;
        this.success = success;
        this.failureReason = failureReason;
        this.occurredAt = occurredAt;
    }
}
