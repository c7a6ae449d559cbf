package com.banklink.broker;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Server-side record that an authorization code was presented for exchange.
 *
 * Keyed by the SHA-256 of the code. Always persisted as new, so a second
 * insert for the same code fails on the primary key.
 */
@Entity
@Table(name = "consumed_authorization_codes", indexes = {
    @Index(name = "idx_consumed_code_expires_at", columnList = "expires_at")
})
@Getter
@NoArgsConstructor
public class ConsumedAuthorizationCode implements Persistable<String> {

    @Id
    @Column(name = "code_hash", length = 64)
    private String codeHash;

    @Column(name = "caller_hash", nullable = false)
    private String callerHash;

    @Column(name = "consumed_at", nullable = false)
    private Instant consumedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Transient
    private boolean fresh = true;

    public ConsumedAuthorizationCode(String codeHash, String callerHash, Instant consumedAt, Instant expiresAt) {
        this.codeHash = codeHash;
        this.callerHash = callerHash;
        this.consumedAt = consumedAt;
        this.expiresAt = expiresAt;
    }

    @Override
    public String getId() {
        return codeHash;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        this.fresh = false;
    }
}
