package com.banklink.storage;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry in the secure tier. The value is ciphertext for everything
 * except the installation key itself.
 */
@Entity
@Table(name = "secure_records")
@Data
@NoArgsConstructor
public class SecureRecord {

    @Id
    @Column(name = "record_key", length = 255)
    private String recordKey;

    @Lob
    @Column(name = "record_value", nullable = false)
    private String recordValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public SecureRecord(String recordKey, String recordValue, Instant updatedAt) {
        this.recordKey = recordKey;
        this.recordValue = recordValue;
        this.updatedAt = updatedAt;
    }
}
