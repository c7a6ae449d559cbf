package com.banklink.storage;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry in the non-sensitive tier (connection id list and similar).
 */
@Entity
@Table(name = "plain_records")
@Data
@NoArgsConstructor
public class PlainRecord {

    @Id
    @Column(name = "record_key", length = 255)
    private String recordKey;

    @Lob
    @Column(name = "record_value", nullable = false)
    private String recordValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public PlainRecord(String recordKey, String recordValue, Instant updatedAt) {
        this.recordKey = recordKey;
        this.recordValue = recordValue;
        this.updatedAt = updatedAt;
    }
}
