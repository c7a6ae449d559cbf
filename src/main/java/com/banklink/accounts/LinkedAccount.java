package com.banklink.accounts;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A bank account discovered through a connection.
 */
@Entity
@Table(name = "linked_accounts",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_linked_account_connection_account",
        columnNames = {"connection_id", "provider_account_id"}),
    indexes = @Index(name = "idx_linked_account_owner", columnList = "owner_user_id"))
@Data
@NoArgsConstructor
public class LinkedAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_user_id", nullable = false)
    private String ownerUserId;

    @Column(name = "connection_id", nullable = false, length = 100)
    private String connectionId;

    @Column(name = "provider_account_id", nullable = false, length = 100)
    private String providerAccountId;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "account_type")
    private String accountType;

    @Column(length = 3)
    private String currency;

    @Column(name = "provider_name")
    private String providerName;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public LinkedAccount(String ownerUserId, String connectionId, String providerAccountId) {
        this.ownerUserId = ownerUserId;
        this.connectionId = connectionId;
        this.providerAccountId = providerAccountId;
    }
}
