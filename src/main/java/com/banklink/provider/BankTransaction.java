package com.banklink.provider;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Provider transaction mapped to the app's model. Amount is always positive;
 * {@link #type} carries the direction.
 */
@Value
@Builder
@Jacksonized
public class BankTransaction {
    String id;
    String providerTransactionId;
    String accountId;
    BigDecimal amount;
    String currency;
    TransactionType type;
    String category;
    String description;
    Instant date;
    boolean pending;
}
