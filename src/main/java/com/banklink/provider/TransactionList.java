package com.banklink.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Confirmed and pending transactions of one account.
 */
@Value
@Builder
@Jacksonized
public class TransactionList {
    String accountId;
    @Singular
    List<BankTransaction> transactions;

    public int size() {
        return transactions.size();
    }
}
