package com.banklink.provider;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Balance of one account or card.
 */
@Value
@Builder
@Jacksonized
public class AccountBalance {
    String accountId;
    /**
     * Current balance, falling back to the available balance.
     */
    BigDecimal amount;
    BigDecimal available;
    String currency;
}
