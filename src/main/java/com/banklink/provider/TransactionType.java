package com.banklink.provider;

/**
 * Direction of a transaction from the account holder's point of view.
 */
public enum TransactionType {
    INCOME,
    EXPENSE
}
