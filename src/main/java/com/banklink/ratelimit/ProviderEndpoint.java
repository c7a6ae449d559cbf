package com.banklink.ratelimit;

/**
 * Provider data endpoints throttled locally, one window each.
 */
public enum ProviderEndpoint {
    ACCOUNTS,
    BALANCE,
    TRANSACTIONS,
    CARDS
}
