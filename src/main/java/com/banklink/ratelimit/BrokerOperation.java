package com.banklink.ratelimit;

/**
 * Broker operations throttled per caller.
 */
public enum BrokerOperation {
    EXCHANGE,
    REFRESH
}
