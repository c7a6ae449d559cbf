package com.banklink.broker;

/**
 * Client-side view of the backend token broker.
 *
 * Implementations raise the same {@link com.banklink.common.exception.BankLinkException}
 * subtypes whether the broker runs in-process or remotely.
 */
public interface TokenBrokerClient {

    ExchangeTokenResponse exchange(String callerId, ExchangeTokenRequest request);

    RefreshTokenResponse refresh(String callerId, RefreshTokenRequest request);
}
