package com.banklink.broker;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Calls the broker in-process. The caller identity is the session's user id.
 */
@Component
@ConditionalOnProperty(prefix = "bank-link.broker", name = "mode", havingValue = "embedded", matchIfMissing = true)
@RequiredArgsConstructor
public class EmbeddedTokenBrokerClient implements TokenBrokerClient {

    private final TokenBrokerService brokerService;

    @Override
    public ExchangeTokenResponse exchange(String callerId, ExchangeTokenRequest request) {
        return brokerService.exchange(callerId, request);
    }

    @Override
    public RefreshTokenResponse refresh(String callerId, RefreshTokenRequest request) {
        return brokerService.refresh(callerId, request);
    }
}
