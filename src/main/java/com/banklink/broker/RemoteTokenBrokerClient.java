package com.banklink.broker;

import com.banklink.common.exception.BankLinkException;
import com.banklink.common.exception.ErrorCategory;
import com.banklink.common.exception.RateLimitedException;
import com.banklink.common.exception.TransientProviderException;
import com.banklink.config.BankLinkProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls a broker deployed elsewhere over HTTP and re-raises its typed errors.
 */
@Component
@ConditionalOnProperty(prefix = "bank-link.broker", name = "mode", havingValue = "remote")
@Slf4j
public class RemoteTokenBrokerClient implements TokenBrokerClient {

    static final String CALLER_HEADER = "X-Caller-Id";

    private final RestTemplate restTemplate;
    private final BankLinkProperties properties;
    private final ObjectMapper objectMapper;

    public RemoteTokenBrokerClient(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                                   BankLinkProperties properties,
                                   ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
        log.info("Remote token broker client initialized: baseUrl={}", properties.getBroker().getBaseUrl());
    }

    @Override
    public ExchangeTokenResponse exchange(String callerId, ExchangeTokenRequest request) {
        return post("/api/v1/broker/token/exchange", callerId, request, ExchangeTokenResponse.class);
    }

    @Override
    public RefreshTokenResponse refresh(String callerId, RefreshTokenRequest request) {
        return post("/api/v1/broker/token/refresh", callerId, request, RefreshTokenResponse.class);
    }

    private <T> T post(String path, String callerId, Object body, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(CALLER_HEADER, callerId);

        try {
            return restTemplate.exchange(
                properties.getBroker().getBaseUrl() + path,
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                responseType
            ).getBody();

        } catch (HttpStatusCodeException e) {
            throw translate(e);
        } catch (ResourceAccessException e) {
            log.warn("Token broker unreachable: {}", e.getMessage());
            throw new TransientProviderException("Token broker unreachable", e);
        }
    }

    private BankLinkException translate(HttpStatusCodeException e) {
        String message = "Token broker returned " + e.getStatusCode().value();
        ErrorCategory category = e.getStatusCode().is5xxServerError() ? ErrorCategory.TRANSIENT : ErrorCategory.INVALID_INPUT;
        try {
            JsonNode node = objectMapper.readTree(e.getResponseBodyAsString());
            if (node.hasNonNull("error")) {
                message = node.get("error").asText();
            }
            if (node.hasNonNull("category")) {
                category = ErrorCategory.valueOf(node.get("category").asText());
            }
        } catch (JsonProcessingException | IllegalArgumentException ignored) {
            log.debug("Token broker error body is not in the expected format");
        }

        if (category == ErrorCategory.RATE_LIMITED) {
            String retryAfter = e.getResponseHeaders() != null
                ? e.getResponseHeaders().getFirst(HttpHeaders.RETRY_AFTER)
                : null;
            return new RateLimitedException(message, parseSeconds(retryAfter));
        }
        return BankLinkException.of(category, message);
    }

    private static long parseSeconds(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
