package com.banklink.broker;

import com.banklink.config.BankLinkProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the provider's OAuth token endpoint.
 *
 * Holds the only code path that sends the client secret.
 */
@Component
@Slf4j
public class ProviderTokenClient {

    private final RestTemplate restTemplate;
    private final BankLinkProperties properties;
    private final ObjectMapper objectMapper;

    public ProviderTokenClient(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                               BankLinkProperties properties,
                               ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ProviderTokenResponse exchangeCode(String code, String redirectUri) {
        MultiValueMap<String, String> form = credentialsForm("authorization_code");
        form.add("redirect_uri", redirectUri);
        form.add("code", code);
        return post(form);
    }

    public ProviderTokenResponse refresh(String refreshToken) {
        MultiValueMap<String, String> form = credentialsForm("refresh_token");
        form.add("refresh_token", refreshToken);
        return post(form);
    }

    private MultiValueMap<String, String> credentialsForm(String grantType) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", grantType);
        form.add("client_id", properties.getProvider().getClientId());
        form.add("client_secret", properties.getBroker().getClientSecret());
        return form;
    }

    private ProviderTokenResponse post(MultiValueMap<String, String> form) {
        String url = properties.getProvider().resolveAuthBaseUrl() + "/connect/token";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        log.debug("Calling provider token endpoint: grant={}", form.getFirst("grant_type"));

        try {
            ResponseEntity<ProviderTokenResponse> response = restTemplate.exchange(
                url,
                HttpMethod.POST,
                new HttpEntity<>(form, headers),
                ProviderTokenResponse.class
            );
            return response.getBody();

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            log.warn("Provider token endpoint returned {}", status);
            throw new ProviderTokenException(status, providerError(e.getResponseBodyAsString()), e);
        } catch (ResourceAccessException e) {
            log.warn("Provider token endpoint unreachable: {}", e.getMessage());
            throw new ProviderTokenException(0, null, e);
        }
    }

    private String providerError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node.get("error");
            return error != null && error.isTextual() ? error.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Provider error body is not JSON");
            return null;
        }
    }
}
