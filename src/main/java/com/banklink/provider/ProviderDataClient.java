package com.banklink.provider;

import com.banklink.common.exception.InvalidInputException;
import com.banklink.common.exception.TransientProviderException;
import com.banklink.config.BankLinkProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the provider's read-only data API.
 *
 * Every call carries {@code Authorization: Bearer <access token>}.
 * 401/403 surface as {@link ProviderUnauthorizedException}, 5xx and I/O
 * failures as {@link TransientProviderException}, any other 4xx as
 * {@link InvalidInputException}.
 */
@Component
@Slf4j
public class ProviderDataClient {

    private static final ParameterizedTypeReference<ProviderDTOs.Results<ProviderDTOs.Account>> ACCOUNTS =
        new ParameterizedTypeReference<>() {
        };
    private static final ParameterizedTypeReference<ProviderDTOs.Results<ProviderDTOs.Balance>> BALANCES =
        new ParameterizedTypeReference<>() {
        };
    private static final ParameterizedTypeReference<ProviderDTOs.Results<ProviderDTOs.Transaction>> TRANSACTIONS =
        new ParameterizedTypeReference<>() {
        };
    private static final ParameterizedTypeReference<ProviderDTOs.Results<ProviderDTOs.Card>> CARDS =
        new ParameterizedTypeReference<>() {
        };

    private final RestTemplate restTemplate;
    private final BankLinkProperties properties;

    public ProviderDataClient(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                              BankLinkProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<ProviderDTOs.Account> listAccounts(String accessToken) {
        return get(accessToken, uri("/data/v1/accounts", Map.of(), null, null), ACCOUNTS);
    }

    /**
     * @return the first balance result, or null if the provider returned none
     */
    public ProviderDTOs.Balance getBalance(String accessToken, String accountId) {
        List<ProviderDTOs.Balance> results = get(accessToken,
            uri("/data/v1/accounts/{id}/balance", Map.of("id", accountId), null, null), BALANCES);
        return results.isEmpty() ? null : results.get(0);
    }

    public List<ProviderDTOs.Transaction> getTransactions(String accessToken, String accountId,
                                                          LocalDate from, LocalDate to) {
        return get(accessToken,
            uri("/data/v1/accounts/{id}/transactions", Map.of("id", accountId), from, to), TRANSACTIONS);
    }

    public List<ProviderDTOs.Transaction> getPendingTransactions(String accessToken, String accountId) {
        return get(accessToken,
            uri("/data/v1/accounts/{id}/transactions/pending", Map.of("id", accountId), null, null), TRANSACTIONS);
    }

    public List<ProviderDTOs.Card> listCards(String accessToken) {
        return get(accessToken, uri("/data/v1/cards", Map.of(), null, null), CARDS);
    }

    public ProviderDTOs.Balance getCardBalance(String accessToken, String cardId) {
        List<ProviderDTOs.Balance> results = get(accessToken,
            uri("/data/v1/cards/{id}/balance", Map.of("id", cardId), null, null), BALANCES);
        return results.isEmpty() ? null : results.get(0);
    }

    public List<ProviderDTOs.Transaction> getCardTransactions(String accessToken, String cardId,
                                                              LocalDate from, LocalDate to) {
        return get(accessToken,
            uri("/data/v1/cards/{id}/transactions", Map.of("id", cardId), from, to), TRANSACTIONS);
    }

    private URI uri(String path, Map<String, String> variables, LocalDate from, LocalDate to) {
        UriComponentsBuilder builder = UriComponentsBuilder
            .fromHttpUrl(properties.getProvider().resolveApiBaseUrl())
            .path(path);
        if (from != null) {
            builder.queryParam("from", from.toString());
        }
        if (to != null) {
            builder.queryParam("to", to.toString());
        }
        return builder.buildAndExpand(variables).encode().toUri();
    }

    private <T> List<T> get(String accessToken, URI uri,
                            ParameterizedTypeReference<ProviderDTOs.Results<T>> type) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        log.debug("Provider GET {}", uri.getPath());

        try {
            ResponseEntity<ProviderDTOs.Results<T>> response = restTemplate.exchange(
                uri,
                HttpMethod.GET,
                new HttpEntity<>(headers),
                type
            );
            ProviderDTOs.Results<T> body = response.getBody();
            return body == null || body.getResults() == null ? List.of() : body.getResults();

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                throw new ProviderUnauthorizedException("Provider rejected access token with " + status, e);
            }
            if (e.getStatusCode().is5xxServerError()) {
                log.warn("Provider data API returned {} for {}", status, uri.getPath());
                throw new TransientProviderException("Provider data API unavailable (" + status + ")", e);
            }
            throw new InvalidInputException("Provider rejected request with " + status);
        } catch (ResourceAccessException e) {
            log.warn("Provider data API unreachable: {}", e.getMessage());
            throw new TransientProviderException("Provider data API unreachable", e);
        }
    }
}
