package com.banklink.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Data transfer objects for the provider's data API.
 */
public class ProviderDTOs {

    /**
     * Envelope used by every list endpoint.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Results<T> {
        private List<T> results = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderInfo {
        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("logo_uri")
        private String logoUri;

        @JsonProperty("provider_id")
        private String providerId;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Account {
        @JsonProperty("account_id")
        private String accountId;

        @JsonProperty("account_type")
        private String accountType;

        private String currency;

        @JsonProperty("display_name")
        private String displayName;

        private ProviderInfo provider;

        @JsonProperty("update_timestamp")
        private String updateTimestamp;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Balance {
        private BigDecimal available;
        private BigDecimal current;
        private BigDecimal overdraft;
        private String currency;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Card {
        @JsonProperty("account_id")
        private String accountId;

        @JsonProperty("card_network")
        private String cardNetwork;

        @JsonProperty("card_type")
        private String cardType;

        private String currency;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("partial_card_number")
        private String partialCardNumber;

        private ProviderInfo provider;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Transaction {
        @JsonProperty("transaction_id")
        private String transactionId;

        private String timestamp;
        private String description;

        @JsonProperty("transaction_type")
        private String transactionType;

        @JsonProperty("transaction_category")
        private String transactionCategory;

        private BigDecimal amount;
        private String currency;

        @JsonProperty("merchant_name")
        private String merchantName;
    }
}
