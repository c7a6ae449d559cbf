package com.banklink.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Settings for the provider integration, the OAuth flow, caching, throttling,
 * background sync and the token broker.
 *
 * TTLs and the stale fraction are product tuning values, not protocol constants.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bank-link")
public class BankLinkProperties {

    @Valid
    private Provider provider = new Provider();

    @Valid
    private OAuth oauth = new OAuth();

    @Valid
    private Cache cache = new Cache();

    private RateLimits rateLimits = new RateLimits();

    private Sync sync = new Sync();

    private Broker broker = new Broker();

    private Storage storage = new Storage();

    @Data
    public static class Provider {
        /**
         * "live" or "sandbox".
         */
        private String env = "live";
        private String clientId;
        /**
         * Overrides the env-derived auth host when set.
         */
        private String authBaseUrl;
        /**
         * Overrides the env-derived data API host when set.
         */
        private String apiBaseUrl;
        private int connectTimeoutMillis = 5000;
        private int readTimeoutMillis = 15000;

        public String resolveAuthBaseUrl() {
            if (authBaseUrl != null && !authBaseUrl.isBlank()) {
                return authBaseUrl;
            }
            return "live".equalsIgnoreCase(env)
                ? "https://auth.truelayer.com"
                : "https://auth.truelayer-sandbox.com";
        }

        public String resolveApiBaseUrl() {
            if (apiBaseUrl != null && !apiBaseUrl.isBlank()) {
                return apiBaseUrl;
            }
            return "live".equalsIgnoreCase(env)
                ? "https://api.truelayer.com"
                : "https://api.truelayer-sandbox.com";
        }
    }

    @Data
    public static class OAuth {
        @NotBlank
        private String redirectUri = "banklink://oauth-callback";
        @NotEmpty
        private List<String> allowedSchemes = List.of("banklink", "com.banklink.app");
        @NotBlank
        private String callbackHost = "oauth-callback";
        private List<String> scopes = List.of(
            "info", "accounts", "balance", "cards", "transactions",
            "direct_debits", "standing_orders", "offline_access");
        private List<String> providers = List.of("uk-ob-all", "uk-oauth-all");
        private Duration stateTtl = Duration.ofMinutes(10);
        private Duration usedCodeTtl = Duration.ofMinutes(10);
        /**
         * Tokens are refreshed once they are within this window of expiry.
         */
        private Duration refreshBuffer = Duration.ofMinutes(5);
    }

    @Data
    public static class Cache {
        private Duration balanceTtl = Duration.ofMinutes(30);
        private Duration transactionsTtl = Duration.ofHours(6);
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double staleFraction = 0.5;
        private int refreshPoolSize = 2;
    }

    @Data
    public static class RateLimits {
        private Duration localWindow = Duration.ofMinutes(1);
        private int accountsPerWindow = 10;
        private int balancePerWindow = 20;
        private int transactionsPerWindow = 20;
        private int cardsPerWindow = 10;

        private Duration brokerWindow = Duration.ofHours(1);
        private int exchangePerWindow = 5;
        private int refreshPerWindow = 10;
    }

    @Data
    public static class Sync {
        private boolean enabled = true;
        /**
         * Non-forced syncs inside this interval are skipped.
         */
        private Duration minInterval = Duration.ofHours(1);
        /**
         * Periodic timer cadence (4x per day by default).
         */
        private Duration interval = Duration.ofHours(6);
        /**
         * Delay of the first timer sync after startup.
         */
        private Duration initialDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Broker {
        /**
         * "embedded" calls the broker in-process, "remote" goes over HTTP.
         */
        private String mode = "embedded";
        private String baseUrl = "http://localhost:8080";
        /**
         * Provider client secret. Server side only, never returned to callers.
         */
        private String clientSecret;
        /**
         * How long audit events are retained before the cleanup job removes them.
         */
        private Duration auditRetention = Duration.ofDays(90);
        private Duration cleanupInterval = Duration.ofHours(1);
    }

    @Data
    public static class Storage {
        /**
         * How often expired states, used-code markers and cache entries are purged.
         */
        private Duration cleanupInterval = Duration.ofHours(1);
    }
}
