package com.banklink.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans shared by the credential, cache and broker layers.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(BankLinkProperties.class)
public class BankLinkConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    /**
     * HTTP client for the provider's auth and data endpoints and for the remote broker.
     */
    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, BankLinkProperties props) {
        return builder
            .setConnectTimeout(Duration.ofMillis(props.getProvider().getConnectTimeoutMillis()))
            .setReadTimeout(Duration.ofMillis(props.getProvider().getReadTimeoutMillis()))
            .build();
    }

    /**
     * Runs stale-while-revalidate refreshes off the caller's thread.
     */
    @Bean(name = "cacheRefreshExecutor")
    public ThreadPoolTaskExecutor cacheRefreshExecutor(BankLinkProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCache().getRefreshPoolSize());
        executor.setMaxPoolSize(props.getCache().getRefreshPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("cache-refresh-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
