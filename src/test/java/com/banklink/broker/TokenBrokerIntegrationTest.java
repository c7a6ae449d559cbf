package com.banklink.broker;

import com.banklink.common.exception.RateLimitedException;
import com.banklink.common.exception.ReplayDetectedException;
import com.banklink.ratelimit.RateLimitCounterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Broker against the real database-backed rate limiter and code guard, with
 * the provider token endpoint mocked at the HTTP layer.
 */
@SpringBootTest
@ActiveProfiles("test")
class TokenBrokerIntegrationTest {

    private static final String TOKEN_URL = "https://auth.provider.test/connect/token";
    private static final String TOKEN_BODY =
        "{\"access_token\":\"access-1\",\"refresh_token\":\"refresh_token_0123456789\",\"expires_in\":3600,\"token_type\":\"Bearer\"}";

    @Autowired
    private TokenBrokerService brokerService;

    @Autowired
    @Qualifier("providerRestTemplate")
    private RestTemplate restTemplate;

    @Autowired
    private BrokerMaintenanceJob maintenanceJob;

    @Autowired
    private RateLimitCounterRepository counterRepository;

    private MockRestServiceServer provider;
    private String caller;

    @BeforeEach
    void setUp() {
        provider = MockRestServiceServer.bindTo(restTemplate).build();
        caller = "broker-it-" + UUID.randomUUID();
    }

    @Test
    void testRefresh_EleventhWithinWindow_IsRateLimited() {
        provider.expect(ExpectedCount.times(10), requestTo(TOKEN_URL))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withSuccess(TOKEN_BODY, MediaType.APPLICATION_JSON));

        RefreshTokenRequest request = new RefreshTokenRequest("refresh_token_0123456789", "tl_1709287200000_abc123xyz");
        for (int i = 0; i < 10; i++) {
            assertEquals("access-1", brokerService.refresh(caller, request).getAccessToken());
        }

        RateLimitedException e = assertThrows(RateLimitedException.class, () -> brokerService.refresh(caller, request));
        assertTrue(e.getRetryAfterSeconds() > 0 && e.getRetryAfterSeconds() <= 3601);
        provider.verify();

        // other callers have their own window
        provider.reset();
        provider.expect(requestTo(TOKEN_URL)).andRespond(withSuccess(TOKEN_BODY, MediaType.APPLICATION_JSON));
        assertNotNull(brokerService.refresh(caller + "-other", request));
    }

    @Test
    void testExchange_SameCodeTwice_IsReplay() {
        provider.expect(ExpectedCount.once(), requestTo(TOKEN_URL))
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
            .andRespond(withSuccess(TOKEN_BODY, MediaType.APPLICATION_JSON));
        String code = "code_" + UUID.randomUUID().toString().replace("-", "");
        ExchangeTokenRequest request = new ExchangeTokenRequest(code, "banklink://oauth-callback", "state_0123456789abcdefghij");

        ExchangeTokenResponse first = brokerService.exchange(caller, request);
        assertNotNull(first.getConnectionId());

        assertThrows(ReplayDetectedException.class, () -> brokerService.exchange(caller, request));
        provider.verify();
    }

    @Test
    void testExchange_SixthWithinWindow_IsRateLimited() {
        provider.expect(ExpectedCount.times(5), requestTo(TOKEN_URL))
            .andRespond(withSuccess(TOKEN_BODY, MediaType.APPLICATION_JSON));

        for (int i = 0; i < 5; i++) {
            brokerService.exchange(caller, new ExchangeTokenRequest(
                "code_" + UUID.randomUUID().toString().replace("-", ""),
                "banklink://oauth-callback", "state_0123456789abcdefghij"));
        }

        assertThrows(RateLimitedException.class, () -> brokerService.exchange(caller, new ExchangeTokenRequest(
            "code_" + UUID.randomUUID().toString().replace("-", ""),
            "banklink://oauth-callback", "state_0123456789abcdefghij")));
        provider.verify();
    }

    @Test
    void testMaintenance_KeepsOpenWindows() {
        provider.expect(requestTo(TOKEN_URL)).andRespond(withSuccess(TOKEN_BODY, MediaType.APPLICATION_JSON));
        brokerService.refresh(caller, new RefreshTokenRequest("refresh_token_0123456789", "tl_1709287200000_abc123xyz"));
        long before = counterRepository.count();

        maintenanceJob.purgeExpired();

        assertEquals(before, counterRepository.count());
    }
}
