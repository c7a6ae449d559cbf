package com.banklink.api.controller;

import com.banklink.broker.ExchangeTokenRequest;
import com.banklink.broker.ExchangeTokenResponse;
import com.banklink.broker.RefreshTokenRequest;
import com.banklink.broker.RefreshTokenResponse;
import com.banklink.broker.TokenBrokerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Token broker endpoints. The caller identity is supplied by the platform's
 * authentication layer in {@code X-Caller-Id}.
 */
@RestController
@RequestMapping("/api/v1/broker/token")
@RequiredArgsConstructor
@Tag(name = "Token broker", description = "Server-side code exchange and token refresh")
public class BrokerController {

    private final TokenBrokerService brokerService;

    @PostMapping("/exchange")
    @Operation(summary = "Exchange an authorization code for tokens")
    public ResponseEntity<ExchangeTokenResponse> exchange(
            @RequestHeader(value = "X-Caller-Id", required = false) String callerId,
            @RequestBody ExchangeTokenRequest request) {
        return ResponseEntity.ok(brokerService.exchange(callerId, request));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh an access token")
    public ResponseEntity<RefreshTokenResponse> refresh(
            @RequestHeader(value = "X-Caller-Id", required = false) String callerId,
            @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(brokerService.refresh(callerId, request));
    }
}
