package com.banklink.api.controller;

import com.banklink.api.dto.CallbackRequest;
import com.banklink.api.dto.CallbackUriRequest;
import com.banklink.api.dto.FlowStateResponse;
import com.banklink.connections.ConnectionSummary;
import com.banklink.oauth.AuthorizationRequest;
import com.banklink.oauth.TokenLifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for linking a bank through the provider's consent flow.
 */
@RestController
@RequestMapping("/api/v1/oauth")
@RequiredArgsConstructor
@Tag(name = "OAuth", description = "Bank authorization flow")
public class OAuthController {

    private final TokenLifecycleManager tokenManager;

    @PostMapping("/authorize")
    @Operation(summary = "Build the provider authorization URL")
    public ResponseEntity<AuthorizationRequest> authorize() {
        return ResponseEntity.ok(tokenManager.buildAuthorizationRequest());
    }

    @PostMapping("/callback")
    @Operation(summary = "Complete the flow with the callback parameters")
    public ResponseEntity<ConnectionSummary> callback(@RequestBody CallbackRequest request) {
        ConnectionSummary connection = tokenManager.handleCallback(
            request.getCode(), request.getState(), request.getError());
        return ResponseEntity.status(HttpStatus.CREATED).body(connection);
    }

    @PostMapping("/callback-uri")
    @Operation(summary = "Complete the flow with the raw deep link")
    public ResponseEntity<ConnectionSummary> callbackUri(@Valid @RequestBody CallbackUriRequest request) {
        ConnectionSummary connection = tokenManager.handleCallbackUri(request.getUri());
        return ResponseEntity.status(HttpStatus.CREATED).body(connection);
    }

    @PostMapping("/cancel")
    @Operation(summary = "Cancel the pending authorization")
    public ResponseEntity<Void> cancel() {
        tokenManager.cancelAuthorization();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/state")
    @Operation(summary = "Get the authorization flow state")
    public ResponseEntity<FlowStateResponse> state() {
        return ResponseEntity.ok(new FlowStateResponse(tokenManager.currentFlowState()));
    }
}
