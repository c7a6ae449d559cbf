package com.banklink.api.controller;

import com.banklink.accounts.LinkedAccount;
import com.banklink.accounts.LinkedAccountService;
import com.banklink.connections.ConnectionSummary;
import com.banklink.oauth.TokenLifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for managing bank connections.
 */
@RestController
@RequestMapping("/api/v1/connections")
@RequiredArgsConstructor
@Tag(name = "Connections", description = "Linked bank connections")
public class ConnectionController {

    private final TokenLifecycleManager tokenManager;
    private final LinkedAccountService accountService;

    @GetMapping
    @Operation(summary = "List connections of the signed-in user")
    public ResponseEntity<List<ConnectionSummary>> list() {
        return ResponseEntity.ok(tokenManager.listConnections());
    }

    @PostMapping("/{connectionId}/refresh")
    @Operation(summary = "Refresh a connection's tokens now")
    public ResponseEntity<ConnectionSummary> refresh(@PathVariable String connectionId) {
        return ResponseEntity.ok(tokenManager.refresh(connectionId));
    }

    @DeleteMapping("/{connectionId}")
    @Operation(summary = "Disconnect a bank")
    public ResponseEntity<Void> disconnect(@PathVariable String connectionId) {
        tokenManager.disconnect(connectionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{connectionId}/accounts")
    @Operation(summary = "List stored accounts of a connection")
    public ResponseEntity<List<LinkedAccount>> accounts(@PathVariable String connectionId) {
        return ResponseEntity.ok(accountService.getAccounts(connectionId));
    }

    @PostMapping("/{connectionId}/accounts/refresh")
    @Operation(summary = "Re-read a connection's accounts from the provider")
    public ResponseEntity<List<LinkedAccount>> refreshAccounts(@PathVariable String connectionId) {
        return ResponseEntity.ok(accountService.refreshAccounts(connectionId));
    }
}
