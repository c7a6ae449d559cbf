package com.banklink.api.controller;

import com.banklink.accounts.LinkedAccount;
import com.banklink.accounts.LinkedAccountService;
import com.banklink.cache.AccountBalanceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the signed-in user's linked accounts across all connections.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Linked bank accounts")
public class AccountController {

    private final LinkedAccountService accountService;
    private final AccountBalanceService balanceService;

    @GetMapping
    @Operation(summary = "List linked accounts")
    public ResponseEntity<List<LinkedAccount>> list() {
        return ResponseEntity.ok(accountService.getAccounts());
    }

    @GetMapping("/balances")
    @Operation(summary = "List linked accounts with their balances")
    public ResponseEntity<List<AccountBalanceService.AccountWithBalance>> balances(
            @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return ResponseEntity.ok(balanceService.balancesFor(accountService.getAccounts(), forceRefresh));
    }
}
