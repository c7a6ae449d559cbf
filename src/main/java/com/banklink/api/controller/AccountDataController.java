package com.banklink.api.controller;

import com.banklink.cache.BalanceCache;
import com.banklink.cache.CachedValue;
import com.banklink.cache.TransactionCache;
import com.banklink.provider.AccountBalance;
import com.banklink.provider.BankDataService;
import com.banklink.provider.ProviderDTOs;
import com.banklink.provider.TransactionList;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST API for balances, transactions and cards of a connection.
 */
@RestController
@RequestMapping("/api/v1/connections/{connectionId}")
@RequiredArgsConstructor
@Tag(name = "Account data", description = "Cached balances and transactions")
public class AccountDataController {

    private final BalanceCache balanceCache;
    private final TransactionCache transactionCache;
    private final BankDataService bankDataService;

    @GetMapping("/accounts/{accountId}/balance")
    @Operation(summary = "Get an account balance")
    public ResponseEntity<CachedValue<AccountBalance>> balance(
            @PathVariable String connectionId,
            @PathVariable String accountId,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return ResponseEntity.ok(balanceCache.get(connectionId, accountId, forceRefresh));
    }

    @GetMapping("/accounts/{accountId}/transactions")
    @Operation(summary = "Get account transactions, confirmed and pending")
    public ResponseEntity<CachedValue<TransactionList>> transactions(
            @PathVariable String connectionId,
            @PathVariable String accountId,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {
        return ResponseEntity.ok(transactionCache.get(connectionId, accountId, forceRefresh));
    }

    @DeleteMapping("/accounts/{accountId}/cache")
    @Operation(summary = "Drop cached data for an account")
    public ResponseEntity<Void> invalidate(@PathVariable String connectionId, @PathVariable String accountId) {
        balanceCache.invalidate(connectionId, accountId);
        transactionCache.invalidate(connectionId, accountId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cards")
    @Operation(summary = "List cards of a connection")
    public ResponseEntity<List<ProviderDTOs.Card>> cards(@PathVariable String connectionId) {
        return ResponseEntity.ok(bankDataService.listCards(connectionId));
    }

    @GetMapping("/cards/{cardId}/balance")
    @Operation(summary = "Get a card balance")
    public ResponseEntity<AccountBalance> cardBalance(@PathVariable String connectionId,
                                                      @PathVariable String cardId) {
        return ResponseEntity.ok(bankDataService.getCardBalance(connectionId, cardId));
    }

    @GetMapping("/cards/{cardId}/transactions")
    @Operation(summary = "Get card transactions")
    public ResponseEntity<TransactionList> cardTransactions(
            @PathVariable String connectionId,
            @PathVariable String cardId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(bankDataService.getCardTransactions(connectionId, cardId, from, to));
    }
}
