package com.banklink.provider;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Maps provider payloads onto the app's transaction and balance model.
 */
@Component
public class TransactionMapper {

    static final String DEFAULT_CURRENCY = "GBP";
    static final String FALLBACK_CATEGORY = "Other";

    private static final Map<String, String> CATEGORIES = Map.ofEntries(
        Map.entry("general", "Other"),
        Map.entry("entertainment", "Entertainment"),
        Map.entry("eating_out", "Food & Dining"),
        Map.entry("expenses", "Other"),
        Map.entry("transport", "Transport"),
        Map.entry("cash", "Cash"),
        Map.entry("bills", "Bills"),
        Map.entry("groceries", "Groceries"),
        Map.entry("shopping", "Shopping"),
        Map.entry("holidays", "Travel"),
        Map.entry("gas_stations", "Transport"),
        Map.entry("atm", "Cash"),
        Map.entry("fees", "Fees"),
        Map.entry("general_merchandise", "Shopping"),
        Map.entry("food_and_drink", "Food & Dining"),
        Map.entry("recreation", "Entertainment"),
        Map.entry("service", "Other"),
        Map.entry("utilities", "Bills"),
        Map.entry("healthcare", "Healthcare"),
        Map.entry("transfer", "Transfer"),
        Map.entry("income", "Income")
    );

    private final Clock clock;

    public TransactionMapper(Clock clock) {
        this.clock = clock;
    }

    public BankTransaction toTransaction(ProviderDTOs.Transaction source, String accountId, boolean pending) {
        boolean credit = "CREDIT".equalsIgnoreCase(source.getTransactionType());
        BigDecimal amount = source.getAmount() == null ? BigDecimal.ZERO : source.getAmount().abs();

        return BankTransaction.builder()
            .id("tl_" + source.getTransactionId())
            .providerTransactionId(source.getTransactionId())
            .accountId(accountId)
            .amount(amount)
            .currency(source.getCurrency() == null ? DEFAULT_CURRENCY : source.getCurrency())
            .type(credit ? TransactionType.INCOME : TransactionType.EXPENSE)
            .category(mapCategory(source.getTransactionCategory()))
            .description(firstNonBlank(source.getMerchantName(), source.getDescription(), "Transaction"))
            .date(parseTimestamp(source.getTimestamp()))
            .pending(pending)
            .build();
    }

    public AccountBalance toBalance(ProviderDTOs.Balance source, String accountId) {
        if (source == null) {
            return AccountBalance.builder()
                .accountId(accountId)
                .amount(BigDecimal.ZERO)
                .currency(DEFAULT_CURRENCY)
                .build();
        }
        BigDecimal amount = source.getCurrent() != null ? source.getCurrent()
            : source.getAvailable() != null ? source.getAvailable()
            : BigDecimal.ZERO;
        return AccountBalance.builder()
            .accountId(accountId)
            .amount(amount)
            .available(source.getAvailable())
            .currency(source.getCurrency() == null || source.getCurrency().isBlank()
                ? DEFAULT_CURRENCY : source.getCurrency())
            .build();
    }

    static String mapCategory(String providerCategory) {
        String normalized = (providerCategory == null || providerCategory.isBlank() ? "general" : providerCategory)
            .trim()
            .toLowerCase(Locale.ROOT)
            .replaceAll("\\s+", "_");
        return CATEGORIES.getOrDefault(normalized, FALLBACK_CATEGORY);
    }

    private Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return clock.instant();
        }
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(timestamp);
            } catch (DateTimeParseException ignored) {
                return clock.instant();
            }
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
