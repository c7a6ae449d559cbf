package com.banklink.provider;

import com.banklink.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TransactionMapperTest {

    private MutableClock clock;
    private TransactionMapper mapper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        mapper = new TransactionMapper(clock);
    }

    private static ProviderDTOs.Transaction transaction(String type, String amount, String category) {
        ProviderDTOs.Transaction t = new ProviderDTOs.Transaction();
        t.setTransactionId("tx-1");
        t.setTimestamp("2024-02-28T09:15:00+00:00");
        t.setDescription("CARD PAYMENT TO TESCO");
        t.setTransactionType(type);
        t.setTransactionCategory(category);
        t.setAmount(amount == null ? null : new BigDecimal(amount));
        t.setCurrency("GBP");
        return t;
    }

    @Test
    void testDebit_MapsToPositiveExpense() {
        BankTransaction mapped = mapper.toTransaction(transaction("DEBIT", "-42.50", "GROCERIES"), "acc-1", false);

        assertEquals("tl_tx-1", mapped.getId());
        assertEquals("tx-1", mapped.getProviderTransactionId());
        assertEquals("acc-1", mapped.getAccountId());
        assertEquals(new BigDecimal("42.50"), mapped.getAmount());
        assertEquals(TransactionType.EXPENSE, mapped.getType());
        assertEquals("Groceries", mapped.getCategory());
        assertEquals(Instant.parse("2024-02-28T09:15:00Z"), mapped.getDate());
        assertFalse(mapped.isPending());
    }

    @Test
    void testCredit_MapsToIncome() {
        BankTransaction mapped = mapper.toTransaction(transaction("CREDIT", "1500.00", "income"), "acc-1", true);

        assertEquals(TransactionType.INCOME, mapped.getType());
        assertEquals("Income", mapped.getCategory());
        assertTrue(mapped.isPending());
    }

    @Test
    void testMerchantName_PreferredOverDescription() {
        ProviderDTOs.Transaction source = transaction("DEBIT", "3.20", "eating_out");
        source.setMerchantName("Pret A Manger");

        assertEquals("Pret A Manger", mapper.toTransaction(source, "acc-1", false).getDescription());
    }

    @Test
    void testMissingFields_UseDefaults() {
        ProviderDTOs.Transaction source = transaction("DEBIT", null, null);
        source.setCurrency(null);
        source.setTimestamp("not a date");
        source.setDescription(null);

        BankTransaction mapped = mapper.toTransaction(source, "acc-1", false);

        assertEquals(BigDecimal.ZERO, mapped.getAmount());
        assertEquals("GBP", mapped.getCurrency());
        assertEquals("Other", mapped.getCategory());
        assertEquals("Transaction", mapped.getDescription());
        assertEquals(clock.instant(), mapped.getDate());
    }

    @Test
    void testCategoryMapping() {
        assertEquals("Food & Dining", TransactionMapper.mapCategory("Food and Drink"));
        assertEquals("Transport", TransactionMapper.mapCategory("gas_stations"));
        assertEquals("Travel", TransactionMapper.mapCategory("HOLIDAYS"));
        assertEquals("Other", TransactionMapper.mapCategory("something_new"));
        assertEquals("Other", TransactionMapper.mapCategory(" "));
    }

    @Test
    void testBalance_PrefersCurrentOverAvailable() {
        ProviderDTOs.Balance balance = new ProviderDTOs.Balance();
        balance.setAvailable(new BigDecimal("900.00"));
        balance.setCurrent(new BigDecimal("1000.00"));
        balance.setCurrency("EUR");

        AccountBalance mapped = mapper.toBalance(balance, "acc-1");

        assertEquals(new BigDecimal("1000.00"), mapped.getAmount());
        assertEquals(new BigDecimal("900.00"), mapped.getAvailable());
        assertEquals("EUR", mapped.getCurrency());
    }

    @Test
    void testBalance_FallsBackToAvailableThenZero() {
        ProviderDTOs.Balance balance = new ProviderDTOs.Balance();
        balance.setAvailable(new BigDecimal("12.00"));

        assertEquals(new BigDecimal("12.00"), mapper.toBalance(balance, "acc-1").getAmount());
        assertEquals("GBP", mapper.toBalance(balance, "acc-1").getCurrency());

        AccountBalance empty = mapper.toBalance(null, "acc-1");
        assertEquals(BigDecimal.ZERO, empty.getAmount());
    }
}
