package com.banklink.cache;

import com.banklink.accounts.LinkedAccount;
import com.banklink.common.exception.BankLinkException;
import com.banklink.provider.AccountBalance;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Attaches cached balances to linked accounts for display.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountBalanceService {

    private final BalanceCache balanceCache;

    /**
     * One entry per account whose balance could be read. Accounts whose fetch
     * fails are left out.
     */
    public List<AccountWithBalance> balancesFor(List<LinkedAccount> accounts, boolean forceRefresh) {
        List<AccountWithBalance> result = new ArrayList<>(accounts.size());
        for (LinkedAccount account : accounts) {
            try {
                CachedValue<AccountBalance> balance = balanceCache.get(
                    account.getConnectionId(), account.getProviderAccountId(), forceRefresh);
                result.add(new AccountWithBalance(
                    account,
                    balance.getPayload().getAmount(),
                    balance.getPayload().getCurrency(),
                    balance.getSource()));
            } catch (BankLinkException e) {
                log.warn("Skipping balance for account {}: {}", account.getId(), e.getCategory());
            }
        }
        return result;
    }

    @Value
    public static class AccountWithBalance {
        LinkedAccount account;
        BigDecimal balance;
        String currency;
        CachedValue.Source source;
    }
}
