package com.flagship.bank_ledger.bank;

import com.flagship.bank_ledger.ledger.Account;
import com.flagship.bank_ledger.ledger.HistoryEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of an account's history and balance, taken when requested.
 */
@Value
public class Statement {
    String branchCode;
    int accountNumber;
    String holderName;
    List<HistoryEntry> entries;
    BigDecimal balance;

    public static Statement of(Account account, String kindFilter) {
        List<HistoryEntry> entries = new ArrayList<>();
        account.getHistory().entries(kindFilter).forEach(entries::add);
        return new Statement(
            account.getBranchCode(),
            account.getNumber(),
            account.getHolderName(),
            List.copyOf(entries),
            account.getBalance()
        );
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
