package com.flagship.bank_ledger.console;

import com.flagship.bank_ledger.bank.Statement;
import com.flagship.bank_ledger.customer.Customer;
import com.flagship.bank_ledger.ledger.Account;
import com.flagship.bank_ledger.ledger.HistoryEntry;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Text layouts printed by the menu.
 */
public final class ConsoleFormatter {

    static final String NO_TRANSACTIONS = "No transactions recorded.";

    private ConsoleFormatter() {
        // Utility class
    }

    public static String money(BigDecimal amount) {
        return "$ " + amount.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    public static String statement(Statement statement) {
        StringBuilder text = new StringBuilder();
        text.append("\n================ STATEMENT ================\n");
        if (statement.isEmpty()) {
            text.append(NO_TRANSACTIONS).append('\n');
        } else {
            for (HistoryEntry entry : statement.getEntries()) {
                text.append('\n')
                    .append(entry.getKind()).append(":\n\t")
                    .append(money(entry.getAmount()));
            }
            text.append('\n');
        }
        text.append("\nBalance:\n\t").append(money(statement.getBalance())).append('\n');
        text.append("===========================================");
        return text.toString();
    }

    public static String account(Account account) {
        return "Branch:\t\t" + account.getBranchCode() + '\n'
            + "Number:\t\t" + account.getNumber() + '\n'
            + "Holder:\t\t" + account.getHolderName() + '\n'
            + "Balance:\t" + money(account.getBalance());
    }

    public static String customer(Customer customer) {
        return String.format("Name: %s, National ID: %s, Address: %s",
            customer.getDisplayName(), customer.getNationalId(), customer.getAddress());
    }
}
