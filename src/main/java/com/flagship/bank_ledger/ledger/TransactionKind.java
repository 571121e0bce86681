package com.flagship.bank_ledger.ledger;

import java.util.Optional;

/**
 * Kind of monetary movement recorded in an account history.
 */
public enum TransactionKind {
    DEPOSIT,
    WITHDRAWAL;

    /**
     * Resolves a kind by name, ignoring case.
     * Returns empty for null or unknown names.
     */
    public static Optional<TransactionKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (TransactionKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
