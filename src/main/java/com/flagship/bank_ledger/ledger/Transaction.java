package com.flagship.bank_ledger.ledger;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An immutable instruction to move money on an account.
 *
 * Applying a transaction asks the account to change its balance and, only
 * when the account accepts, records the movement in the account history.
 *
 * Invariant: amount is strictly positive. This is checked here at
 * construction and again by the account, independently.
 */
@Getter
public abstract class Transaction {

    private final BigDecimal amount;

    protected Transaction(BigDecimal amount) {
        Objects.requireNonNull(amount, "Amount is required");
        if (amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        this.amount = amount;
    }

    public abstract TransactionKind getKind();

    /**
     * Applies this transaction to the account and records it on success.
     */
    public final OperationResult apply(Account account) {
        OperationResult result = execute(account);
        if (result.isSuccess()) {
            account.getHistory().record(getKind(), amount);
        }
        return result;
    }

    protected abstract OperationResult execute(Account account);

    @Override
    public String toString() {
        return getKind() + "(" + amount.toPlainString() + ")";
    }
}
