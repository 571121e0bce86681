package com.flagship.bank_ledger.ledger;

import java.math.BigDecimal;

public final class Deposit extends Transaction {

    public Deposit(BigDecimal amount) {
        super(amount);
    }

    public static Deposit of(BigDecimal amount) {
        return new Deposit(amount);
    }

    @Override
    public TransactionKind getKind() {
        return TransactionKind.DEPOSIT;
    }

    @Override
    protected OperationResult execute(Account account) {
        return account.deposit(getAmount());
    }
}
