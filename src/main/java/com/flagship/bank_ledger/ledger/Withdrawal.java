package com.flagship.bank_ledger.ledger;

import java.math.BigDecimal;

public final class Withdrawal extends Transaction {

    public Withdrawal(BigDecimal amount) {
        super(amount);
    }

    public static Withdrawal of(BigDecimal amount) {
        return new Withdrawal(amount);
    }

    @Override
    public TransactionKind getKind() {
        return TransactionKind.WITHDRAWAL;
    }

    @Override
    protected OperationResult execute(Account account) {
        return account.withdraw(getAmount());
    }
}
