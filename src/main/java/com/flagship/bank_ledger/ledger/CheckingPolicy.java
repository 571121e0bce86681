package com.flagship.bank_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Withdrawal rules of a checking account: a cap on each withdrawal and a
 * maximum number of withdrawals per statement period.
 *
 * The count only looks at withdrawals present in the history, so rejected
 * attempts never use up the allowance.
 */
@Value
public class CheckingPolicy implements WithdrawalPolicy {

    public static final BigDecimal DEFAULT_WITHDRAWAL_LIMIT = new BigDecimal("500");
    public static final int DEFAULT_MAX_WITHDRAWALS = 3;

    BigDecimal withdrawalLimit;
    int maxWithdrawals;

    public CheckingPolicy(BigDecimal withdrawalLimit, int maxWithdrawals) {
        this.withdrawalLimit = Objects.requireNonNull(withdrawalLimit);
        if (withdrawalLimit.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Withdrawal limit must be positive");
        }
        if (maxWithdrawals < 0) {
            throw new IllegalArgumentException("Maximum withdrawals cannot be negative");
        }
        this.maxWithdrawals = maxWithdrawals;
    }

    public static CheckingPolicy defaults() {
        return new CheckingPolicy(DEFAULT_WITHDRAWAL_LIMIT, DEFAULT_MAX_WITHDRAWALS);
    }

    @Override
    public Optional<FailureReason> evaluate(BigDecimal amount, History history) {
        if (amount.compareTo(withdrawalLimit) > 0) {
            return Optional.of(FailureReason.LIMIT_EXCEEDED);
        }
        if (history.count(TransactionKind.WITHDRAWAL) >= maxWithdrawals) {
            return Optional.of(FailureReason.WITHDRAWAL_COUNT_EXCEEDED);
        }
        return Optional.empty();
    }
}
