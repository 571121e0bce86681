package com.flagship.bank_ledger.ledger;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Account-kind specific rules applied to a withdrawal after the amount and
 * the balance have already been checked.
 */
public interface WithdrawalPolicy {

    /**
     * Evaluates a withdrawal against the policy.
     *
     * @param amount  positive amount already known to be covered by the balance
     * @param history the account history, used to count applied withdrawals
     * @return the reason the withdrawal is refused, or empty if allowed
     */
    Optional<FailureReason> evaluate(BigDecimal amount, History history);

    /**
     * Policy with no limits beyond the balance.
     */
    static WithdrawalPolicy unrestricted() {
        return (amount, history) -> Optional.empty();
    }
}
