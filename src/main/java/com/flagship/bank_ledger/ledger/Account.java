package com.flagship.bank_ledger.ledger;

import com.flagship.bank_ledger.customer.Customer;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A balance-holding account owned by a customer.
 *
 * The account is the only place the balance changes. Account kinds differ
 * by their {@link WithdrawalPolicy}, not by subclassing.
 *
 * Key invariants:
 * - The balance is never negative
 * - The balance only changes through {@link #deposit} and {@link #withdraw}
 * - Neither operation touches the history; recording is done by the
 *   transaction that applied the change
 */
@Getter
public class Account {

    public static final String DEFAULT_BRANCH_CODE = "0001";

    private final AccountKind kind;
    private final int number;
    private final String branchCode;
    private final Customer customer;
    private final History history;
    private final WithdrawalPolicy withdrawalPolicy;
    private BigDecimal balance = BigDecimal.ZERO;

    public enum AccountKind {
        CHECKING,
        BASIC
    }

    public Account(AccountKind kind, int number, String branchCode, Customer customer,
                   WithdrawalPolicy withdrawalPolicy, History history) {
        this.kind = Objects.requireNonNull(kind);
        this.number = number;
        this.branchCode = Objects.requireNonNull(branchCode);
        this.customer = Objects.requireNonNull(customer);
        this.withdrawalPolicy = Objects.requireNonNull(withdrawalPolicy);
        this.history = Objects.requireNonNull(history);
    }

    /**
     * Opens a checking account at the default branch.
     */
    public static Account checking(Customer customer, int number, CheckingPolicy policy) {
        return checking(customer, number, DEFAULT_BRANCH_CODE, policy);
    }

    public static Account checking(Customer customer, int number, String branchCode, CheckingPolicy policy) {
        return checking(customer, number, branchCode, policy, new History());
    }

    public static Account checking(Customer customer, int number, String branchCode, CheckingPolicy policy,
                                   History history) {
        return new Account(AccountKind.CHECKING, number, branchCode, customer, policy, history);
    }

    /**
     * Opens an account with no withdrawal rules beyond the balance.
     */
    public static Account open(Customer customer, int number) {
        return new Account(AccountKind.BASIC, number, DEFAULT_BRANCH_CODE, customer,
            WithdrawalPolicy.unrestricted(), new History());
    }

    /**
     * Adds the amount to the balance.
     *
     * @return failure with {@link FailureReason#INVALID_AMOUNT} if the amount is not positive
     */
    public OperationResult deposit(BigDecimal amount) {
        if (!isPositive(amount)) {
            return OperationResult.failure(FailureReason.INVALID_AMOUNT);
        }
        balance = balance.add(amount);
        return OperationResult.ok();
    }

    /**
     * Takes the amount from the balance.
     *
     * Checks run in a fixed order: amount, then funds, then the account's
     * withdrawal policy. The first failing check decides the reason.
     */
    public OperationResult withdraw(BigDecimal amount) {
        if (!isPositive(amount)) {
            return OperationResult.failure(FailureReason.INVALID_AMOUNT);
        }
        if (amount.compareTo(balance) > 0) {
            return OperationResult.failure(FailureReason.INSUFFICIENT_FUNDS);
        }
        Optional<FailureReason> refused = withdrawalPolicy.evaluate(amount, history);
        if (refused.isPresent()) {
            return OperationResult.failure(refused.get());
        }
        balance = balance.subtract(amount);
        return OperationResult.ok();
    }

    public String getHolderName() {
        return customer.getDisplayName();
    }

    private static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.compareTo(BigDecimal.ZERO) > 0;
    }

    @Override
    public String toString() {
        return String.format("Branch: %s, Account: %d, Holder: %s", branchCode, number, getHolderName());
    }
}
