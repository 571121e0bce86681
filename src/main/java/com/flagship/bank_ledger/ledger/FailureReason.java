package com.flagship.bank_ledger.ledger;

/**
 * Reasons an operation on the ledger can be rejected.
 *
 * All of them are recoverable: the caller reports the message and carries on.
 */
public enum FailureReason {
    INVALID_AMOUNT("The amount informed is invalid"),
    INSUFFICIENT_FUNDS("Insufficient funds for this withdrawal"),
    LIMIT_EXCEEDED("The withdrawal amount exceeds the account limit"),
    WITHDRAWAL_COUNT_EXCEEDED("Maximum number of withdrawals reached"),
    CUSTOMER_NOT_FOUND("Customer not found"),
    ACCOUNT_NOT_FOUND("Account not found"),
    ACCOUNT_NOT_OWNED("Account does not belong to this customer"),
    DUPLICATE_CUSTOMER("A customer with this national ID already exists"),
    INVALID_NATIONAL_ID("National ID must contain exactly 11 digits");

    private final String defaultMessage;

    FailureReason(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
