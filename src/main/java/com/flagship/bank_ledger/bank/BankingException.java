package com.flagship.bank_ledger.bank;

import com.flagship.bank_ledger.ledger.FailureReason;
import lombok.Getter;

/**
 * Raised by the bank session when a lookup or a registration cannot be done.
 * Recoverable: the console prints the message and returns to the menu.
 */
@Getter
public class BankingException extends RuntimeException {

    private final FailureReason reason;

    public BankingException(FailureReason reason) {
        this(reason, reason.getDefaultMessage());
    }

    public BankingException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
