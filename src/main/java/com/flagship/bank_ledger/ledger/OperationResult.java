package com.flagship.bank_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a deposit or withdrawal.
 *
 * Business rejections are values, not exceptions: a failed result carries
 * the reason so callers (and tests) can tell each rule apart.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult {

    private static final OperationResult OK = new OperationResult(true, null, "Operation completed successfully");

    boolean success;
    FailureReason failureReason;
    String message;

    public static OperationResult ok() {
        return OK;
    }

    public static OperationResult failure(FailureReason reason) {
        return new OperationResult(false, reason, reason.getDefaultMessage());
    }

    /**
     * Checks whether this result failed for the given reason.
     */
    public boolean failedWith(FailureReason reason) {
        return !success && failureReason == reason;
    }
}
