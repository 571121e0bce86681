package com.flagship.bank_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single executed transaction in an account history.
 * Entries are immutable once recorded.
 */
@Value
public class HistoryEntry {
    long sequenceNumber;
    TransactionKind kind;
    BigDecimal amount;
    Instant timestamp;
}
