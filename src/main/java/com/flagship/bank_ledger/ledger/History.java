package com.flagship.bank_ledger.ledger;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only log of the transactions executed on one account.
 *
 * Key invariants:
 * - Entries are only ever appended, never removed or replaced
 * - Insertion order is preserved
 * - Only applied transactions are recorded, never attempts
 */
public class History {

    private final List<HistoryEntry> entries = new ArrayList<>();
    private final Clock clock;

    public History() {
        this(Clock.systemDefaultZone());
    }

    public History(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Appends an entry stamped with the current time.
     */
    public HistoryEntry record(TransactionKind kind, BigDecimal amount) {
        HistoryEntry entry = new HistoryEntry(
            entries.size() + 1L,
            Objects.requireNonNull(kind),
            Objects.requireNonNull(amount),
            clock.instant()
        );
        entries.add(entry);
        return entry;
    }

    /**
     * All entries in insertion order.
     * Each call to {@code iterator()} starts again from the first entry.
     */
    public Iterable<HistoryEntry> entries() {
        return () -> Collections.unmodifiableList(entries).iterator();
    }

    /**
     * Entries whose kind matches the given name, ignoring case.
     * A null filter returns every entry; an unknown kind name matches nothing.
     */
    public Iterable<HistoryEntry> entries(String kindFilter) {
        if (kindFilter == null) {
            return entries();
        }
        return TransactionKind.fromName(kindFilter)
            .map(this::entries)
            .orElse(List.of());
    }

    public Iterable<HistoryEntry> entries(TransactionKind kind) {
        if (kind == null) {
            return entries();
        }
        return () -> entries.stream()
            .filter(entry -> entry.getKind() == kind)
            .iterator();
    }

    public long count(TransactionKind kind) {
        return entries.stream()
            .filter(entry -> entry.getKind() == kind)
            .count();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
