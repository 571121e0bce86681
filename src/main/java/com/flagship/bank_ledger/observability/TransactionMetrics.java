package com.flagship.bank_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics for bank operations.
 *
 * Metrics exposed:
 * - bank.customers.registered: Counter of registered customers
 * - bank.accounts.opened: Counter of opened accounts
 * - bank.transactions: Counter of deposits and withdrawals, tagged by kind and outcome
 * - bank.operation.latency: Timer per operation
 * - bank.accounts.count: Gauge of accounts held in the session
 */
@Component
public class TransactionMetrics {

    private final MeterRegistry registry;

    private final Counter customersRegistered;
    private final Counter accountsOpened;

    public TransactionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.customersRegistered = Counter.builder("bank.customers.registered")
                .description("Number of customers registered")
                .register(registry);

        this.accountsOpened = Counter.builder("bank.accounts.opened")
                .description("Number of accounts opened")
                .register(registry);
    }

    public void incrementCustomersRegistered() {
        customersRegistered.increment();
    }

    public void incrementAccountsOpened() {
        accountsOpened.increment();
    }

    /**
     * Records a deposit or withdrawal with its outcome.
     * The outcome is "success" or the lower-cased failure reason.
     */
    public void recordTransaction(String kind, String outcome) {
        registry.counter("bank.transactions",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("bank.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Registers a gauge for the number of accounts held by the given state object.
     * The gauge keeps only a weak reference, so the state object must be long-lived.
     */
    public <T> void registerAccountCountGauge(T state, ToDoubleFunction<T> accountCount) {
        registry.gauge("bank.accounts.count", Tags.empty(), state, accountCount);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
