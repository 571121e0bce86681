package com.flagship.bank_ledger.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TransactionMetricsTest {

    private SimpleMeterRegistry registry;
    private TransactionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TransactionMetrics(registry);
    }

    @Test
    @DisplayName("Transaction counter is tagged with sanitized kind and outcome")
    void testTransactionTags() {
        metrics.recordTransaction("DEPOSIT", "success");
        metrics.recordTransaction("DEPOSIT", "success");
        metrics.recordTransaction("Withdrawal", "limit exceeded!");
        metrics.recordTransaction(null, null);

        assertEquals(2.0, registry.get("bank.transactions")
                .tag("kind", "deposit").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.get("bank.transactions")
                .tag("kind", "withdrawal").tag("outcome", "limit_exceeded_").counter().count());
        assertEquals(1.0, registry.get("bank.transactions")
                .tag("kind", "unknown").tag("outcome", "unknown").counter().count());
    }

    @Test
    @DisplayName("Lifecycle counters and latency timer")
    void testCountersAndTimer() {
        metrics.incrementCustomersRegistered();
        metrics.incrementAccountsOpened();
        metrics.incrementAccountsOpened();
        metrics.recordOperationLatency("deposit", 15);

        assertEquals(1.0, registry.get("bank.customers.registered").counter().count());
        assertEquals(2.0, registry.get("bank.accounts.opened").counter().count());
        assertEquals(1, registry.get("bank.operation.latency").tag("operation", "deposit").timer().count());
        assertEquals(15.0, registry.get("bank.operation.latency").timer().totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("Account gauge follows its state object")
    void testAccountGauge() {
        AtomicInteger accounts = new AtomicInteger(2);
        metrics.registerAccountCountGauge(accounts, AtomicInteger::get);

        accounts.incrementAndGet();

        assertEquals(3.0, registry.get("bank.accounts.count").gauge().value());
    }

    @Test
    @DisplayName("Operation context is mirrored into the MDC and cleared")
    void testOperationContext() {
        String id = OperationContext.start();

        assertTrue(OperationContext.hasOperationId());
        assertEquals(id, OperationContext.getOperationId());
        assertEquals(id, MDC.get(OperationContext.OPERATION_ID_MDC_KEY));
        assertEquals(8, id.length());

        OperationContext.clear();

        assertFalse(OperationContext.hasOperationId());
        assertNull(MDC.get(OperationContext.OPERATION_ID_MDC_KEY));
    }
}
