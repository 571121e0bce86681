package com.flagship.bank_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context identifying the menu operation being executed.
 *
 * The operation ID is mirrored into the MDC so every log line written while
 * an operation runs can be grouped together.
 */
public final class OperationContext {

    public static final String OPERATION_ID_MDC_KEY = "operationId";
    public static final String ACCOUNT_NUMBER_MDC_KEY = "accountNumber";

    private static final ThreadLocal<String> operationId = new ThreadLocal<>();

    private OperationContext() {
        // Utility class
    }

    /**
     * Gets the current operation ID, or starts a new one if not set.
     */
    public static String getOperationId() {
        String id = operationId.get();
        if (id == null) {
            id = start();
        }
        return id;
    }

    /**
     * Starts a new operation on the current thread and returns its ID.
     */
    public static String start() {
        String id = generateOperationId();
        operationId.set(id);
        MDC.put(OPERATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Clears the operation ID from the current thread and the MDC.
     */
    public static void clear() {
        operationId.remove();
        MDC.remove(OPERATION_ID_MDC_KEY);
        MDC.remove(ACCOUNT_NUMBER_MDC_KEY);
    }

    public static boolean hasOperationId() {
        return operationId.get() != null;
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateOperationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
