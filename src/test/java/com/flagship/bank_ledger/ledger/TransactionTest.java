package com.flagship.bank_ledger.ledger;

import com.flagship.bank_ledger.customer.Customer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Transaction Tests
 *
 * These tests verify that:
 * - Transactions refuse non-positive amounts at construction
 * - Applied transactions are recorded in the history exactly once
 * - Rejected transactions leave no trace in the history
 */
class TransactionTest {

    private Account account;

    @BeforeEach
    void setUp() {
        Customer customer = Customer.individual("Ana Souza", LocalDate.of(1990, 1, 15), "98765432100", "Rua B, 45");
        account = Account.checking(customer, 1, CheckingPolicy.defaults());
        customer.addAccount(account);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printStep(String action, OperationResult result) {
        System.out.println("STEP   - " + action + " -> " + (result.isSuccess() ? "OK" : result.getFailureReason())
                + " | balance=" + account.getBalance() + ", history=" + account.getHistory().size());
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private OperationResult step(Transaction transaction) {
        OperationResult result = transaction.apply(account);
        printStep(transaction.toString(), result);
        return result;
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                "Expected: " + expected + ", Actual: " + actual);
    }

    @Test
    @DisplayName("Zero amount should be rejected at construction")
    void testZeroAmount_ShouldFail() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> Deposit.of(BigDecimal.ZERO));

        assertTrue(exception.getMessage().contains("positive"));
    }

    @Test
    @DisplayName("Negative amount should be rejected at construction")
    void testNegativeAmount_ShouldFail() {
        assertThrows(IllegalArgumentException.class, () -> Withdrawal.of(new BigDecimal("-1")));
    }

    @Test
    @DisplayName("Null amount should be rejected at construction")
    void testNullAmount_ShouldFail() {
        assertThrows(NullPointerException.class, () -> new Deposit(null));
    }

    @Test
    @DisplayName("Successful deposit records exactly one DEPOSIT entry")
    void testDepositRecordsHistory() {
        OperationResult result = Deposit.of(new BigDecimal("100")).apply(account);

        assertTrue(result.isSuccess());
        assertEquals(1, account.getHistory().size());
        HistoryEntry entry = account.getHistory().entries().iterator().next();
        assertEquals(TransactionKind.DEPOSIT, entry.getKind());
        assertAmount("100", entry.getAmount());
        assertNotNull(entry.getTimestamp());
    }

    @Test
    @DisplayName("Failed withdrawal leaves the history unchanged")
    void testFailedWithdrawalNotRecorded() {
        Deposit.of(new BigDecimal("100")).apply(account);

        OperationResult result = Withdrawal.of(new BigDecimal("150")).apply(account);

        assertTrue(result.failedWith(FailureReason.INSUFFICIENT_FUNDS));
        assertEquals(1, account.getHistory().size());
        assertEquals(0, account.getHistory().count(TransactionKind.WITHDRAWAL));
    }

    @Test
    @DisplayName("Deposit then withdrawal of the same amount restores the balance")
    void testRoundTripRestoresBalance() {
        Deposit.of(new BigDecimal("300")).apply(account);
        BigDecimal before = account.getBalance();

        Deposit.of(new BigDecimal("123.45")).apply(account);
        Withdrawal.of(new BigDecimal("123.45")).apply(account);

        assertAmount(before.toPlainString(), account.getBalance());
    }

    @Test
    @DisplayName("Rejected attempts do not use up the withdrawal allowance")
    void testRejectedAttemptsDoNotCount() {
        Deposit.of(new BigDecimal("1000")).apply(account);

        for (int i = 0; i < 5; i++) {
            assertTrue(Withdrawal.of(new BigDecimal("600")).apply(account)
                    .failedWith(FailureReason.LIMIT_EXCEEDED));
        }

        assertTrue(Withdrawal.of(new BigDecimal("100")).apply(account).isSuccess());
        assertTrue(Withdrawal.of(new BigDecimal("100")).apply(account).isSuccess());
        assertTrue(Withdrawal.of(new BigDecimal("100")).apply(account).isSuccess());
        assertAmount("700", account.getBalance());
    }

    @Test
    @DisplayName("Full scenario: deposits, withdrawals, insufficient funds and withdrawal maximum")
    void testFullScenario() {
        printTestHeader("Checking account scenario");
        List<Integer> historySizes = new ArrayList<>();

        assertTrue(step(Deposit.of(new BigDecimal("1000"))).isSuccess());
        assertAmount("1000", account.getBalance());
        historySizes.add(account.getHistory().size());

        assertTrue(step(Withdrawal.of(new BigDecimal("200"))).isSuccess());
        assertAmount("800", account.getBalance());
        historySizes.add(account.getHistory().size());

        assertTrue(step(Withdrawal.of(new BigDecimal("900"))).failedWith(FailureReason.INSUFFICIENT_FUNDS));
        assertAmount("800", account.getBalance());
        historySizes.add(account.getHistory().size());

        assertTrue(step(Withdrawal.of(new BigDecimal("200"))).isSuccess());
        assertAmount("600", account.getBalance());

        assertTrue(step(Withdrawal.of(new BigDecimal("200"))).isSuccess());
        assertAmount("400", account.getBalance());

        OperationResult fourth = step(Withdrawal.of(new BigDecimal("200")));
        assertTrue(fourth.failedWith(FailureReason.WITHDRAWAL_COUNT_EXCEEDED),
                "Expected WITHDRAWAL_COUNT_EXCEEDED, got " + fourth.getFailureReason());
        assertAmount("400", account.getBalance());

        assertEquals(List.of(1, 2, 2), historySizes);
        assertEquals(4, account.getHistory().size());
        assertEquals(3, account.getHistory().count(TransactionKind.WITHDRAWAL));
        printSuccess("Scenario behaved as expected");
    }
}
