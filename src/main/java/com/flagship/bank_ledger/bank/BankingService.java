package com.flagship.bank_ledger.bank;

import com.flagship.bank_ledger.customer.Customer;
import com.flagship.bank_ledger.ledger.Account;
import com.flagship.bank_ledger.ledger.OperationResult;
import com.flagship.bank_ledger.ledger.TransactionKind;
import com.flagship.bank_ledger.observability.OperationContext;
import com.flagship.bank_ledger.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Entry point for every bank operation.
 *
 * Delegates to the {@link BankSession} and adds logging and metrics on top.
 * Deposits and withdrawals report business rejections through
 * {@link OperationResult}; lookups and registrations throw
 * {@link BankingException}.
 */
@Service
@Slf4j
public class BankingService {

    private final BankSession session;
    private final TransactionMetrics metrics;

    public BankingService(BankSession session, TransactionMetrics metrics) {
        this.session = session;
        this.metrics = metrics;
        metrics.registerAccountCountGauge(session, BankSession::accountCount);
    }

    public Customer registerCustomer(String name, LocalDate birthDate, String nationalId, String address) {
        try {
            Customer customer = session.registerCustomer(name, birthDate, nationalId, address);
            metrics.incrementCustomersRegistered();
            log.info("Customer registered: name={}", name);
            return customer;
        } catch (BankingException e) {
            log.warn("Customer registration rejected: reason={}", e.getReason());
            throw e;
        }
    }

    public Customer findCustomer(String nationalId) {
        return session.requireCustomer(nationalId);
    }

    public boolean customerExists(String nationalId) {
        return session.findCustomer(nationalId).isPresent();
    }

    public Account openCheckingAccount(String nationalId) {
        Account account = session.openCheckingAccount(nationalId);
        metrics.incrementAccountsOpened();
        log.info("Checking account opened: branch={}, number={}, holder={}",
                account.getBranchCode(), account.getNumber(), account.getHolderName());
        return account;
    }

    public OperationResult deposit(String nationalId, int accountNumber, BigDecimal amount) {
        return move(TransactionKind.DEPOSIT, accountNumber, amount,
                () -> session.deposit(nationalId, accountNumber, amount));
    }

    public OperationResult withdraw(String nationalId, int accountNumber, BigDecimal amount) {
        return move(TransactionKind.WITHDRAWAL, accountNumber, amount,
                () -> session.withdraw(nationalId, accountNumber, amount));
    }

    public Statement statement(String nationalId, int accountNumber) {
        return statement(nationalId, accountNumber, null);
    }

    public Statement statement(String nationalId, int accountNumber, String kindFilter) {
        return session.statement(nationalId, accountNumber, kindFilter);
    }

    public Iterable<Account> listAccounts() {
        return session.accounts();
    }

    public Iterable<Customer> listCustomers() {
        return session.customers();
    }

    private OperationResult move(TransactionKind kind, int accountNumber, BigDecimal amount,
                                 Supplier<OperationResult> operation) {
        MDC.put(OperationContext.ACCOUNT_NUMBER_MDC_KEY, String.valueOf(accountNumber));
        try {
            OperationResult result = operation.get();
            if (result.isSuccess()) {
                metrics.recordTransaction(kind.name(), "success");
                log.info("{} applied: amount={}", kind, amount);
            } else {
                metrics.recordTransaction(kind.name(), result.getFailureReason().name().toLowerCase(Locale.ROOT));
                log.warn("{} rejected: amount={}, reason={}", kind, amount, result.getFailureReason());
            }
            return result;
        } catch (BankingException e) {
            metrics.recordTransaction(kind.name(), e.getReason().name().toLowerCase(Locale.ROOT));
            log.warn("{} rejected: reason={}", kind, e.getReason());
            throw e;
        } finally {
            MDC.remove(OperationContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }
}
