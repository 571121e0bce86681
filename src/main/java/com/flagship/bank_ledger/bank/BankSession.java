package com.flagship.bank_ledger.bank;

import com.flagship.bank_ledger.customer.Customer;
import com.flagship.bank_ledger.customer.NationalIds;
import com.flagship.bank_ledger.ledger.Account;
import com.flagship.bank_ledger.ledger.CheckingPolicy;
import com.flagship.bank_ledger.ledger.Deposit;
import com.flagship.bank_ledger.ledger.FailureReason;
import com.flagship.bank_ledger.ledger.History;
import com.flagship.bank_ledger.ledger.OperationResult;
import com.flagship.bank_ledger.ledger.Transaction;
import com.flagship.bank_ledger.ledger.Withdrawal;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * In-memory store of the customers and accounts of one running bank.
 *
 * Key invariants:
 * - A national ID identifies at most one customer
 * - Account numbers are assigned sequentially, starting at 1
 * - Customers and accounts are never removed
 *
 * Not thread-safe: operations are expected to run one at a time.
 */
public class BankSession {

    private final String branchCode;
    private final CheckingPolicy checkingPolicy;
    private final Clock clock;
    private final List<Customer> customers = new ArrayList<>();
    private final List<Account> accounts = new ArrayList<>();

    public BankSession(String branchCode, CheckingPolicy checkingPolicy) {
        this(branchCode, checkingPolicy, Clock.systemDefaultZone());
    }

    /**
     * @param clock stamps the history entries of every account opened in this session
     */
    public BankSession(String branchCode, CheckingPolicy checkingPolicy, Clock clock) {
        this.branchCode = Objects.requireNonNull(branchCode);
        this.checkingPolicy = Objects.requireNonNull(checkingPolicy);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Registers an individual customer.
     *
     * @throws BankingException with {@link FailureReason#INVALID_NATIONAL_ID} if the ID is not 11 digits,
     *                          or {@link FailureReason#DUPLICATE_CUSTOMER} if it is already registered
     */
    public Customer registerCustomer(String name, LocalDate birthDate, String nationalId, String address) {
        if (!NationalIds.isValid(nationalId)) {
            throw new BankingException(FailureReason.INVALID_NATIONAL_ID);
        }
        if (findCustomer(nationalId).isPresent()) {
            throw new BankingException(FailureReason.DUPLICATE_CUSTOMER);
        }
        Customer customer = Customer.individual(name, birthDate, nationalId, address);
        customers.add(customer);
        return customer;
    }

    public Optional<Customer> findCustomer(String nationalId) {
        if (nationalId == null) {
            return Optional.empty();
        }
        return customers.stream()
            .filter(customer -> customer.getNationalId().equals(nationalId))
            .findFirst();
    }

    public Customer requireCustomer(String nationalId) {
        return findCustomer(nationalId)
            .orElseThrow(() -> new BankingException(FailureReason.CUSTOMER_NOT_FOUND));
    }

    /**
     * Opens a checking account for an existing customer, numbered after the
     * last account opened in this session.
     */
    public Account openCheckingAccount(String nationalId) {
        Customer customer = requireCustomer(nationalId);
        Account account = Account.checking(customer, accounts.size() + 1, branchCode, checkingPolicy,
            new History(clock));
        accounts.add(account);
        customer.addAccount(account);
        return account;
    }

    /**
     * Looks up an account among the accounts of the given customer.
     */
    public Account requireAccount(String nationalId, int accountNumber) {
        Customer customer = requireCustomer(nationalId);
        return customer.findAccount(accountNumber)
            .orElseThrow(() -> new BankingException(FailureReason.ACCOUNT_NOT_FOUND,
                String.format("Account %d not found for this customer", accountNumber)));
    }

    public OperationResult deposit(String nationalId, int accountNumber, BigDecimal amount) {
        return execute(nationalId, accountNumber, amount, Deposit::new);
    }

    public OperationResult withdraw(String nationalId, int accountNumber, BigDecimal amount) {
        return execute(nationalId, accountNumber, amount, Withdrawal::new);
    }

    public Statement statement(String nationalId, int accountNumber, String kindFilter) {
        return Statement.of(requireAccount(nationalId, accountNumber), kindFilter);
    }

    /**
     * Every account, in the order it was opened. Restartable.
     */
    public Iterable<Account> accounts() {
        return () -> Collections.unmodifiableList(accounts).iterator();
    }

    /**
     * Every customer, in registration order. Restartable.
     */
    public Iterable<Customer> customers() {
        return () -> Collections.unmodifiableList(customers).iterator();
    }

    public int accountCount() {
        return accounts.size();
    }

    public int customerCount() {
        return customers.size();
    }

    public String getBranchCode() {
        return branchCode;
    }

    private OperationResult execute(String nationalId, int accountNumber, BigDecimal amount,
                                    Function<BigDecimal, Transaction> factory) {
        Customer customer = requireCustomer(nationalId);
        Account account = requireAccount(nationalId, accountNumber);
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            return OperationResult.failure(FailureReason.INVALID_AMOUNT);
        }
        return customer.execute(account, factory.apply(amount));
    }
}
