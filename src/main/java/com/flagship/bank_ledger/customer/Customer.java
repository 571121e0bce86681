package com.flagship.bank_ledger.customer;

import com.flagship.bank_ledger.ledger.Account;
import com.flagship.bank_ledger.ledger.FailureReason;
import com.flagship.bank_ledger.ledger.OperationResult;
import com.flagship.bank_ledger.ledger.Transaction;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A bank customer: the owner of accounts and the party that authorizes
 * transactions on them.
 *
 * The customer kind selects the identity payload. Individuals carry name,
 * birth date and national ID.
 */
@Getter
public class Customer {

    private final CustomerKind kind;
    private final IndividualIdentity identity;
    private final String address;
    private final List<Account> accounts = new ArrayList<>();

    public enum CustomerKind {
        INDIVIDUAL
    }

    private Customer(CustomerKind kind, IndividualIdentity identity, String address) {
        this.kind = Objects.requireNonNull(kind);
        this.identity = Objects.requireNonNull(identity);
        this.address = address;
    }

    public static Customer individual(String name, LocalDate birthDate, String nationalId, String address) {
        return new Customer(CustomerKind.INDIVIDUAL, new IndividualIdentity(name, birthDate, nationalId), address);
    }

    public String getDisplayName() {
        return identity.getName();
    }

    public String getNationalId() {
        return identity.getNationalId();
    }

    /**
     * Accounts in the order they were added. The returned list is read-only.
     */
    public List<Account> getAccounts() {
        return Collections.unmodifiableList(accounts);
    }

    /**
     * Adds an account to this customer. Uniqueness is up to the caller.
     */
    public void addAccount(Account account) {
        accounts.add(Objects.requireNonNull(account));
    }

    public boolean owns(Account account) {
        return accounts.contains(account);
    }

    public Optional<Account> findAccount(int number) {
        return accounts.stream()
            .filter(account -> account.getNumber() == number)
            .findFirst();
    }

    /**
     * Executes a transaction on one of this customer's accounts.
     *
     * Accounts not owned by this customer are refused with
     * {@link FailureReason#ACCOUNT_NOT_OWNED} and nothing is applied.
     */
    public OperationResult execute(Account account, Transaction transaction) {
        Objects.requireNonNull(transaction);
        if (account == null || !owns(account)) {
            return OperationResult.failure(FailureReason.ACCOUNT_NOT_OWNED);
        }
        return transaction.apply(account);
    }

    @Override
    public String toString() {
        return String.format("Name: %s, National ID: %s, Address: %s",
            identity.getName(), identity.getNationalId(), address);
    }
}
