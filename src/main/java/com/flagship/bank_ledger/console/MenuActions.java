package com.flagship.bank_ledger.console;

import com.flagship.bank_ledger.bank.BankingException;
import com.flagship.bank_ledger.bank.BankingService;
import com.flagship.bank_ledger.bank.Statement;
import com.flagship.bank_ledger.customer.Customer;
import com.flagship.bank_ledger.customer.NationalIds;
import com.flagship.bank_ledger.ledger.Account;
import com.flagship.bank_ledger.ledger.FailureReason;
import com.flagship.bank_ledger.ledger.OperationResult;
import com.flagship.bank_ledger.observability.LoggedOperation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * The operations behind each menu option. Every method reads what it needs
 * from the console, calls the {@link BankingService} and prints the outcome.
 * Failures are printed and never propagate back to the menu loop.
 */
@Component
@RequiredArgsConstructor
public class MenuActions {

    static final DateTimeFormatter BIRTH_DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    static final int MAX_AMOUNT_DIGITS = 15;
    private static final int MAX_AMOUNT_INPUT_SCALE = 10;

    private final BankingService bankingService;

    @LoggedOperation("deposit")
    public void deposit(ConsoleIO io) {
        Customer customer = findCustomer(io);
        if (customer == null) {
            return;
        }
        BigDecimal amount = readAmount(io);
        if (amount == null) {
            return;
        }
        Account account = chooseAccount(io, customer);
        if (account == null) {
            return;
        }
        report(io, bankingService.deposit(customer.getNationalId(), account.getNumber(), amount),
            "Deposit completed successfully!");
    }

    @LoggedOperation("withdraw")
    public void withdraw(ConsoleIO io) {
        Customer customer = findCustomer(io);
        if (customer == null) {
            return;
        }
        BigDecimal amount = readAmount(io);
        if (amount == null) {
            return;
        }
        Account account = chooseAccount(io, customer);
        if (account == null) {
            return;
        }
        report(io, bankingService.withdraw(customer.getNationalId(), account.getNumber(), amount),
            "Withdrawal completed successfully!");
    }

    @LoggedOperation("statement")
    public void showStatement(ConsoleIO io) {
        Customer customer = findCustomer(io);
        if (customer == null) {
            return;
        }
        Account account = chooseAccount(io, customer);
        if (account == null) {
            return;
        }
        Statement statement = bankingService.statement(customer.getNationalId(), account.getNumber());
        io.println(ConsoleFormatter.statement(statement));
    }

    @LoggedOperation("create_customer")
    public void createCustomer(ConsoleIO io) {
        String nationalId = io.prompt("National ID (digits only): ");
        if (!NationalIds.isValid(nationalId)) {
            fail(io, FailureReason.INVALID_NATIONAL_ID.getDefaultMessage());
            return;
        }
        if (bankingService.customerExists(nationalId)) {
            fail(io, FailureReason.DUPLICATE_CUSTOMER.getDefaultMessage());
            return;
        }

        String name = io.prompt("Full name: ");
        String birthDateText = io.prompt("Birth date (dd-mm-yyyy): ");
        LocalDate birthDate;
        try {
            birthDate = LocalDate.parse(birthDateText == null ? "" : birthDateText, BIRTH_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            fail(io, "Invalid birth date, expected dd-mm-yyyy");
            return;
        }
        String address = io.prompt("Address (street, number - district - city/state): ");

        try {
            bankingService.registerCustomer(name, birthDate, nationalId, address);
            io.println("\n=== Customer created successfully! ===");
        } catch (BankingException e) {
            fail(io, e.getMessage());
        }
    }

    @LoggedOperation("create_account")
    public void createAccount(ConsoleIO io) {
        String nationalId = io.prompt("Customer national ID: ");
        try {
            Account account = bankingService.openCheckingAccount(nationalId);
            io.println(String.format("\n=== Account %d created successfully! ===", account.getNumber()));
        } catch (BankingException e) {
            fail(io, e.getMessage());
        }
    }

    public void listAccounts(ConsoleIO io) {
        boolean any = false;
        for (Account account : bankingService.listAccounts()) {
            any = true;
            io.println("=".repeat(100));
            io.println(ConsoleFormatter.account(account));
        }
        if (!any) {
            io.println("\nNo accounts registered.");
        }
    }

    public void listCustomers(ConsoleIO io) {
        io.println("\n========== Customers ==========");
        for (Customer customer : bankingService.listCustomers()) {
            io.println(ConsoleFormatter.customer(customer));
        }
        io.println("===============================");
    }

    private Customer findCustomer(ConsoleIO io) {
        String nationalId = io.prompt("Customer national ID: ");
        try {
            return bankingService.findCustomer(nationalId);
        } catch (BankingException e) {
            fail(io, e.getMessage());
            return null;
        }
    }

    /**
     * Reads a strictly positive amount rounded to cents. Prints why and returns null otherwise.
     * At most {@link #MAX_AMOUNT_DIGITS} integer digits are accepted.
     */
    private BigDecimal readAmount(ConsoleIO io) {
        String text = io.prompt("Amount: ");
        BigDecimal amount;
        try {
            BigDecimal parsed = new BigDecimal(text == null ? "" : text);
            if (parsed.precision() - parsed.scale() > MAX_AMOUNT_DIGITS || parsed.scale() > MAX_AMOUNT_INPUT_SCALE) {
                fail(io, FailureReason.INVALID_AMOUNT.getDefaultMessage());
                return null;
            }
            amount = parsed.setScale(2, RoundingMode.HALF_EVEN);
        } catch (NumberFormatException | ArithmeticException e) {
            fail(io, "Invalid amount, please try again");
            return null;
        }
        if (amount.compareTo(BigDecimal.ZERO) <= 0) {
            fail(io, FailureReason.INVALID_AMOUNT.getDefaultMessage());
            return null;
        }
        return amount;
    }

    /**
     * Picks the account to operate on: the only one, or the one the user selects by index.
     */
    private Account chooseAccount(ConsoleIO io, Customer customer) {
        List<Account> accounts = customer.getAccounts();
        if (accounts.isEmpty()) {
            fail(io, "Customer has no account!");
            return null;
        }
        if (accounts.size() == 1) {
            return accounts.get(0);
        }

        io.println("\nChoose the account:");
        for (int i = 0; i < accounts.size(); i++) {
            Account account = accounts.get(i);
            io.println(String.format("%d - Branch: %s, Number: %d", i, account.getBranchCode(), account.getNumber()));
        }
        String choice = io.prompt("Account index: ");
        int index;
        try {
            index = Integer.parseInt(choice == null ? "" : choice);
        } catch (NumberFormatException e) {
            fail(io, "Invalid account index");
            return null;
        }
        if (index < 0 || index >= accounts.size()) {
            fail(io, FailureReason.ACCOUNT_NOT_FOUND.getDefaultMessage());
            return null;
        }
        return accounts.get(index);
    }

    private void report(ConsoleIO io, OperationResult result, String successMessage) {
        if (result.isSuccess()) {
            io.println("\n=== " + successMessage + " ===");
        } else {
            fail(io, result.getMessage());
        }
    }

    private void fail(ConsoleIO io, String message) {
        io.println("\n@@@ Operation failed! " + message + ". @@@");
    }
}
