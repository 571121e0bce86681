package com.flagship.bank_ledger.console;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The interactive menu loop.
 *
 * Runs one option at a time to completion, then shows the menu again.
 * Stops on "q" or at end of input.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BankMenu {

    static final String GREETING = "\nWelcome! Please choose one of the options below.\n";
    static final String FAREWELL = "\nThank you for banking with us, see you soon!";
    static final String INVALID_OPTION = "\n@@@ Invalid operation, please select a valid option. @@@";

    private static final String MENU = "\n\n================ MENU ================\n"
            + "[d]\tDeposit\n"
            + "[s]\tWithdraw\n"
            + "[e]\tStatement\n"
            + "[nc]\tNew account\n"
            + "[lc]\tList accounts\n"
            + "[nu]\tNew customer\n"
            + "[lu]\tList customers\n"
            + "[q]\tQuit\n"
            + "=> ";

    private final MenuActions actions;

    public void run(ConsoleIO io) {
        io.println(GREETING);
        while (true) {
            String option = io.prompt(MENU);
            if (option == null) {
                log.debug("Input closed, leaving menu");
                return;
            }
            switch (option) {
                case "d" -> actions.deposit(io);
                case "s" -> actions.withdraw(io);
                case "e" -> actions.showStatement(io);
                case "nc" -> actions.createAccount(io);
                case "lc" -> actions.listAccounts(io);
                case "nu" -> actions.createCustomer(io);
                case "lu" -> actions.listCustomers(io);
                case "q" -> {
                    io.println(FAREWELL);
                    return;
                }
                default -> io.println(INVALID_OPTION);
            }
        }
    }
}
