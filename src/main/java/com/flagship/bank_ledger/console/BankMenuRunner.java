package com.flagship.bank_ledger.console;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the menu on the process console once the application is up.
 * Disable with {@code bank.cli.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "bank.cli.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BankMenuRunner implements CommandLineRunner {

    private final BankMenu menu;

    @Override
    public void run(String... args) {
        log.info("Starting bank console");
        menu.run(ConsoleIO.system(System.in, System.out));
        log.info("Bank console closed");
    }
}
