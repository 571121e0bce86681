package com.flagship.bank_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(BankLedgerApplication.class, args);
    }
}
