package com.flagship.bank_ledger.config;

import com.flagship.bank_ledger.bank.BankSession;
import com.flagship.bank_ledger.ledger.CheckingPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Wiring for the in-memory bank.
 *
 * Settings (application.yml):
 * - bank.branch-code: branch every account is opened at
 * - bank.checking.withdrawal-limit: cap on a single checking withdrawal
 * - bank.checking.max-withdrawals: withdrawals allowed per statement period
 */
@Configuration
public class BankConfig {

    @Value("${bank.branch-code:0001}")
    private String branchCode;

    @Value("${bank.checking.withdrawal-limit:500}")
    private BigDecimal withdrawalLimit;

    @Value("${bank.checking.max-withdrawals:3}")
    private int maxWithdrawals;

    @Bean
    public CheckingPolicy checkingPolicy() {
        return new CheckingPolicy(withdrawalLimit, maxWithdrawals);
    }

    @Bean
    public BankSession bankSession(CheckingPolicy checkingPolicy, Clock clock) {
        return new BankSession(branchCode, checkingPolicy, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
