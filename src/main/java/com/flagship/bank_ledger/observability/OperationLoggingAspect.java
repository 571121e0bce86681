package com.flagship.bank_ledger.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Logs each {@link LoggedOperation} with the time it ran, its name and how
 * long it took. Each call runs inside its own {@link OperationContext}.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class OperationLoggingAspect {

    private final TransactionMetrics metrics;
    private final Clock clock;

    @Around("@annotation(loggedOperation)")
    public Object logAround(ProceedingJoinPoint joinPoint, LoggedOperation loggedOperation) throws Throwable {
        String operation = loggedOperation.value().isEmpty()
                ? joinPoint.getSignature().getName()
                : loggedOperation.value();
        long start = System.currentTimeMillis();
        OperationContext.start();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - start;
            metrics.recordOperationLatency(operation, duration);
            log.info("{}: {} ({}ms)", LocalDateTime.now(clock), operation.toUpperCase(Locale.ROOT), duration);
            return result;
        } catch (Throwable e) {
            long duration = System.currentTimeMillis() - start;
            metrics.recordOperationLatency(operation, duration);
            log.error("{}: {} failed after {}ms | {}", LocalDateTime.now(clock),
                    operation.toUpperCase(Locale.ROOT), duration, e.getMessage());
            throw e;
        } finally {
            OperationContext.clear();
        }
    }
}
