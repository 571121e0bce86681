package com.flagship.bank_ledger.observability;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a menu operation whose execution time and name are logged.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LoggedOperation {

    /**
     * Operation name used in logs and metrics. Defaults to the method name.
     */
    String value() default "";
}
