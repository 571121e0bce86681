package com.flagship.bank_ledger.customer;

import lombok.Value;

import java.time.LocalDate;

/**
 * Identity of an individual customer.
 * The national ID is expected to be already validated.
 */
@Value
public class IndividualIdentity {
    String name;
    LocalDate birthDate;
    String nationalId;
}
