package com.flagship.pawn_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Filters for listing payments. Null fields do not filter.
 *
 * paidFrom and paidTo are calendar days in the business time zone, both inclusive.
 */
@Value
@Builder
public class PaymentSearchCriteria {
    UUID branchId;
    UUID customerId;
    UUID loanId;
    PaymentStatus status;
    PaymentMethod method;
    LocalDate paidFrom;
    LocalDate paidTo;
}
