package com.flagship.pawn_ledger.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a payment has been applied to a loan.
 *
 * Consumers add the amount to the customer's running total and, when the
 * loan is now fully paid, release the pawned item.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoanPaymentAppliedEvent implements LoanPaymentEvent {
    UUID eventId;
    UUID paymentId;
    String paymentNumber;
    UUID loanId;
    UUID customerId;
    UUID itemId;
    BigDecimal amount;
    BigDecimal lateFeeAmount;
    BigDecimal interestAmount;
    BigDecimal principalAmount;
    boolean loanFullyPaid;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanPaymentApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanPaymentAppliedEvent of(Payment payment, Loan loan, Instant occurredAt) {
        return new LoanPaymentAppliedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getPaymentNumber(),
            loan.getId(),
            loan.getCustomerId(),
            loan.getItemId(),
            payment.getAmount(),
            payment.getLateFeeAmount(),
            payment.getInterestAmount(),
            payment.getPrincipalAmount(),
            loan.isFullyPaid(),
            occurredAt
        );
    }
}
