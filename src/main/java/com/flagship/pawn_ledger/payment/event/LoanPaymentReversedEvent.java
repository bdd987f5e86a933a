package com.flagship.pawn_ledger.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a completed payment has been reversed.
 *
 * Consumers take the amount off the customer's running total and, when the
 * reversal reopened a paid loan, pledge the item as collateral again.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoanPaymentReversedEvent implements LoanPaymentEvent {
    UUID eventId;
    UUID paymentId;
    String paymentNumber;
    UUID loanId;
    UUID customerId;
    UUID itemId;
    BigDecimal amount;
    boolean loanReactivated;
    String reason;
    UUID reversedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanPaymentReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanPaymentReversedEvent of(Payment reversed, Loan loan, boolean loanReactivated) {
        return new LoanPaymentReversedEvent(
            UUID.randomUUID(),
            reversed.getId(),
            reversed.getPaymentNumber(),
            loan.getId(),
            loan.getCustomerId(),
            loan.getItemId(),
            reversed.getAmount(),
            loanReactivated,
            reversed.getReversalReason(),
            reversed.getReversedBy(),
            reversed.getReversedAt()
        );
    }
}
