package com.flagship.pawn_ledger.payment;

import com.flagship.pawn_ledger.settlement.Allocation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Loan payment domain object.
 *
 * Key principles:
 * - Waterfall splits and balance snapshots are written once and never change
 * - The only transition is COMPLETED → REVERSED, via reverse()
 * - State changes are immutable (reverse() returns a new Payment)
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    String paymentNumber;
    UUID branchId;
    UUID loanId;
    UUID customerId;

    BigDecimal amount;
    BigDecimal principalAmount;
    BigDecimal interestAmount;
    BigDecimal lateFeeAmount;

    PaymentMethod paymentMethod;
    String referenceNumber;

    PaymentStatus status;
    Instant paymentDate;

    // Loan balances right after this payment was applied
    BigDecimal loanBalanceAfter;
    BigDecimal interestBalanceAfter;

    Instant reversedAt;
    UUID reversedBy;
    String reversalReason;

    String notes;
    UUID cashSessionId;
    UUID createdBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * The waterfall splits recorded on this payment.
     */
    public Allocation getAllocation() {
        return Allocation.of(lateFeeAmount, interestAmount, principalAmount);
    }

    public boolean isReversed() {
        return status == PaymentStatus.REVERSED;
    }

    public boolean canBeReversed() {
        return status == PaymentStatus.COMPLETED;
    }

    /**
     * Transitions payment to REVERSED status.
     * Only valid from COMPLETED status.
     *
     * @return New Payment instance with REVERSED status and reversal details
     * @throws IllegalStateException if the payment is not COMPLETED
     */
    public Payment reverse(String reason, UUID reversedBy, Instant reversedAt) {
        if (!canBeReversed()) {
            throw new IllegalStateException(
                String.format("Cannot reverse payment in %s status. Only COMPLETED payments can be reversed.",
                    this.status));
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Reversal reason is required");
        }
        return toBuilder()
            .status(PaymentStatus.REVERSED)
            .reversedAt(reversedAt)
            .reversedBy(reversedBy)
            .reversalReason(reason)
            .build();
    }
}
