package com.flagship.pawn_ledger.loan;

import com.flagship.pawn_ledger.settlement.Allocation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Pawn loan domain object.
 *
 * Key principles:
 * - Balance fields change only through applyPayment() and reversePayment()
 * - No balance can go negative
 * - State changes are immutable (each transition returns a new Loan)
 */
@Value
@Builder(toBuilder = true)
public class Loan {
    UUID id;
    String loanNumber;
    UUID branchId;
    UUID customerId;
    UUID itemId;

    BigDecimal loanAmount;
    BigDecimal principalRemaining;
    BigDecimal interestRemaining;
    BigDecimal lateFeeRemaining;
    BigDecimal amountPaid;

    LoanStatus status;
    LocalDate dueDate;
    int gracePeriodDays;
    Instant paidDate;

    PaymentPlanType paymentPlanType;
    boolean requiresMinimumPayment;
    BigDecimal minimumPaymentAmount;

    UUID updatedBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Outstanding balance: late fee + interest + principal still owed.
     */
    public BigDecimal getRemainingBalance() {
        return principalRemaining.add(interestRemaining).add(lateFeeRemaining);
    }

    public boolean isPayable() {
        return status.acceptsPayments();
    }

    public boolean isFullyPaid() {
        return principalRemaining.signum() == 0
            && interestRemaining.signum() == 0
            && lateFeeRemaining.signum() == 0;
    }

    public boolean usesInstallments() {
        return paymentPlanType == PaymentPlanType.INSTALLMENTS;
    }

    /**
     * Smallest payment that keeps the loan in good standing.
     *
     * Loans without a configured minimum must be paid in full. Otherwise the
     * minimum plus any late fee, capped at the remaining balance.
     */
    public BigDecimal getMinimumPaymentDue() {
        BigDecimal remaining = getRemainingBalance();
        if (!requiresMinimumPayment || minimumPaymentAmount == null || minimumPaymentAmount.signum() <= 0) {
            return remaining;
        }
        if (remaining.compareTo(minimumPaymentAmount) < 0) {
            return remaining;
        }
        return minimumPaymentAmount.add(lateFeeRemaining).min(remaining);
    }

    /**
     * Applies waterfall splits to the balances.
     * Transitions to PAID and stamps the paid date when every balance reaches zero.
     *
     * @param allocation splits computed by the waterfall for this loan's current balances
     * @param paidAt time of the payment
     * @param paidBy user recording the payment
     * @return New Loan with reduced balances
     * @throws IllegalStateException if the loan does not accept payments
     * @throws IllegalArgumentException if a split exceeds the matching balance
     */
    public Loan applyPayment(Allocation allocation, Instant paidAt, UUID paidBy) {
        if (!isPayable()) {
            throw new IllegalStateException(
                String.format("Cannot apply payment to loan %s in %s status", id, status));
        }
        BigDecimal lateFee = subtractWithinBalance(lateFeeRemaining, allocation.getLateFee(), "late fee");
        BigDecimal interest = subtractWithinBalance(interestRemaining, allocation.getInterest(), "interest");
        BigDecimal principal = subtractWithinBalance(principalRemaining, allocation.getPrincipal(), "principal");

        Loan updated = toBuilder()
            .lateFeeRemaining(lateFee)
            .interestRemaining(interest)
            .principalRemaining(principal)
            .amountPaid(amountPaid.add(allocation.getTotal()))
            .updatedBy(paidBy)
            .build();

        if (updated.isFullyPaid()) {
            return updated.toBuilder()
                .status(LoanStatus.PAID)
                .paidDate(paidAt)
                .build();
        }
        return updated;
    }

    /**
     * Restores the splits of a previously applied payment.
     * A PAID loan becomes ACTIVE again and loses its paid date.
     *
     * @param allocation splits recorded on the payment being reversed
     * @param reversedBy user reversing the payment
     * @return New Loan with restored balances
     * @throws IllegalStateException if the reversal would make amount paid negative
     */
    public Loan reversePayment(Allocation allocation, UUID reversedBy) {
        BigDecimal restoredAmountPaid = amountPaid.subtract(allocation.getTotal());
        if (restoredAmountPaid.signum() < 0) {
            throw new IllegalStateException(
                String.format("Reversing %s on loan %s would leave amount paid negative (%s)",
                    allocation.getTotal(), id, amountPaid));
        }

        LoanBuilder builder = toBuilder()
            .lateFeeRemaining(lateFeeRemaining.add(allocation.getLateFee()))
            .interestRemaining(interestRemaining.add(allocation.getInterest()))
            .principalRemaining(principalRemaining.add(allocation.getPrincipal()))
            .amountPaid(restoredAmountPaid)
            .updatedBy(reversedBy);

        if (status == LoanStatus.PAID) {
            builder.status(LoanStatus.ACTIVE).paidDate(null);
        }
        return builder.build();
    }

    private BigDecimal subtractWithinBalance(BigDecimal balance, BigDecimal split, String component) {
        BigDecimal result = balance.subtract(split);
        if (result.signum() < 0) {
            throw new IllegalArgumentException(
                String.format("Split %s exceeds %s remaining %s on loan %s", split, component, balance, id));
        }
        return result;
    }
}
