package com.flagship.pawn_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One scheduled sub-payment of an installment-plan loan.
 *
 * Invariants:
 * - 0 <= amountPaid <= totalAmount
 * - paid is true iff amountPaid == totalAmount
 */
@Value
public class LoanInstallment {
    UUID id;
    UUID loanId;
    int installmentNumber;
    LocalDate dueDate;
    BigDecimal principalAmount;
    BigDecimal interestAmount;
    BigDecimal totalAmount;
    BigDecimal amountPaid;
    boolean paid;
    Instant paidDate;

    public BigDecimal getRemainingAmount() {
        return totalAmount.subtract(amountPaid);
    }

    /**
     * Credits part of a payment to this installment.
     *
     * @param amount portion of the payment, at most the remaining amount
     * @param paidAt stamped as paid date when the installment is completed
     * @return New LoanInstallment with the amount credited
     */
    public LoanInstallment applyPayment(BigDecimal amount, Instant paidAt) {
        if (amount.signum() <= 0 || amount.compareTo(getRemainingAmount()) > 0) {
            throw new IllegalArgumentException(
                String.format("Cannot apply %s to installment #%d with %s remaining",
                    amount, installmentNumber, getRemainingAmount()));
        }
        BigDecimal newAmountPaid = amountPaid.add(amount);
        boolean completed = newAmountPaid.compareTo(totalAmount) == 0;
        return new LoanInstallment(
            id,
            loanId,
            installmentNumber,
            dueDate,
            principalAmount,
            interestAmount,
            totalAmount,
            newAmountPaid,
            completed,
            completed ? paidAt : paidDate
        );
    }

    /**
     * Pulls back part of a reversed payment from this installment.
     *
     * @param amount portion to pull back, at most the amount paid
     * @return New LoanInstallment, no longer marked paid if it is now short
     */
    public LoanInstallment reversePayment(BigDecimal amount) {
        if (amount.signum() <= 0 || amount.compareTo(amountPaid) > 0) {
            throw new IllegalArgumentException(
                String.format("Cannot reverse %s from installment #%d with %s paid",
                    amount, installmentNumber, amountPaid));
        }
        BigDecimal newAmountPaid = amountPaid.subtract(amount);
        boolean stillPaid = newAmountPaid.compareTo(totalAmount) == 0;
        return new LoanInstallment(
            id,
            loanId,
            installmentNumber,
            dueDate,
            principalAmount,
            interestAmount,
            totalAmount,
            newAmountPaid,
            stillPaid,
            stillPaid ? paidDate : null
        );
    }
}
