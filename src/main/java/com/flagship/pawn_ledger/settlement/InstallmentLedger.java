package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.loan.LoanInstallment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Spreads a loan payment over the installment schedule and pulls it back on reversal.
 *
 * Payments fill installments oldest first; reversals empty them newest first,
 * so a reversal of the latest payment restores every installment exactly.
 * Both operations return only the installments they changed.
 */
public final class InstallmentLedger {

    private InstallmentLedger() {
    }

    /**
     * Applies the amount in ascending installment number order, skipping paid installments.
     * Whatever is left once every installment is paid stays undistributed.
     *
     * @param installments the loan's schedule, in any order
     * @param amount full payment amount
     * @param paidAt stamped on installments that become paid
     * @return the changed installments, in installment number order
     */
    public static List<LoanInstallment> distribute(List<LoanInstallment> installments,
                                                   BigDecimal amount,
                                                   Instant paidAt) {
        requirePositive(amount);
        List<LoanInstallment> changed = new ArrayList<>();
        BigDecimal remaining = amount;

        for (LoanInstallment installment : sorted(installments, false)) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (installment.isPaid()) {
                continue;
            }
            BigDecimal due = installment.getRemainingAmount();
            if (due.signum() <= 0) {
                continue;
            }
            BigDecimal applied = remaining.min(due);
            changed.add(installment.applyPayment(applied, paidAt));
            remaining = remaining.subtract(applied);
        }
        return changed;
    }

    /**
     * Pulls the amount back in descending installment number order,
     * skipping installments with nothing paid.
     *
     * @param installments the loan's schedule, in any order
     * @param amount full amount of the reversed payment
     * @return the changed installments, highest installment number first
     */
    public static List<LoanInstallment> reverse(List<LoanInstallment> installments, BigDecimal amount) {
        requirePositive(amount);
        List<LoanInstallment> changed = new ArrayList<>();
        BigDecimal remaining = amount;

        for (LoanInstallment installment : sorted(installments, true)) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (installment.getAmountPaid().signum() <= 0) {
                continue;
            }
            BigDecimal pulled = remaining.min(installment.getAmountPaid());
            changed.add(installment.reversePayment(pulled));
            remaining = remaining.subtract(pulled);
        }
        return changed;
    }

    private static List<LoanInstallment> sorted(List<LoanInstallment> installments, boolean descending) {
        Comparator<LoanInstallment> order = Comparator.comparingInt(LoanInstallment::getInstallmentNumber);
        return installments.stream()
            .sorted(descending ? order.reversed() : order)
            .toList();
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
