package com.flagship.pawn_ledger.settlement;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Fixed-priority distribution of a payment across a loan's balances.
 *
 * Priority order is a business rule: late fee first, then interest, then
 * principal. Each step takes the smaller of what is left of the payment and
 * what is owed on that component.
 *
 * The waterfall does not absorb overpayment. Callers must reject payments
 * larger than the total owed before allocating; an amount left over after
 * principal is reported as an error here.
 */
public final class AllocationWaterfall {

    private AllocationWaterfall() {
        // Utility class
    }

    /**
     * Splits a payment into late fee, interest and principal portions.
     *
     * @param paymentAmount amount received, must be positive
     * @param lateFeeRemaining late fee still owed
     * @param interestRemaining interest still owed
     * @param principalRemaining principal still owed
     * @return the three splits, summing to {@code paymentAmount}
     * @throws IllegalArgumentException if an input is negative or the payment exceeds the total owed
     */
    public static Allocation allocate(BigDecimal paymentAmount,
                                      BigDecimal lateFeeRemaining,
                                      BigDecimal interestRemaining,
                                      BigDecimal principalRemaining) {
        Objects.requireNonNull(paymentAmount, "paymentAmount");
        requireNonNegative(lateFeeRemaining, "lateFeeRemaining");
        requireNonNegative(interestRemaining, "interestRemaining");
        requireNonNegative(principalRemaining, "principalRemaining");
        if (paymentAmount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive: " + paymentAmount);
        }

        BigDecimal remaining = paymentAmount;

        BigDecimal lateFee = remaining.min(lateFeeRemaining);
        remaining = remaining.subtract(lateFee);

        BigDecimal interest = remaining.min(interestRemaining);
        remaining = remaining.subtract(interest);

        BigDecimal principal = remaining.min(principalRemaining);
        remaining = remaining.subtract(principal);

        if (remaining.signum() > 0) {
            BigDecimal totalOwed = lateFeeRemaining.add(interestRemaining).add(principalRemaining);
            throw new IllegalArgumentException(
                String.format("Payment amount %s exceeds total owed %s", paymentAmount, totalOwed));
        }

        return Allocation.of(lateFee, interest, principal);
    }

    private static void requireNonNegative(BigDecimal value, String name) {
        Objects.requireNonNull(value, name);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
