package com.flagship.pawn_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of the allocation waterfall: how much of a payment goes to each
 * loan balance component. No component is ever negative.
 */
@Value
public class Allocation {
    BigDecimal lateFee;
    BigDecimal interest;
    BigDecimal principal;

    public static Allocation of(BigDecimal lateFee, BigDecimal interest, BigDecimal principal) {
        if (lateFee.signum() < 0 || interest.signum() < 0 || principal.signum() < 0) {
            throw new IllegalArgumentException(
                String.format("Allocation splits must not be negative: lateFee=%s, interest=%s, principal=%s",
                    lateFee, interest, principal));
        }
        return new Allocation(lateFee, interest, principal);
    }

    /**
     * Sum of the three splits.
     */
    public BigDecimal getTotal() {
        return lateFee.add(interest).add(principal);
    }
}
