package com.flagship.pawn_ledger.payment;

import java.util.Locale;

/**
 * Payment status.
 *
 * The settlement engine creates payments as COMPLETED. The only transition
 * it knows is COMPLETED → REVERSED, made once by the reversal engine.
 */
public enum PaymentStatus {
    /**
     * Applied to the loan balances.
     */
    COMPLETED,

    /**
     * Recorded but not yet applied. Not produced by the settlement engine.
     */
    PENDING,

    /**
     * Undone by a reversal. Terminal state.
     */
    REVERSED,

    /**
     * Could not be applied. Terminal state.
     */
    FAILED;

    /**
     * Parses the lowercase wire code ("completed", "reversed", ...).
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static PaymentStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Payment status is required");
        }
        try {
            return PaymentStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid payment status: " + code);
        }
    }
}
