package com.flagship.pawn_ledger.payment;

import java.util.Locale;

/**
 * How a loan payment was tendered.
 */
public enum PaymentMethod {
    CASH,
    CARD,
    TRANSFER,
    CHECK,
    OTHER;

    /**
     * Parses the lowercase wire code ("cash", "card", ...).
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static PaymentMethod fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Payment method is required");
        }
        try {
            return PaymentMethod.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid payment method: " + code);
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
