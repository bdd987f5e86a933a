package com.flagship.pawn_ledger.payment.exception;

import java.util.UUID;

public class PaymentNotFoundException extends ResourceNotFoundException {

    public PaymentNotFoundException(UUID paymentId) {
        super("Payment", paymentId);
    }
}
