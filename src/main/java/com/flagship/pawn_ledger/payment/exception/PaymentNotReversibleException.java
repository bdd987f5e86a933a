package com.flagship.pawn_ledger.payment.exception;

import com.flagship.pawn_ledger.payment.PaymentStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Only COMPLETED payments can be reversed, and only once.
 */
@Getter
public class PaymentNotReversibleException extends SettlementException {

    private final UUID paymentId;
    private final PaymentStatus status;

    public PaymentNotReversibleException(UUID paymentId, PaymentStatus status) {
        super(String.format("Payment %s cannot be reversed in %s status", paymentId, status));
        this.paymentId = paymentId;
        this.status = status;
    }
}
