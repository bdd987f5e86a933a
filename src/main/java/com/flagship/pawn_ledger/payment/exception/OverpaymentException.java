package com.flagship.pawn_ledger.payment.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The payment is larger than late fee + interest + principal still owed.
 */
@Getter
public class OverpaymentException extends SettlementException {

    private final BigDecimal paymentAmount;
    private final BigDecimal totalOwed;

    public OverpaymentException(BigDecimal paymentAmount, BigDecimal totalOwed) {
        super(String.format("Payment amount (%s) exceeds total owed (%s)",
            paymentAmount.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            totalOwed.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        this.paymentAmount = paymentAmount;
        this.totalOwed = totalOwed;
    }
}
