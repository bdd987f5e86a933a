package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A payment to apply to a loan.
 */
@Value
@Builder
public class SettlePaymentCommand {
    UUID loanId;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    String referenceNumber;
    String notes;
    UUID cashSessionId;
    UUID branchId;
    UUID createdBy;
}
