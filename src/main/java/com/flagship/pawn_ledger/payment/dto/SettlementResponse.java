package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.loan.dto.LoanResponse;
import com.flagship.pawn_ledger.settlement.SettlementResult;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response for POST /api/payments: the payment and the loan after it.
 */
@Value
public class SettlementResponse {

    @JsonProperty("payment")
    PaymentResponse payment;

    @JsonProperty("loan")
    LoanResponse loan;

    @JsonProperty("is_fully_paid")
    boolean fullyPaid;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    public static SettlementResponse from(SettlementResult result) {
        return new SettlementResponse(
            PaymentResponse.from(result.getPayment()),
            LoanResponse.from(result.getLoan()),
            result.isFullyPaid(),
            result.getRemainingBalance()
        );
    }
}
