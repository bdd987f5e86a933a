package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.loan.dto.LoanResponse;
import com.flagship.pawn_ledger.settlement.ReversalResult;
import lombok.Value;

@Value
public class ReversalResponse {

    @JsonProperty("payment")
    PaymentResponse payment;

    @JsonProperty("loan")
    LoanResponse loan;

    @JsonProperty("loan_reactivated")
    boolean loanReactivated;

    public static ReversalResponse from(ReversalResult result) {
        return new ReversalResponse(
            PaymentResponse.from(result.getPayment()),
            LoanResponse.from(result.getLoan()),
            result.isLoanReactivated()
        );
    }
}
