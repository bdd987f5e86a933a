package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payoff or minimum payment amount of a loan.
 */
@Value
public class LoanAmountResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("amount")
    BigDecimal amount;
}
