package com.flagship.pawn_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.loan.LoanInstallment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class InstallmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("installment_number")
    int installmentNumber;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("is_paid")
    boolean paid;

    @JsonProperty("paid_date")
    Instant paidDate;

    public static InstallmentResponse from(LoanInstallment installment) {
        return new InstallmentResponse(
            installment.getId(),
            installment.getInstallmentNumber(),
            installment.getDueDate(),
            installment.getPrincipalAmount(),
            installment.getInterestAmount(),
            installment.getTotalAmount(),
            installment.getAmountPaid(),
            installment.isPaid(),
            installment.getPaidDate()
        );
    }
}
