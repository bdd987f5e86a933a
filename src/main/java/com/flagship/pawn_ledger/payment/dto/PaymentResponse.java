package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.payment.Payment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Response DTO for a loan payment.
 */
@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_number")
    String paymentNumber;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("late_fee_amount")
    BigDecimal lateFeeAmount;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("status")
    String status;

    @JsonProperty("payment_date")
    Instant paymentDate;

    @JsonProperty("loan_balance_after")
    BigDecimal loanBalanceAfter;

    @JsonProperty("interest_balance_after")
    BigDecimal interestBalanceAfter;

    @JsonProperty("reversed_at")
    Instant reversedAt;

    @JsonProperty("reversed_by")
    UUID reversedBy;

    @JsonProperty("reversal_reason")
    String reversalReason;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("cash_session_id")
    UUID cashSessionId;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .paymentNumber(payment.getPaymentNumber())
            .loanId(payment.getLoanId())
            .customerId(payment.getCustomerId())
            .branchId(payment.getBranchId())
            .amount(payment.getAmount())
            .lateFeeAmount(payment.getLateFeeAmount())
            .interestAmount(payment.getInterestAmount())
            .principalAmount(payment.getPrincipalAmount())
            .paymentMethod(payment.getPaymentMethod().code())
            .referenceNumber(payment.getReferenceNumber())
            .status(payment.getStatus().name().toLowerCase(Locale.ROOT))
            .paymentDate(payment.getPaymentDate())
            .loanBalanceAfter(payment.getLoanBalanceAfter())
            .interestBalanceAfter(payment.getInterestBalanceAfter())
            .reversedAt(payment.getReversedAt())
            .reversedBy(payment.getReversedBy())
            .reversalReason(payment.getReversalReason())
            .notes(payment.getNotes())
            .cashSessionId(payment.getCashSessionId())
            .createdBy(payment.getCreatedBy())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}
