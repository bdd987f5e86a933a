package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for applying a payment to a loan.
 */
@Value
public class SettlePaymentRequest {

    @NotNull(message = "Loan ID is required")
    @JsonProperty("loan_id")
    UUID loanId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 10, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Payment method is required")
    @Pattern(regexp = "^(cash|card|transfer|check|other)$",
        message = "Payment method must be one of cash, card, transfer, check, other")
    @JsonProperty("payment_method")
    String paymentMethod;

    @Size(max = 100, message = "Reference number must be at most 100 characters")
    @JsonProperty("reference_number")
    String referenceNumber;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    @JsonProperty("notes")
    String notes;

    @JsonProperty("cash_session_id")
    UUID cashSessionId;

    @NotNull(message = "Branch ID is required")
    @JsonProperty("branch_id")
    UUID branchId;

    @NotNull(message = "Created by is required")
    @JsonProperty("created_by")
    UUID createdBy;
}
