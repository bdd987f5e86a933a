package com.flagship.pawn_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.loan.LoanSnapshot;
import com.flagship.pawn_ledger.loan.OverdueStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * Response DTO for a loan's balances and status.
 * The overdue block is present only on GET /api/loans/{id}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoanResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("loan_number")
    String loanNumber;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("loan_amount")
    BigDecimal loanAmount;

    @JsonProperty("principal_remaining")
    BigDecimal principalRemaining;

    @JsonProperty("interest_remaining")
    BigDecimal interestRemaining;

    @JsonProperty("late_fee_remaining")
    BigDecimal lateFeeRemaining;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("status")
    String status;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("grace_period_days")
    int gracePeriodDays;

    @JsonProperty("paid_date")
    Instant paidDate;

    @JsonProperty("payment_plan_type")
    String paymentPlanType;

    @JsonProperty("requires_minimum_payment")
    boolean requiresMinimumPayment;

    @JsonProperty("minimum_payment_amount")
    BigDecimal minimumPaymentAmount;

    @JsonProperty("overdue")
    Overdue overdue;

    @Value
    public static class Overdue {
        @JsonProperty("is_overdue")
        boolean overdue;

        @JsonProperty("in_grace_period")
        boolean inGracePeriod;

        @JsonProperty("days_until_due")
        long daysUntilDue;

        @JsonProperty("days_overdue")
        long daysOverdue;

        static Overdue from(OverdueStatus status) {
            return new Overdue(status.isOverdue(), status.isInGracePeriod(),
                status.getDaysUntilDue(), status.getDaysOverdue());
        }
    }

    public static LoanResponse from(Loan loan) {
        return baseBuilder(loan).build();
    }

    public static LoanResponse from(LoanSnapshot snapshot) {
        return baseBuilder(snapshot.getLoan())
            .overdue(Overdue.from(snapshot.getOverdueStatus()))
            .build();
    }

    private static LoanResponseBuilder baseBuilder(Loan loan) {
        return LoanResponse.builder()
            .id(loan.getId())
            .loanNumber(loan.getLoanNumber())
            .customerId(loan.getCustomerId())
            .itemId(loan.getItemId())
            .branchId(loan.getBranchId())
            .loanAmount(loan.getLoanAmount())
            .principalRemaining(loan.getPrincipalRemaining())
            .interestRemaining(loan.getInterestRemaining())
            .lateFeeRemaining(loan.getLateFeeRemaining())
            .remainingBalance(loan.getRemainingBalance())
            .amountPaid(loan.getAmountPaid())
            .status(loan.getStatus().name().toLowerCase(Locale.ROOT))
            .dueDate(loan.getDueDate())
            .gracePeriodDays(loan.getGracePeriodDays())
            .paidDate(loan.getPaidDate())
            .paymentPlanType(loan.getPaymentPlanType().name().toLowerCase(Locale.ROOT))
            .requiresMinimumPayment(loan.isRequiresMinimumPayment())
            .minimumPaymentAmount(loan.getMinimumPaymentAmount());
    }
}
