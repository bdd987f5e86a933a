package com.flagship.pawn_ledger.loan;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA Entity for loan persistence.
 *
 * Key design principles:
 * - No @Setter: balances change only through updateFromDomain()
 * - Identity, parties, collateral and original amount are updatable = false
 * - @Version guards against lost updates if a writer bypasses the row lock
 */
@Entity
@Table(
    name = "loans",
    indexes = {
        @Index(name = "idx_loans_customer_id", columnList = "customer_id"),
        @Index(name = "idx_loans_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_number", nullable = false, updatable = false, unique = true, length = 50)
    private String loanNumber;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "loan_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal loanAmount;

    @Column(name = "principal_remaining", nullable = false, precision = 12, scale = 2)
    private BigDecimal principalRemaining;

    @Column(name = "interest_remaining", nullable = false, precision = 12, scale = 2)
    private BigDecimal interestRemaining;

    @Column(name = "late_fee_remaining", nullable = false, precision = 12, scale = 2)
    private BigDecimal lateFeeRemaining;

    @Column(name = "amount_paid", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LoanStatus status;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "grace_period_days", nullable = false)
    private int gracePeriodDays;

    @Column(name = "paid_date")
    private Instant paidDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_plan_type", nullable = false, length = 20)
    private PaymentPlanType paymentPlanType;

    @Column(name = "requires_minimum_payment", nullable = false)
    private boolean requiresMinimumPayment;

    @Column(name = "minimum_payment_amount", precision = 12, scale = 2)
    private BigDecimal minimumPaymentAmount;

    @Column(name = "updated_by")
    private UUID updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory used when a loan is first stored.
     */
    static LoanEntity fromDomain(Loan loan) {
        LoanEntity entity = new LoanEntity();
        entity.id = loan.getId();
        entity.loanNumber = loan.getLoanNumber();
        entity.branchId = loan.getBranchId();
        entity.customerId = loan.getCustomerId();
        entity.itemId = loan.getItemId();
        entity.loanAmount = loan.getLoanAmount();
        entity.dueDate = loan.getDueDate();
        entity.gracePeriodDays = loan.getGracePeriodDays();
        entity.paymentPlanType = loan.getPaymentPlanType();
        entity.requiresMinimumPayment = loan.isRequiresMinimumPayment();
        entity.minimumPaymentAmount = loan.getMinimumPaymentAmount();
        entity.updateFromDomain(loan);
        return entity;
    }

    public Loan toDomain() {
        return Loan.builder()
            .id(id)
            .loanNumber(loanNumber)
            .branchId(branchId)
            .customerId(customerId)
            .itemId(itemId)
            .loanAmount(loanAmount)
            .principalRemaining(principalRemaining)
            .interestRemaining(interestRemaining)
            .lateFeeRemaining(lateFeeRemaining)
            .amountPaid(amountPaid)
            .status(status)
            .dueDate(dueDate)
            .gracePeriodDays(gracePeriodDays)
            .paidDate(paidDate)
            .paymentPlanType(paymentPlanType)
            .requiresMinimumPayment(requiresMinimumPayment)
            .minimumPaymentAmount(minimumPaymentAmount)
            .updatedBy(updatedBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable state (balances, status, paid date) from the domain object.
     * Terms of the loan are never touched here.
     */
    void updateFromDomain(Loan loan) {
        this.principalRemaining = loan.getPrincipalRemaining();
        this.interestRemaining = loan.getInterestRemaining();
        this.lateFeeRemaining = loan.getLateFeeRemaining();
        this.amountPaid = loan.getAmountPaid();
        this.status = loan.getStatus();
        this.paidDate = loan.getPaidDate();
        this.updatedBy = loan.getUpdatedBy();
    }
}
