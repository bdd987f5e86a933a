package com.flagship.pawn_ledger.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for loan payment persistence.
 *
 * Key design principles:
 * - No @Setter: only the reversal fields can change, through updateFromDomain()
 * - Splits, balance snapshots and parties are updatable = false
 * - Controlled factory: fromDomain() is the only way to create entities
 *
 * Note: Idempotency key is a persistence concern, not a domain concern.
 * It's passed separately in fromDomain() and may be null when the client
 * sent no Idempotency-Key header.
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_loan_id", columnList = "loan_id"),
        @Index(name = "idx_payments_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_number", nullable = false, updatable = false, unique = true, length = 50)
    private String paymentNumber;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "principal_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal principalAmount;

    @Column(name = "interest_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal interestAmount;

    @Column(name = "late_fee_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal lateFeeAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "reference_number", updatable = false, length = 100)
    private String referenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private Instant paymentDate;

    @Column(name = "loan_balance_after", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal loanBalanceAfter;

    @Column(name = "interest_balance_after", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal interestBalanceAfter;

    @Column(name = "reversed_at")
    private Instant reversedAt;

    @Column(name = "reversed_by")
    private UUID reversedBy;

    @Column(name = "reversal_reason")
    private String reversalReason;

    @Column(updatable = false)
    private String notes;

    @Column(name = "cash_session_id", updatable = false)
    private UUID cashSessionId;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

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
     * Controlled factory method to create entity from domain object.
     *
     * @param payment Domain payment object
     * @param idempotencyKey Client idempotency key, or null
     */
    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        PaymentEntity entity = new PaymentEntity();
        entity.id = payment.getId();
        entity.paymentNumber = payment.getPaymentNumber();
        entity.branchId = payment.getBranchId();
        entity.loanId = payment.getLoanId();
        entity.customerId = payment.getCustomerId();
        entity.amount = payment.getAmount();
        entity.principalAmount = payment.getPrincipalAmount();
        entity.interestAmount = payment.getInterestAmount();
        entity.lateFeeAmount = payment.getLateFeeAmount();
        entity.paymentMethod = payment.getPaymentMethod();
        entity.referenceNumber = payment.getReferenceNumber();
        entity.status = payment.getStatus();
        entity.paymentDate = payment.getPaymentDate();
        entity.loanBalanceAfter = payment.getLoanBalanceAfter();
        entity.interestBalanceAfter = payment.getInterestBalanceAfter();
        entity.notes = payment.getNotes();
        entity.cashSessionId = payment.getCashSessionId();
        entity.createdBy = payment.getCreatedBy();
        entity.idempotencyKey = idempotencyKey;
        return entity;
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .paymentNumber(paymentNumber)
            .branchId(branchId)
            .loanId(loanId)
            .customerId(customerId)
            .amount(amount)
            .principalAmount(principalAmount)
            .interestAmount(interestAmount)
            .lateFeeAmount(lateFeeAmount)
            .paymentMethod(paymentMethod)
            .referenceNumber(referenceNumber)
            .status(status)
            .paymentDate(paymentDate)
            .loanBalanceAfter(loanBalanceAfter)
            .interestBalanceAfter(interestBalanceAfter)
            .reversedAt(reversedAt)
            .reversedBy(reversedBy)
            .reversalReason(reversalReason)
            .notes(notes)
            .cashSessionId(cashSessionId)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Updates entity from domain object.
     * Only status and the reversal fields can change after insert.
     */
    void updateFromDomain(Payment payment) {
        this.status = payment.getStatus();
        this.reversedAt = payment.getReversedAt();
        this.reversedBy = payment.getReversedBy();
        this.reversalReason = payment.getReversalReason();
    }
}
