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
 * JPA Entity for loan installments.
 * Schedule columns are fixed at loan creation; only payment progress is updatable.
 */
@Entity
@Table(
    name = "loan_installments",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_loan_installments_number", columnNames = {"loan_id", "installment_number"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoanInstallmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "installment_number", nullable = false, updatable = false)
    private int installmentNumber;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "principal_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal principalAmount;

    @Column(name = "interest_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal interestAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "amount_paid", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "is_paid", nullable = false)
    private boolean paid;

    @Column(name = "paid_date")
    private Instant paidDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LoanInstallmentEntity fromDomain(LoanInstallment installment) {
        LoanInstallmentEntity entity = new LoanInstallmentEntity();
        entity.id = installment.getId();
        entity.loanId = installment.getLoanId();
        entity.installmentNumber = installment.getInstallmentNumber();
        entity.dueDate = installment.getDueDate();
        entity.principalAmount = installment.getPrincipalAmount();
        entity.interestAmount = installment.getInterestAmount();
        entity.totalAmount = installment.getTotalAmount();
        entity.updateFromDomain(installment);
        return entity;
    }

    public LoanInstallment toDomain() {
        return new LoanInstallment(
            id,
            loanId,
            installmentNumber,
            dueDate,
            principalAmount,
            interestAmount,
            totalAmount,
            amountPaid,
            paid,
            paidDate
        );
    }

    void updateFromDomain(LoanInstallment installment) {
        this.amountPaid = installment.getAmountPaid();
        this.paid = installment.isPaid();
        this.paidDate = installment.getPaidDate();
    }
}
