package com.flagship.pawn_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for loan installments.
 */
@Repository
public interface LoanInstallmentRepository extends JpaRepository<LoanInstallmentEntity, UUID> {

    /**
     * Installments of a loan in schedule order (oldest first).
     */
    List<LoanInstallmentEntity> findByLoanIdOrderByInstallmentNumberAsc(UUID loanId);
}
