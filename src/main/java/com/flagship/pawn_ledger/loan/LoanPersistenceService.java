package com.flagship.pawn_ledger.loan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for loan and installment persistence.
 *
 * Bridges the domain layer (Loan, LoanInstallment) and the JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanPersistenceService {

    private final LoanRepository loanRepository;
    private final LoanInstallmentRepository installmentRepository;
    private final JdbcTemplate jdbcTemplate;

    @Value("${settlement.lock-timeout-ms:5000}")
    private long lockTimeoutMs;

    @Transactional(readOnly = true)
    public Optional<Loan> findById(UUID loanId) {
        return loanRepository.findById(loanId).map(LoanEntity::toDomain);
    }

    /**
     * Loads a loan and holds its row lock until the caller's transaction ends.
     *
     * MANDATORY propagation: a lock taken outside a transaction would be
     * released before the caller gets to write.
     * Waits for the lock are bounded by settlement.lock-timeout-ms for the rest
     * of the transaction (PostgreSQL ignores the JPA lock timeout hint), so a
     * stuck holder surfaces as a PessimisticLockingFailureException.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Loan> lockById(UUID loanId) {
        jdbcTemplate.execute("SET LOCAL lock_timeout = " + lockTimeoutMs);
        return loanRepository.findByIdForUpdate(loanId).map(LoanEntity::toDomain);
    }

    /**
     * Writes the loan's balances, status and paid date.
     *
     * @param loan Domain loan with updated state (must exist)
     * @return Loan as stored
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan update(Loan loan) {
        LoanEntity existing = loanRepository.findById(loan.getId())
            .orElseThrow(() -> new IllegalArgumentException("Loan not found: " + loan.getId()));

        existing.updateFromDomain(loan);

        LoanEntity updated = loanRepository.save(existing);
        log.debug("Updated loan {}: status={}, remaining={}",
                updated.getId(), updated.getStatus(), loan.getRemainingBalance());
        return updated.toDomain();
    }

    /**
     * Installments of a loan ordered by installment number.
     */
    @Transactional(readOnly = true)
    public List<LoanInstallment> findInstallments(UUID loanId) {
        return installmentRepository.findByLoanIdOrderByInstallmentNumberAsc(loanId)
            .stream()
            .map(LoanInstallmentEntity::toDomain)
            .toList();
    }

    /**
     * Writes payment progress of the given installments.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void updateInstallments(List<LoanInstallment> installments) {
        for (LoanInstallment installment : installments) {
            LoanInstallmentEntity existing = installmentRepository.findById(installment.getId())
                .orElseThrow(() -> new IllegalArgumentException(
                    "Installment not found: " + installment.getId()));
            existing.updateFromDomain(installment);
            installmentRepository.save(existing);
        }
        log.debug("Updated {} installments", installments.size());
    }
}
