package com.flagship.pawn_ledger.loan;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for loan persistence.
 */
@Repository
public interface LoanRepository extends JpaRepository<LoanEntity, UUID> {

    /**
     * Loads a loan holding a row lock (SELECT ... FOR UPDATE) until the
     * surrounding transaction ends. Every settlement and reversal goes
     * through this method so that mutations of one loan are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanEntity l WHERE l.id = :id")
    Optional<LoanEntity> findByIdForUpdate(@Param("id") UUID id);
}
