package com.flagship.pawn_ledger.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for payment persistence operations.
 *
 * This service bridges the domain layer (Payment) and persistence layer (PaymentEntity).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    @Value("${settlement.business-zone:UTC}")
    private String businessZone;

    /**
     * Saves a new payment.
     *
     * @param payment Domain payment object
     * @param idempotencyKey Idempotency key for this payment, or null
     * @return Payment as stored (with timestamps)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment save(Payment payment, String idempotencyKey) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment, idempotencyKey));
        log.debug("Saved payment {} ({}) with idempotency key {}",
                saved.getId(), saved.getPaymentNumber(), idempotencyKey);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByIdempotencyKey(String idempotencyKey) {
        return paymentRepository.findByIdempotencyKey(idempotencyKey).map(PaymentEntity::toDomain);
    }

    /**
     * One page of the payments matching the criteria, in the pageable's sort order.
     */
    @Transactional(readOnly = true)
    public Page<Payment> search(PaymentSearchCriteria criteria, Pageable pageable) {
        return paymentRepository
            .findAll(PaymentSpecifications.matching(criteria, ZoneId.of(businessZone)), pageable)
            .map(PaymentEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<UUID> findLoanIdOf(UUID paymentId) {
        return paymentRepository.findLoanIdById(paymentId);
    }

    /**
     * Loads a payment and holds its row lock until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Payment> lockById(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId).map(PaymentEntity::toDomain);
    }

    /**
     * Writes the status and reversal details of an existing payment.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> new IllegalArgumentException("Payment not found: " + payment.getId()));

        existing.updateFromDomain(payment);

        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }
}
