package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.loan.LoanInstallment;
import com.flagship.pawn_ledger.loan.LoanPersistenceService;
import com.flagship.pawn_ledger.outbox.OutboxService;
import com.flagship.pawn_ledger.payment.Payment;
import com.flagship.pawn_ledger.payment.PaymentNumberGenerator;
import com.flagship.pawn_ledger.payment.PaymentPersistenceService;
import com.flagship.pawn_ledger.payment.PaymentStatus;
import com.flagship.pawn_ledger.payment.event.LoanPaymentAppliedEvent;
import com.flagship.pawn_ledger.payment.exception.LoanNotFoundException;
import com.flagship.pawn_ledger.payment.exception.LoanNotPayableException;
import com.flagship.pawn_ledger.payment.exception.OverpaymentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a payment to a loan.
 *
 * One transaction covers the loan row lock, the payment insert, the loan and
 * installment updates and the outbox event. Any failure rolls all of it back,
 * so a rejected call leaves the loan exactly as it was.
 *
 * Steps:
 * 1. Lock the loan row (SELECT ... FOR UPDATE)
 * 2. Return the earlier payment if the idempotency key was already used
 * 3. Reject PAID/CONFISCATED loans and overpayments
 * 4. Split the amount with the allocation waterfall and reduce the balances
 * 5. Store the payment with its splits and the post-payment balances
 * 6. Spread the amount over the installment schedule, if the loan has one
 * 7. Write LoanPaymentApplied to the outbox (customer total, collateral release)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanSettlementEngine {

    public static final String AGGREGATE_TYPE = "Loan";

    private final LoanPersistenceService loanPersistence;
    private final PaymentPersistenceService paymentPersistence;
    private final PaymentNumberGenerator paymentNumberGenerator;
    private final OutboxService outboxService;
    private final Clock clock;

    /**
     * @param command the payment to apply
     * @param idempotencyKey client key, or null for no replay protection
     * @throws LoanNotFoundException if the loan does not exist
     * @throws LoanNotPayableException if the loan is PAID or CONFISCATED
     * @throws OverpaymentException if the amount exceeds the remaining balance
     */
    @Transactional
    public SettlementResult settle(SettlePaymentCommand command, String idempotencyKey) {
        BigDecimal amount = toMoney(command.getAmount());

        Loan loan = loanPersistence.lockById(command.getLoanId())
            .orElseThrow(() -> new LoanNotFoundException(command.getLoanId()));

        Optional<Payment> previous = findPrevious(idempotencyKey, loan.getId());
        if (previous.isPresent()) {
            log.info("Idempotency key {} already settled as payment {}, returning it",
                    idempotencyKey, previous.get().getPaymentNumber());
            return SettlementResult.replayed(previous.get(), loan);
        }

        if (!loan.isPayable()) {
            throw new LoanNotPayableException(loan.getId(), loan.getStatus());
        }
        BigDecimal totalOwed = loan.getRemainingBalance();
        if (amount.compareTo(totalOwed) > 0) {
            throw new OverpaymentException(amount, totalOwed);
        }

        Allocation allocation = AllocationWaterfall.allocate(amount,
            loan.getLateFeeRemaining(), loan.getInterestRemaining(), loan.getPrincipalRemaining());

        Instant now = clock.instant();
        Loan updated = loan.applyPayment(allocation, now, command.getCreatedBy());

        Payment payment = paymentPersistence.save(Payment.builder()
            .id(UUID.randomUUID())
            .paymentNumber(paymentNumberGenerator.next())
            .branchId(command.getBranchId())
            .loanId(loan.getId())
            .customerId(loan.getCustomerId())
            .amount(amount)
            .principalAmount(allocation.getPrincipal())
            .interestAmount(allocation.getInterest())
            .lateFeeAmount(allocation.getLateFee())
            .paymentMethod(command.getPaymentMethod())
            .referenceNumber(command.getReferenceNumber())
            .status(PaymentStatus.COMPLETED)
            .paymentDate(now)
            .loanBalanceAfter(updated.getPrincipalRemaining())
            .interestBalanceAfter(updated.getInterestRemaining())
            .notes(command.getNotes())
            .cashSessionId(command.getCashSessionId())
            .createdBy(command.getCreatedBy())
            .build(), idempotencyKey);

        Loan saved = loanPersistence.update(updated);

        if (saved.usesInstallments()) {
            List<LoanInstallment> changed = InstallmentLedger.distribute(
                loanPersistence.findInstallments(saved.getId()), amount, now);
            loanPersistence.updateInstallments(changed);
            log.debug("Payment {} spread over {} installments", payment.getPaymentNumber(), changed.size());
        }

        outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(),
            LoanPaymentAppliedEvent.EVENT_TYPE, LoanPaymentAppliedEvent.of(payment, saved, now));

        log.info("Applied payment {}: amount={}, lateFee={}, interest={}, principal={}, remaining={}, status={}",
                payment.getPaymentNumber(), amount, allocation.getLateFee(), allocation.getInterest(),
                allocation.getPrincipal(), saved.getRemainingBalance(), saved.getStatus());

        return SettlementResult.settled(payment, saved);
    }

    private Optional<Payment> findPrevious(String idempotencyKey, UUID loanId) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        Optional<Payment> previous = paymentPersistence.findByIdempotencyKey(idempotencyKey);
        previous.ifPresent(payment -> {
            if (!payment.getLoanId().equals(loanId)) {
                throw new IllegalArgumentException(
                    "Idempotency key " + idempotencyKey + " was already used for another loan");
            }
        });
        return previous;
    }

    /**
     * Money carries exactly two decimals; more precision is rejected, not rounded.
     */
    static BigDecimal toMoney(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        try {
            return amount.setScale(2, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Payment amount must have at most 2 decimal places: " + amount);
        }
    }
}
