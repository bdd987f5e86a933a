package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.loan.LoanPersistenceService;
import com.flagship.pawn_ledger.observability.CorrelationContext;
import com.flagship.pawn_ledger.observability.SettlementMetrics;
import com.flagship.pawn_ledger.payment.IdempotencyService;
import com.flagship.pawn_ledger.payment.Payment;
import com.flagship.pawn_ledger.payment.PaymentPersistenceService;
import com.flagship.pawn_ledger.payment.PaymentSearchCriteria;
import com.flagship.pawn_ledger.payment.exception.ConcurrencyConflictException;
import com.flagship.pawn_ledger.payment.exception.LoanNotFoundException;
import com.flagship.pawn_ledger.payment.exception.PaymentNotFoundException;
import com.flagship.pawn_ledger.payment.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for settling, reversing and reading loan payments.
 *
 * Each settle/reverse attempt runs the engine in its own transaction. A lost
 * lock or version race becomes ConcurrencyConflictException and the whole
 * call is retried with backoff (settlement.retry.*); after the last attempt
 * the conflict reaches the caller. Idempotency keys are checked in Redis
 * before any lock is taken.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanPaymentService {

    private final LoanSettlementEngine settlementEngine;
    private final PaymentReversalEngine reversalEngine;
    private final IdempotencyService idempotencyService;
    private final PaymentPersistenceService paymentPersistence;
    private final LoanPersistenceService loanPersistence;
    private final SettlementMetrics metrics;

    @Retryable(
        retryFor = ConcurrencyConflictException.class,
        maxAttemptsExpression = "${settlement.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${settlement.retry.backoff-ms:50}", multiplier = 2)
    )
    public SettlementResult settle(SettlePaymentCommand command, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String method = command.getPaymentMethod() != null ? command.getPaymentMethod().code() : null;
        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, String.valueOf(command.getLoanId()));

        try {
            Optional<SettlementResult> cached = replayFromCache(idempotencyKey, command.getLoanId());
            if (cached.isPresent()) {
                metrics.recordSettlement("replayed", method);
                return cached.get();
            }

            SettlementResult result;
            try {
                result = settlementEngine.settle(command, idempotencyKey);
            } catch (PessimisticLockingFailureException | OptimisticLockingFailureException e) {
                log.warn("Lock conflict settling payment, will retry if attempts remain: {}", e.getMessage());
                throw new ConcurrencyConflictException("loan " + command.getLoanId(), e);
            }

            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, result.getPayment().getId().toString());
            if (result.isReplayed()) {
                metrics.recordSettlement("replayed", method);
            } else {
                metrics.recordSettlement("success", method);
                metrics.recordSettledAmount(result.getPayment().getAmount().doubleValue());
                if (result.isFullyPaid()) {
                    metrics.recordPayoff();
                }
            }
            if (idempotencyKey != null) {
                idempotencyService.remember(idempotencyKey, result.getPayment().getId());
            }

            log.info("Settlement finished: payment={}, remaining={}, fullyPaid={}, replayed={}, duration={}ms",
                    result.getPayment().getPaymentNumber(), result.getRemainingBalance(),
                    result.isFullyPaid(), result.isReplayed(), System.currentTimeMillis() - startTime);
            return result;

        } catch (SettlementException | IllegalArgumentException e) {
            metrics.recordSettlement(outcomeOf(e), method);
            log.warn("Settlement rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordSettlement("error", method);
            log.error("Settlement failed: error={}", e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordLatency("settle", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    @Retryable(
        retryFor = ConcurrencyConflictException.class,
        maxAttemptsExpression = "${settlement.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${settlement.retry.backoff-ms:50}", multiplier = 2)
    )
    public ReversalResult reverse(ReversePaymentCommand command) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, String.valueOf(command.getPaymentId()));

        try {
            ReversalResult result;
            try {
                result = reversalEngine.reverse(command);
            } catch (PessimisticLockingFailureException | OptimisticLockingFailureException e) {
                log.warn("Lock conflict reversing payment, will retry if attempts remain: {}", e.getMessage());
                throw new ConcurrencyConflictException("payment " + command.getPaymentId(), e);
            }

            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, result.getLoan().getId().toString());
            metrics.recordReversal("success");
            log.info("Reversal finished: payment={}, loanStatus={}, duration={}ms",
                    result.getPayment().getPaymentNumber(), result.getLoan().getStatus(),
                    System.currentTimeMillis() - startTime);
            return result;

        } catch (SettlementException | IllegalArgumentException e) {
            metrics.recordReversal(outcomeOf(e));
            log.warn("Reversal rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordReversal("error");
            log.error("Reversal failed: error={}", e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordLatency("reverse", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    public Payment getPayment(UUID paymentId) {
        return paymentPersistence.findById(paymentId)
            .orElseThrow(() -> new PaymentNotFoundException(paymentId));
    }

    /**
     * One page of the payments matching the criteria.
     *
     * @throws LoanNotFoundException if the criteria name a loan that does not exist
     */
    public Page<Payment> searchPayments(PaymentSearchCriteria criteria, Pageable pageable) {
        if (criteria.getLoanId() != null && loanPersistence.findById(criteria.getLoanId()).isEmpty()) {
            throw new LoanNotFoundException(criteria.getLoanId());
        }
        return paymentPersistence.search(criteria, pageable);
    }

    private Optional<SettlementResult> replayFromCache(String idempotencyKey, UUID loanId) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        Optional<Payment> previous = idempotencyService.lookup(idempotencyKey)
            .flatMap(paymentPersistence::findById);
        if (previous.isEmpty()) {
            metrics.recordIdempotencyMiss();
            return Optional.empty();
        }
        metrics.recordIdempotencyHit();
        Payment payment = previous.get();
        if (!payment.getLoanId().equals(loanId)) {
            throw new IllegalArgumentException(
                "Idempotency key " + idempotencyKey + " was already used for another loan");
        }
        Loan loan = loanPersistence.findById(loanId).orElseThrow(() -> new LoanNotFoundException(loanId));
        log.info("Idempotent replay of payment {}", payment.getPaymentNumber());
        return Optional.of(SettlementResult.replayed(payment, loan));
    }

    private static String outcomeOf(RuntimeException e) {
        return e instanceof SettlementException
            ? e.getClass().getSimpleName().replace("Exception", "")
            : "invalid";
    }
}
