package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.loan.LoanInstallment;
import com.flagship.pawn_ledger.loan.LoanPersistenceService;
import com.flagship.pawn_ledger.loan.LoanStatus;
import com.flagship.pawn_ledger.outbox.OutboxService;
import com.flagship.pawn_ledger.payment.Payment;
import com.flagship.pawn_ledger.payment.PaymentPersistenceService;
import com.flagship.pawn_ledger.payment.event.LoanPaymentReversedEvent;
import com.flagship.pawn_ledger.payment.exception.LoanNotFoundException;
import com.flagship.pawn_ledger.payment.exception.PaymentNotFoundException;
import com.flagship.pawn_ledger.payment.exception.PaymentNotReversibleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Undoes a completed payment.
 *
 * Locks the loan before the payment, the same order settlement uses, so a
 * reversal and a settlement on one loan never deadlock. The payment's
 * recorded splits are added back onto the loan and the installment schedule
 * is emptied newest first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentReversalEngine {

    private final LoanPersistenceService loanPersistence;
    private final PaymentPersistenceService paymentPersistence;
    private final OutboxService outboxService;
    private final Clock clock;

    /**
     * @throws PaymentNotFoundException if the payment does not exist
     * @throws PaymentNotReversibleException if the payment is not COMPLETED
     */
    @Transactional
    public ReversalResult reverse(ReversePaymentCommand command) {
        UUID paymentId = command.getPaymentId();
        if (command.getReason() == null || command.getReason().isBlank()) {
            throw new IllegalArgumentException("Reversal reason is required");
        }

        UUID loanId = paymentPersistence.findLoanIdOf(paymentId)
            .orElseThrow(() -> new PaymentNotFoundException(paymentId));
        Loan loan = loanPersistence.lockById(loanId)
            .orElseThrow(() -> new LoanNotFoundException(loanId));
        Payment payment = paymentPersistence.lockById(paymentId)
            .orElseThrow(() -> new PaymentNotFoundException(paymentId));

        if (!payment.canBeReversed()) {
            throw new PaymentNotReversibleException(paymentId, payment.getStatus());
        }

        Loan restored = loanPersistence.update(loan.reversePayment(payment.getAllocation(), command.getReversedBy()));
        boolean reactivated = loan.getStatus() == LoanStatus.PAID && restored.getStatus() == LoanStatus.ACTIVE;

        if (restored.usesInstallments()) {
            List<LoanInstallment> changed = InstallmentLedger.reverse(
                loanPersistence.findInstallments(loanId), payment.getAmount());
            loanPersistence.updateInstallments(changed);
            log.debug("Reversal of {} pulled back from {} installments", payment.getPaymentNumber(), changed.size());
        }

        Payment reversed = paymentPersistence.update(
            payment.reverse(command.getReason(), command.getReversedBy(), clock.instant()));

        outboxService.saveEvent(LoanSettlementEngine.AGGREGATE_TYPE, loanId,
            LoanPaymentReversedEvent.EVENT_TYPE, LoanPaymentReversedEvent.of(reversed, restored, reactivated));

        log.info("Reversed payment {}: amount={}, remaining={}, status={}, reactivated={}",
                reversed.getPaymentNumber(), reversed.getAmount(), restored.getRemainingBalance(),
                restored.getStatus(), reactivated);

        return new ReversalResult(reversed, restored, reactivated);
    }
}
