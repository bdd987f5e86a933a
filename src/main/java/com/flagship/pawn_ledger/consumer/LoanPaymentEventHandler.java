package com.flagship.pawn_ledger.consumer;

import com.flagship.pawn_ledger.collateral.CollateralService;
import com.flagship.pawn_ledger.customer.CustomerStatsService;
import com.flagship.pawn_ledger.payment.event.LoanPaymentAppliedEvent;
import com.flagship.pawn_ledger.payment.event.LoanPaymentReversedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Side effects of loan payments outside the loan aggregate.
 *
 * Called by LoanPaymentEventConsumer after the idempotency check, inside its
 * transaction. A collateral failure is logged and does not stop the event;
 * a customer update failure propagates so the event is redelivered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanPaymentEventHandler {

    private final CustomerStatsService customerStatsService;
    private final CollateralService collateralService;

    public void onPaymentApplied(LoanPaymentAppliedEvent event) {
        log.info("Handling LoanPaymentApplied: paymentId={}, loanId={}, amount={}, fullyPaid={}",
                event.getPaymentId(), event.getLoanId(), event.getAmount(), event.isLoanFullyPaid());

        customerStatsService.recordPayment(event.getCustomerId(), event.getAmount());

        if (event.isLoanFullyPaid()) {
            try {
                collateralService.release(event.getItemId());
            } catch (RuntimeException e) {
                log.error("Failed to release item {} for paid loan {}: {}",
                        event.getItemId(), event.getLoanId(), e.getMessage());
            }
        }
    }

    public void onPaymentReversed(LoanPaymentReversedEvent event) {
        log.info("Handling LoanPaymentReversed: paymentId={}, loanId={}, amount={}, reactivated={}",
                event.getPaymentId(), event.getLoanId(), event.getAmount(), event.isLoanReactivated());

        customerStatsService.revertPayment(event.getCustomerId(), event.getAmount());

        if (event.isLoanReactivated()) {
            try {
                collateralService.repledge(event.getItemId());
            } catch (RuntimeException e) {
                log.error("Failed to re-pledge item {} for reactivated loan {}: {}",
                        event.getItemId(), event.getLoanId(), e.getMessage());
            }
        }
    }
}
