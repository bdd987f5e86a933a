package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a settlement: the recorded payment and the loan after it.
 *
 * replayed is true when an earlier payment with the same idempotency key was
 * returned instead of settling again; the loan is then its current state.
 */
@Value
public class SettlementResult {
    Payment payment;
    Loan loan;
    boolean fullyPaid;
    boolean replayed;

    public static SettlementResult settled(Payment payment, Loan loan) {
        return new SettlementResult(payment, loan, loan.isFullyPaid(), false);
    }

    public static SettlementResult replayed(Payment payment, Loan loan) {
        return new SettlementResult(payment, loan, loan.isFullyPaid(), true);
    }

    public BigDecimal getRemainingBalance() {
        return loan.getRemainingBalance();
    }
}
