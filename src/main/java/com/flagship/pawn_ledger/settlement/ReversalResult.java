package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.payment.Payment;
import lombok.Value;

/**
 * Outcome of a reversal: the REVERSED payment and the restored loan.
 * loanReactivated is true when the reversal turned a PAID loan back to ACTIVE.
 */
@Value
public class ReversalResult {
    Payment payment;
    Loan loan;
    boolean loanReactivated;
}
