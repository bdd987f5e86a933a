package com.flagship.pawn_ledger.loan;

/**
 * Lifecycle status of a pawn loan.
 *
 * Only the settlement and reversal engines move a loan between ACTIVE/OVERDUE
 * and PAID. The other transitions belong to external processes (scheduler,
 * renewal, confiscation).
 */
public enum LoanStatus {
    /**
     * Loan is running and accepts payments.
     */
    ACTIVE,

    /**
     * Past due date. Set by the overdue scheduler; still accepts payments.
     */
    OVERDUE,

    /**
     * All balances are zero. Rejects further payments.
     * Can return to ACTIVE only through a payment reversal.
     */
    PAID,

    /**
     * Past grace period, pending confiscation. Still accepts payments.
     */
    DEFAULTED,

    /**
     * Extended into a new loan.
     */
    RENEWED,

    /**
     * Collateral kept by the shop. Rejects payments.
     */
    CONFISCATED;

    /**
     * Whether a loan in this status may receive a new payment.
     */
    public boolean acceptsPayments() {
        return this != PAID && this != CONFISCATED;
    }
}
