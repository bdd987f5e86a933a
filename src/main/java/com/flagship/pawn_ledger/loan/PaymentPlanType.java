package com.flagship.pawn_ledger.loan;

/**
 * How the customer repays the loan.
 * Only INSTALLMENTS loans carry an installment ledger.
 */
public enum PaymentPlanType {
    SINGLE,
    MINIMUM_PAYMENT,
    INSTALLMENTS
}
