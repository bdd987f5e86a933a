package com.flagship.pawn_ledger.payment.exception;

import com.flagship.pawn_ledger.loan.LoanStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * The loan is PAID or CONFISCATED and cannot take another payment.
 */
@Getter
public class LoanNotPayableException extends SettlementException {

    private final UUID loanId;
    private final LoanStatus status;

    public LoanNotPayableException(UUID loanId, LoanStatus status) {
        super(String.format("Loan %s cannot receive payments in %s status", loanId, status));
        this.loanId = loanId;
        this.status = status;
    }
}
