package com.flagship.pawn_ledger.payment.exception;

import java.util.UUID;

public class LoanNotFoundException extends ResourceNotFoundException {

    public LoanNotFoundException(UUID loanId) {
        super("Loan", loanId);
    }
}
