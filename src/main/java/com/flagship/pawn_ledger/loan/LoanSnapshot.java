package com.flagship.pawn_ledger.loan;

import lombok.Value;

/**
 * A loan together with its overdue status at the time it was read.
 */
@Value
public class LoanSnapshot {
    Loan loan;
    OverdueStatus overdueStatus;
}
