package com.flagship.pawn_ledger.loan;

import lombok.Value;

/**
 * Point-in-time overdue snapshot of a loan, for reporting only.
 */
@Value
public class OverdueStatus {
    boolean overdue;
    boolean inGracePeriod;
    long daysUntilDue;
    long daysOverdue;
}
