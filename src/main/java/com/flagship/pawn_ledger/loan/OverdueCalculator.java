package com.flagship.pawn_ledger.loan;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Date arithmetic for due dates and grace periods.
 *
 * A due date is a calendar day; it is taken to start at midnight in the
 * business time zone. Overdue-ness is a transition trigger for the external
 * scheduler: a loan already classified OVERDUE, DEFAULTED or PAID reports
 * false. Nothing here changes loan status.
 */
@Component
public class OverdueCalculator {

    private static final long HOURS_PER_DAY = 24;

    private final Clock clock;
    private final ZoneId businessZone;

    public OverdueCalculator(Clock clock,
                             @Value("${settlement.business-zone:UTC}") String businessZone) {
        this.clock = clock;
        this.businessZone = ZoneId.of(businessZone);
    }

    /**
     * Evaluates the loan against the current time.
     */
    public OverdueStatus evaluate(Loan loan) {
        ZonedDateTime due = loan.getDueDate().atStartOfDay(businessZone);
        Instant now = clock.instant();
        return new OverdueStatus(
            isOverdue(loan.getStatus(), due, now),
            isInGracePeriod(loan.getStatus(), due, loan.getGracePeriodDays(), now),
            daysUntilDue(due, now),
            daysOverdue(loan.getStatus(), due, now)
        );
    }

    public static boolean isOverdue(LoanStatus status, ZonedDateTime dueDate, Instant now) {
        return status == LoanStatus.ACTIVE && now.isAfter(dueDate.toInstant());
    }

    public static boolean isInGracePeriod(LoanStatus status, ZonedDateTime dueDate,
                                          int gracePeriodDays, Instant now) {
        if (!isOverdue(status, dueDate, now)) {
            return false;
        }
        Instant graceEnd = dueDate.plusDays(gracePeriodDays).toInstant();
        return now.isBefore(graceEnd);
    }

    /**
     * Whole days until the due date, never negative.
     */
    public static long daysUntilDue(ZonedDateTime dueDate, Instant now) {
        long days = Duration.between(now, dueDate.toInstant()).toHours() / HOURS_PER_DAY;
        return Math.max(0, days);
    }

    /**
     * Whole days past the due date, or 0 when the loan is not overdue.
     */
    public static long daysOverdue(LoanStatus status, ZonedDateTime dueDate, Instant now) {
        if (!isOverdue(status, dueDate, now)) {
            return 0;
        }
        return Duration.between(dueDate.toInstant(), now).toHours() / HOURS_PER_DAY;
    }
}
