package com.flagship.pawn_ledger.loan;

import com.flagship.pawn_ledger.LoanFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loans in these tests are due 2026-03-01 with a 5 day grace period.
 */
class OverdueCalculatorTest {

    private static OverdueCalculator at(String instant, String zone) {
        return new OverdueCalculator(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC), zone);
    }

    private final Loan loan = LoanFixtures.activeLoan("0.00", "50.00", "500.00");

    @Test
    @DisplayName("Before the due date: days until due, not overdue")
    void beforeDueDate() {
        OverdueStatus status = at("2026-02-20T00:00:00Z", "UTC").evaluate(loan);

        assertFalse(status.isOverdue());
        assertFalse(status.isInGracePeriod());
        assertEquals(9, status.getDaysUntilDue());
        assertEquals(0, status.getDaysOverdue());
    }

    @Test
    @DisplayName("Past due inside the grace period")
    void inGracePeriod() {
        OverdueStatus status = at("2026-03-03T12:00:00Z", "UTC").evaluate(loan);

        assertTrue(status.isOverdue());
        assertTrue(status.isInGracePeriod());
        assertEquals(0, status.getDaysUntilDue());
        assertEquals(2, status.getDaysOverdue());
    }

    @Test
    @DisplayName("Past the grace period")
    void pastGracePeriod() {
        OverdueStatus status = at("2026-03-10T00:00:00Z", "UTC").evaluate(loan);

        assertTrue(status.isOverdue());
        assertFalse(status.isInGracePeriod());
        assertEquals(9, status.getDaysOverdue());
    }

    @Test
    @DisplayName("A loan already classified OVERDUE is not reported as newly overdue")
    void alreadyClassified() {
        Loan overdue = loan.toBuilder().status(LoanStatus.OVERDUE).build();

        OverdueStatus status = at("2026-03-10T00:00:00Z", "UTC").evaluate(overdue);

        assertFalse(status.isOverdue());
        assertFalse(status.isInGracePeriod());
        assertEquals(0, status.getDaysOverdue());
    }

    @Test
    @DisplayName("Due date starts at midnight in the business time zone")
    void businessZone() {
        String justAfterUtcMidnight = "2026-03-01T03:00:00Z";

        assertTrue(at(justAfterUtcMidnight, "UTC").evaluate(loan).isOverdue());
        assertFalse(at(justAfterUtcMidnight, "America/New_York").evaluate(loan).isOverdue());
    }
}
