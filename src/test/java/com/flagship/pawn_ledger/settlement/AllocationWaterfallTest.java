package com.flagship.pawn_ledger.settlement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.flagship.pawn_ledger.LoanFixtures.money;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation waterfall: late fee, then interest, then principal.
 */
class AllocationWaterfallTest {

    private static void assertMoney(String expected, BigDecimal actual) {
        assertEquals(0, money(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual);
    }

    @Nested
    @DisplayName("Priority order")
    class PriorityOrder {

        @Test
        @DisplayName("Payment covering fee and interest spills into principal")
        void spillsIntoPrincipal() {
            Allocation allocation = AllocationWaterfall.allocate(
                money("100.00"), money("10.00"), money("50.00"), money("500.00"));

            assertMoney("10.00", allocation.getLateFee());
            assertMoney("50.00", allocation.getInterest());
            assertMoney("40.00", allocation.getPrincipal());
            assertMoney("100.00", allocation.getTotal());
        }

        @Test
        @DisplayName("Small payment only touches the late fee")
        void smallPaymentGoesToLateFee() {
            Allocation allocation = AllocationWaterfall.allocate(
                money("5.00"), money("10.00"), money("50.00"), money("500.00"));

            assertMoney("5.00", allocation.getLateFee());
            assertMoney("0.00", allocation.getInterest());
            assertMoney("0.00", allocation.getPrincipal());
        }

        @Test
        @DisplayName("No late fee: interest first, then principal")
        void noLateFee() {
            Allocation allocation = AllocationWaterfall.allocate(
                money("60.00"), money("0.00"), money("25.50"), money("100.00"));

            assertMoney("0.00", allocation.getLateFee());
            assertMoney("25.50", allocation.getInterest());
            assertMoney("34.50", allocation.getPrincipal());
        }

        @Test
        @DisplayName("Exact payoff zeroes every component")
        void exactPayoff() {
            Allocation allocation = AllocationWaterfall.allocate(
                money("560.00"), money("10.00"), money("50.00"), money("500.00"));

            assertMoney("10.00", allocation.getLateFee());
            assertMoney("50.00", allocation.getInterest());
            assertMoney("500.00", allocation.getPrincipal());
        }

        @Test
        @DisplayName("One cent goes to the first component still owed")
        void oneCent() {
            Allocation allocation = AllocationWaterfall.allocate(
                money("0.01"), money("0.00"), money("0.00"), money("500.00"));

            assertMoney("0.01", allocation.getPrincipal());
        }
    }

    @Nested
    @DisplayName("Rejected input")
    class RejectedInput {

        @Test
        @DisplayName("Amount above the total owed is rejected")
        void overpayment() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                AllocationWaterfall.allocate(money("560.01"), money("10.00"), money("50.00"), money("500.00")));
            assertTrue(e.getMessage().contains("exceeds total owed"));
        }

        @Test
        @DisplayName("Zero and negative amounts are rejected")
        void nonPositive() {
            assertThrows(IllegalArgumentException.class, () ->
                AllocationWaterfall.allocate(money("0.00"), money("1.00"), money("1.00"), money("1.00")));
            assertThrows(IllegalArgumentException.class, () ->
                AllocationWaterfall.allocate(money("-1.00"), money("1.00"), money("1.00"), money("1.00")));
        }

        @Test
        @DisplayName("Negative balances are rejected")
        void negativeBalance() {
            assertThrows(IllegalArgumentException.class, () ->
                AllocationWaterfall.allocate(money("1.00"), money("-1.00"), money("1.00"), money("1.00")));
        }

        @Test
        @DisplayName("Allocation refuses negative splits")
        void negativeSplit() {
            assertThrows(IllegalArgumentException.class, () ->
                Allocation.of(money("0.00"), money("-0.01"), money("1.00")));
        }
    }
}
