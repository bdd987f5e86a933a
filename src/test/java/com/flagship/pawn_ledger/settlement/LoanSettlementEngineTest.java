package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.LoanFixtures;
import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.loan.LoanInstallment;
import com.flagship.pawn_ledger.loan.LoanPersistenceService;
import com.flagship.pawn_ledger.loan.LoanStatus;
import com.flagship.pawn_ledger.loan.PaymentPlanType;
import com.flagship.pawn_ledger.outbox.OutboxService;
import com.flagship.pawn_ledger.payment.Payment;
import com.flagship.pawn_ledger.payment.PaymentMethod;
import com.flagship.pawn_ledger.payment.PaymentNumberGenerator;
import com.flagship.pawn_ledger.payment.PaymentPersistenceService;
import com.flagship.pawn_ledger.payment.PaymentStatus;
import com.flagship.pawn_ledger.payment.event.LoanPaymentAppliedEvent;
import com.flagship.pawn_ledger.payment.exception.LoanNotFoundException;
import com.flagship.pawn_ledger.payment.exception.LoanNotPayableException;
import com.flagship.pawn_ledger.payment.exception.OverpaymentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.pawn_ledger.LoanFixtures.money;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LoanSettlementEngineTest {

    private static final Instant NOW = Instant.parse("2026-02-10T12:00:00Z");

    @Mock
    private LoanPersistenceService loanPersistence;

    @Mock
    private PaymentPersistenceService paymentPersistence;

    @Mock
    private PaymentNumberGenerator paymentNumberGenerator;

    @Mock
    private OutboxService outboxService;

    private LoanSettlementEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LoanSettlementEngine(loanPersistence, paymentPersistence, paymentNumberGenerator,
            outboxService, Clock.fixed(NOW, ZoneOffset.UTC));
        when(paymentNumberGenerator.next()).thenReturn("PY-2026-000001");
        when(paymentPersistence.save(any(Payment.class), any())).thenAnswer(inv -> inv.getArgument(0));
        when(loanPersistence.update(any(Loan.class))).thenAnswer(inv -> inv.getArgument(0));
        when(paymentPersistence.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
    }

    private Loan stored(Loan loan) {
        when(loanPersistence.lockById(loan.getId())).thenReturn(Optional.of(loan));
        return loan;
    }

    private static SettlePaymentCommand command(Loan loan, String amount) {
        return SettlePaymentCommand.builder()
            .loanId(loan.getId())
            .amount(new BigDecimal(amount))
            .paymentMethod(PaymentMethod.CASH)
            .branchId(loan.getBranchId())
            .createdBy(UUID.randomUUID())
            .build();
    }

    private static void assertMoney(String expected, BigDecimal actual) {
        assertEquals(0, money(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual);
    }

    @Nested
    @DisplayName("Successful settlement")
    class Success {

        @Test
        @DisplayName("Partial payment is split by the waterfall and recorded with balance snapshots")
        void partialPayment() {
            Loan loan = stored(LoanFixtures.activeLoan("10.00", "50.00", "500.00"));

            SettlementResult result = engine.settle(command(loan, "100"), "key-1");

            Payment payment = result.getPayment();
            assertEquals(PaymentStatus.COMPLETED, payment.getStatus());
            assertEquals("PY-2026-000001", payment.getPaymentNumber());
            assertEquals(2, payment.getAmount().scale());
            assertMoney("10.00", payment.getLateFeeAmount());
            assertMoney("50.00", payment.getInterestAmount());
            assertMoney("40.00", payment.getPrincipalAmount());
            assertMoney("460.00", payment.getLoanBalanceAfter());
            assertMoney("0.00", payment.getInterestBalanceAfter());
            assertEquals(NOW, payment.getPaymentDate());
            assertEquals(loan.getCustomerId(), payment.getCustomerId());

            assertFalse(result.isReplayed());
            assertFalse(result.isFullyPaid());
            assertMoney("460.00", result.getRemainingBalance());
            verify(paymentPersistence).save(any(Payment.class), eq("key-1"));
        }

        @Test
        @DisplayName("Payoff closes the loan and the event says so")
        void payoff() {
            Loan loan = stored(LoanFixtures.activeLoan("10.00", "50.00", "500.00"));

            SettlementResult result = engine.settle(command(loan, "560.00"), null);

            assertTrue(result.isFullyPaid());
            assertEquals(LoanStatus.PAID, result.getLoan().getStatus());
            assertEquals(NOW, result.getLoan().getPaidDate());

            ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
            verify(outboxService).saveEvent(eq(LoanSettlementEngine.AGGREGATE_TYPE), eq(loan.getId()),
                eq(LoanPaymentAppliedEvent.EVENT_TYPE), event.capture());
            LoanPaymentAppliedEvent applied = (LoanPaymentAppliedEvent) event.getValue();
            assertTrue(applied.isLoanFullyPaid());
            assertEquals(loan.getItemId(), applied.getItemId());
            verify(paymentPersistence, never()).findByIdempotencyKey(any());
        }

        @Test
        @DisplayName("Installment loans spread the payment over the schedule")
        void installments() {
            Loan loan = stored(LoanFixtures.activeLoan("0.00", "0.00", "300.00").toBuilder()
                .paymentPlanType(PaymentPlanType.INSTALLMENTS).build());
            List<LoanInstallment> schedule = LoanFixtures.schedule(loan.getId(), 3, "100.00");
            when(loanPersistence.findInstallments(loan.getId())).thenReturn(schedule);

            engine.settle(command(loan, "150.00"), "key-2");

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<LoanInstallment>> changed = ArgumentCaptor.forClass(List.class);
            verify(loanPersistence).updateInstallments(changed.capture());
            assertEquals(2, changed.getValue().size());
            assertTrue(changed.getValue().get(0).isPaid());
        }

        @Test
        @DisplayName("Single payment loans leave installments alone")
        void noInstallments() {
            Loan loan = stored(LoanFixtures.activeLoan("0.00", "0.00", "300.00"));

            engine.settle(command(loan, "50.00"), "key-3");

            verify(loanPersistence, never()).updateInstallments(anyList());
        }
    }

    @Nested
    @DisplayName("Idempotent replay")
    class Replay {

        @Test
        @DisplayName("A used key returns the earlier payment without settling again")
        void replaysEarlierPayment() {
            Loan loan = stored(LoanFixtures.activeLoan("0.00", "0.00", "300.00"));
            Payment earlier = Payment.builder().id(UUID.randomUUID()).loanId(loan.getId())
                .paymentNumber("PY-2026-000007").amount(money("50.00")).status(PaymentStatus.COMPLETED).build();
            when(paymentPersistence.findByIdempotencyKey("key-4")).thenReturn(Optional.of(earlier));

            SettlementResult result = engine.settle(command(loan, "50.00"), "key-4");

            assertTrue(result.isReplayed());
            assertSame(earlier, result.getPayment());
            verify(paymentPersistence, never()).save(any(), any());
            verify(outboxService, never()).saveEvent(any(), any(), any(), any());
        }

        @Test
        @DisplayName("A key used for another loan is rejected")
        void keyFromAnotherLoan() {
            Loan loan = stored(LoanFixtures.activeLoan("0.00", "0.00", "300.00"));
            Payment other = Payment.builder().id(UUID.randomUUID()).loanId(UUID.randomUUID()).build();
            when(paymentPersistence.findByIdempotencyKey("key-5")).thenReturn(Optional.of(other));

            assertThrows(IllegalArgumentException.class, () -> engine.settle(command(loan, "50.00"), "key-5"));
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Overpayment leaves the loan untouched")
        void overpayment() {
            Loan loan = stored(LoanFixtures.activeLoan("10.00", "50.00", "500.00"));

            OverpaymentException e = assertThrows(OverpaymentException.class,
                () -> engine.settle(command(loan, "560.01"), "key-6"));

            assertEquals("Payment amount (560.01) exceeds total owed (560.00)", e.getMessage());
            verify(paymentPersistence, never()).save(any(), any());
            verify(loanPersistence, never()).update(any());
        }

        @Test
        @DisplayName("PAID loans reject payments")
        void paidLoan() {
            Loan loan = stored(LoanFixtures.activeLoan("0.00", "0.00", "0.00").toBuilder()
                .status(LoanStatus.PAID).build());

            assertThrows(LoanNotPayableException.class, () -> engine.settle(command(loan, "1.00"), "key-7"));
        }

        @Test
        @DisplayName("CONFISCATED loans reject payments")
        void confiscatedLoan() {
            Loan loan = stored(LoanFixtures.activeLoan("0.00", "0.00", "100.00").toBuilder()
                .status(LoanStatus.CONFISCATED).build());

            LoanNotPayableException e = assertThrows(LoanNotPayableException.class,
                () -> engine.settle(command(loan, "1.00"), "key-8"));
            assertEquals(LoanStatus.CONFISCATED, e.getStatus());
        }

        @Test
        @DisplayName("Unknown loan")
        void unknownLoan() {
            UUID loanId = UUID.randomUUID();
            when(loanPersistence.lockById(loanId)).thenReturn(Optional.empty());
            SettlePaymentCommand command = SettlePaymentCommand.builder()
                .loanId(loanId).amount(money("1.00")).paymentMethod(PaymentMethod.CASH).build();

            assertThrows(LoanNotFoundException.class, () -> engine.settle(command, "key-9"));
        }

        @Test
        @DisplayName("Amounts with sub-cent precision or no value are rejected")
        void invalidAmounts() {
            Loan loan = stored(LoanFixtures.activeLoan("0.00", "0.00", "100.00"));

            assertThrows(IllegalArgumentException.class, () -> engine.settle(command(loan, "10.001"), "k"));
            assertThrows(IllegalArgumentException.class, () -> engine.settle(command(loan, "0.00"), "k"));
            assertThrows(IllegalArgumentException.class, () -> engine.settle(command(loan, "-5"), "k"));
            verify(loanPersistence, never()).lockById(any());
        }
    }
}
