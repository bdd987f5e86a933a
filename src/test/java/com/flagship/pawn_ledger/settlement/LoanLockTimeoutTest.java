package com.flagship.pawn_ledger.settlement;

import com.flagship.pawn_ledger.LoanFixtures;
import com.flagship.pawn_ledger.loan.Loan;
import com.flagship.pawn_ledger.loan.LoanInstallmentRepository;
import com.flagship.pawn_ledger.loan.LoanPersistenceService;
import com.flagship.pawn_ledger.loan.LoanRepository;
import com.flagship.pawn_ledger.loan.LoanTestData;
import com.flagship.pawn_ledger.payment.PaymentMethod;
import com.flagship.pawn_ledger.payment.PaymentStatus;
import com.flagship.pawn_ledger.payment.exception.ConcurrencyConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.flagship.pawn_ledger.LoanFixtures.money;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Bounded waits on the loan row lock.
 *
 * These tests verify that:
 * - A settle or reverse blocked by another transaction gives up after the lock timeout
 * - The timeout surfaces as a retryable conflict once the retries are spent
 * - The loan is untouched and accepts the payment once the lock is released
 */
@SpringBootTest
@Testcontainers
class LoanLockTimeoutTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("pawn_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("settlement.lock-timeout-ms", () -> "300");
        registry.add("settlement.retry.backoff-ms", () -> "10");
    }

    @Autowired
    private LoanPaymentService loanPaymentService;

    @Autowired
    private LoanPersistenceService loanPersistence;

    @Autowired
    private LoanRepository loanRepository;

    @Autowired
    private LoanInstallmentRepository installmentRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private final ExecutorService lockHolder = Executors.newSingleThreadExecutor();
    private final UUID clerk = UUID.randomUUID();

    private Loan loan;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        loan = new LoanTestData(loanRepository, installmentRepository)
            .save(LoanFixtures.activeLoan("10.00", "50.00", "500.00"));
    }

    @AfterEach
    void tearDown() {
        lockHolder.shutdownNow();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printInvariant(String invariant) {
        System.out.println("🔒 INVARIANT MAINTAINED: " + invariant);
    }

    private SettlePaymentCommand pay(String amount) {
        return SettlePaymentCommand.builder()
            .loanId(loan.getId())
            .amount(money(amount))
            .paymentMethod(PaymentMethod.CASH)
            .branchId(loan.getBranchId())
            .createdBy(clerk)
            .build();
    }

    /**
     * Takes the loan's row lock in another transaction and keeps it until {@code release} opens.
     */
    private Future<?> holdLoanLock(CountDownLatch locked, CountDownLatch release) {
        return lockHolder.submit(() -> transactionTemplate.executeWithoutResult(status -> {
            loanPersistence.lockById(loan.getId()).orElseThrow();
            locked.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
    }

    @Test
    @DisplayName("Settle gives up on a held loan lock with a concurrency conflict")
    void settleTimesOutOnHeldLock() throws Exception {
        printTestHeader("Settle - Lock Wait Is Bounded");

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = holdLoanLock(locked, release);
        assertTrue(locked.await(10, TimeUnit.SECONDS));

        long start = System.currentTimeMillis();
        try {
            ConcurrencyConflictException conflict = assertThrows(ConcurrencyConflictException.class,
                () -> loanPaymentService.settle(pay("100.00"), "key-" + UUID.randomUUID()));
            long elapsed = System.currentTimeMillis() - start;
            System.out.println("Gave up after " + elapsed + "ms: " + conflict.getMessage());

            assertInstanceOf(PessimisticLockingFailureException.class, conflict.getCause());
            assertTrue(elapsed < 10_000, "Lock wait must be bounded, took " + elapsed + "ms");
        } finally {
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        }

        Loan unchanged = loanPersistence.findById(loan.getId()).orElseThrow();
        assertEquals(0, money("560.00").compareTo(unchanged.getRemainingBalance()));
        printInvariant("Timed-out settlement left the loan untouched");

        SettlementResult result = loanPaymentService.settle(pay("100.00"), "key-" + UUID.randomUUID());
        assertEquals(0, money("460.00").compareTo(result.getRemainingBalance()));

        printSuccess("Settlement succeeds once the lock is released");
    }

    @Test
    @DisplayName("Reverse gives up on a held loan lock with a concurrency conflict")
    void reverseTimesOutOnHeldLock() throws Exception {
        printTestHeader("Reverse - Lock Wait Is Bounded");

        SettlementResult settled = loanPaymentService.settle(pay("100.00"), "key-" + UUID.randomUUID());
        UUID paymentId = settled.getPayment().getId();
        ReversePaymentCommand reversal = new ReversePaymentCommand(paymentId, "Entered twice", clerk);

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = holdLoanLock(locked, release);
        assertTrue(locked.await(10, TimeUnit.SECONDS));

        try {
            assertThrows(ConcurrencyConflictException.class, () -> loanPaymentService.reverse(reversal));
        } finally {
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        }

        assertEquals(PaymentStatus.COMPLETED, loanPaymentService.getPayment(paymentId).getStatus());
        printInvariant("Timed-out reversal left the payment completed");

        loanPaymentService.reverse(reversal);
        assertEquals(PaymentStatus.REVERSED, loanPaymentService.getPayment(paymentId).getStatus());

        printSuccess("Reversal succeeds once the lock is released");
    }
}
