package com.flagship.pawn_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pawn_ledger.collateral.ItemEntity;
import com.flagship.pawn_ledger.collateral.ItemRepository;
import com.flagship.pawn_ledger.collateral.ItemStatus;
import com.flagship.pawn_ledger.customer.CustomerEntity;
import com.flagship.pawn_ledger.customer.CustomerRepository;
import com.flagship.pawn_ledger.payment.event.LoanPaymentAppliedEvent;
import com.flagship.pawn_ledger.payment.event.LoanPaymentReversedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.util.ReflectionTestUtils;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Consumer side of loan payment events, fed records directly.
 *
 * These tests verify that:
 * - LoanPaymentApplied raises the customer total and releases the item on payoff
 * - LoanPaymentReversed lowers the total and re-pledges the item on reactivation
 * - Redelivered events change nothing
 * - Unknown and unreadable records are acknowledged and skipped
 */
@SpringBootTest
@Testcontainers
class LoanPaymentEventConsumerTest {

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
        // The listener container stays off; records are handed to the consumer directly
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private LoanPaymentEventHandler eventHandler;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Value("${spring.kafka.consumer.group-id}")
    private String consumerGroup;

    private LoanPaymentEventConsumer consumer;
    private UUID customerId;
    private UUID itemId;
    private UUID loanId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        consumer = new LoanPaymentEventConsumer(eventProcessor, eventHandler, objectMapper);
        ReflectionTestUtils.setField(consumer, "consumerGroup", consumerGroup);
        customerId = UUID.randomUUID();
        itemId = UUID.randomUUID();
        loanId = UUID.randomUUID();
        customerRepository.save(CustomerEntity.create(customerId, "Test Customer"));
        itemRepository.save(ItemEntity.create(itemId, "14k gold ring", ItemStatus.COLLATERAL));
    }

    private Acknowledgment deliver(Object event) throws Exception {
        return deliverRaw(objectMapper.writeValueAsString(event));
    }

    private Acknowledgment deliverRaw(String json) {
        Acknowledgment ack = mock(Acknowledgment.class);
        consumer.consume(new ConsumerRecord<>("loan-payments", 0, 0L, loanId.toString(), json), ack);
        return ack;
    }

    private LoanPaymentAppliedEvent applied(String amount, boolean fullyPaid) {
        return new LoanPaymentAppliedEvent(UUID.randomUUID(), UUID.randomUUID(), "PY-2026-000100",
            loanId, customerId, itemId, new BigDecimal(amount), BigDecimal.ZERO, BigDecimal.ZERO,
            new BigDecimal(amount), fullyPaid, Instant.now());
    }

    private BigDecimal totalPaid() {
        return customerRepository.findById(customerId).orElseThrow().getTotalPaid();
    }

    private ItemStatus itemStatus() {
        return itemRepository.findById(itemId).orElseThrow().getStatus();
    }

    @Test
    @DisplayName("Payoff event raises the customer total and releases the item")
    void payoff() throws Exception {
        printTestHeader("LoanPaymentApplied with payoff");

        Acknowledgment ack = deliver(applied("250.00", true));

        verify(ack).acknowledge();
        assertEquals(0, new BigDecimal("250.00").compareTo(totalPaid()));
        assertEquals(ItemStatus.AVAILABLE, itemStatus());
        printSuccess("Customer total updated and item released");
    }

    @Test
    @DisplayName("Redelivered event is acknowledged without counting twice")
    void redelivery() throws Exception {
        printTestHeader("Redelivery");
        LoanPaymentAppliedEvent event = applied("40.00", false);

        deliver(event);
        Acknowledgment second = deliver(event);

        verify(second).acknowledge();
        assertEquals(0, new BigDecimal("40.00").compareTo(totalPaid()));
        assertEquals(ItemStatus.COLLATERAL, itemStatus());
        printSuccess("Second delivery changed nothing");
    }

    @Test
    @DisplayName("Reversal of a payoff lowers the total and re-pledges the item")
    void reversal() throws Exception {
        printTestHeader("LoanPaymentReversed with reactivation");
        deliver(applied("250.00", true));

        LoanPaymentReversedEvent reversed = new LoanPaymentReversedEvent(UUID.randomUUID(), UUID.randomUUID(),
            "PY-2026-000100", loanId, customerId, itemId, new BigDecimal("250.00"), true,
            "Check bounced", UUID.randomUUID(), Instant.now());
        deliver(reversed);

        assertEquals(0, BigDecimal.ZERO.compareTo(totalPaid()));
        assertEquals(ItemStatus.COLLATERAL, itemStatus());
        printSuccess("Payoff undone downstream");
    }

    @Test
    @DisplayName("Customer total never goes below zero")
    void totalClampedAtZero() throws Exception {
        LoanPaymentReversedEvent reversed = new LoanPaymentReversedEvent(UUID.randomUUID(), UUID.randomUUID(),
            "PY-2026-000101", loanId, customerId, itemId, new BigDecimal("75.00"), false,
            "Imported payment", UUID.randomUUID(), Instant.now());

        deliver(reversed);

        assertEquals(0, BigDecimal.ZERO.compareTo(totalPaid()));
    }

    @Test
    @DisplayName("Missing customer or item does not block the stream")
    void missingReferences() throws Exception {
        customerId = UUID.randomUUID();
        itemId = UUID.randomUUID();
        LoanPaymentAppliedEvent event = applied("10.00", true);

        Acknowledgment ack = deliver(event);

        verify(ack).acknowledge();
        assertTrue(processedEventRepository.existsByEventIdAndConsumerGroup(
            event.getEventId(), consumerGroup));
    }

    @Test
    @DisplayName("Processed events are recorded under the listener's configured group")
    void recordsConfiguredConsumerGroup() throws Exception {
        LoanPaymentAppliedEvent event = applied("25.00", false);

        deliver(event);

        ProcessedEventEntity processed = processedEventRepository.findById(event.getEventId()).orElseThrow();
        System.out.println("Consumer group: " + processed.getConsumerGroup());
        assertEquals("pawn-ledger-consumers", consumerGroup);
        assertEquals("pawn-ledger-consumers", processed.getConsumerGroup());
    }

    @Test
    @DisplayName("Unknown event types are recorded as skipped")
    void unknownEventType() {
        UUID eventId = UUID.randomUUID();
        String json = "{\"eventId\":\"" + eventId + "\",\"loanId\":\"" + loanId + "\",\"eventType\":\"LoanRenewed\"}";

        Acknowledgment ack = deliverRaw(json);

        verify(ack).acknowledge();
        ProcessedEventEntity entity = processedEventRepository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, entity.getProcessingResult());
    }

    @Test
    @DisplayName("Unreadable records are acknowledged and dropped")
    void unreadable() {
        Acknowledgment ack = deliverRaw("not json at all");

        verify(ack, times(1)).acknowledge();
    }
}
