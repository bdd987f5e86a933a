package com.flagship.pawn_ledger.outbox;

import com.flagship.pawn_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Outbox publisher behaviour against a mocked broker.
 *
 * These tests verify that:
 * - Events are sent keyed by loan id and marked published only after the broker acknowledges
 * - A failed send increments the retry count and leaves the event unpublished
 * - A failed send holds back the later events of the same loan
 * - The last allowed failure dead-letters the event
 * - A polling failure does not escape the scheduled task
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "loan-payments";
    private static final int MAX_RETRIES = 3;

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "loanPaymentsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", MAX_RETRIES);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(UUID loanId, String eventType, int retryCount, long sequence) {
        return new OutboxEvent(UUID.randomUUID(), "Loan", loanId, eventType,
            "{\"eventType\":\"" + eventType + "\"}", Instant.now(), null, retryCount, null, sequence);
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Events are sent keyed by loan id in order and marked published")
    void publishesInOrder() {
        UUID loanId = UUID.randomUUID();
        OutboxEvent applied = event(loanId, "LoanPaymentApplied", 0, 1L);
        OutboxEvent reversed = event(loanId, "LoanPaymentReversed", 0, 2L);
        when(outboxService.findPublishable(100, MAX_RETRIES)).thenReturn(List.of(applied, reversed));
        when(kafkaTemplate.send(TOPIC, loanId.toString(), applied.getPayload())).thenReturn(acknowledged(applied));
        when(kafkaTemplate.send(TOPIC, loanId.toString(), reversed.getPayload())).thenReturn(acknowledged(reversed));

        publisher.publishPendingEvents();

        InOrder inOrder = inOrder(kafkaTemplate, outboxService);
        inOrder.verify(kafkaTemplate).send(TOPIC, loanId.toString(), applied.getPayload());
        inOrder.verify(outboxService).markPublished(applied.getId());
        inOrder.verify(kafkaTemplate).send(TOPIC, loanId.toString(), reversed.getPayload());
        inOrder.verify(outboxService).markPublished(reversed.getId());
        verify(outboxMetrics).recordEventPublished("LoanPaymentApplied");
        verify(outboxMetrics).recordEventPublished("LoanPaymentReversed");
        verify(outboxService, never()).markFailed(any(), anyString());
    }

    @Test
    @DisplayName("A failed send is recorded as a retry and not marked published")
    void failedSendIsRetried() {
        OutboxEvent applied = event(UUID.randomUUID(), "LoanPaymentApplied", 0, 1L);
        when(outboxService.findPublishable(100, MAX_RETRIES)).thenReturn(List.of(applied));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(applied.getId()), contains("broker unavailable"));
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("LoanPaymentApplied");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void lastFailureDeadLetters() {
        OutboxEvent applied = event(UUID.randomUUID(), "LoanPaymentApplied", MAX_RETRIES - 1, 1L);
        when(outboxService.findPublishable(100, MAX_RETRIES)).thenReturn(List.of(applied));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenThrow(new IllegalStateException("producer closed"));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(applied.getId(), "producer closed");
        verify(outboxMetrics).recordEventPublishFailed("LoanPaymentApplied");
        verify(outboxMetrics).recordEventDeadLettered("LoanPaymentApplied");
    }

    @Test
    @DisplayName("One failed event does not stop the rest of the batch")
    void failureDoesNotStopBatch() {
        OutboxEvent failing = event(UUID.randomUUID(), "LoanPaymentApplied", 0, 1L);
        OutboxEvent healthy = event(UUID.randomUUID(), "LoanPaymentApplied", 0, 2L);
        when(outboxService.findPublishable(100, MAX_RETRIES)).thenReturn(List.of(failing, healthy));
        when(kafkaTemplate.send(TOPIC, failing.getAggregateId().toString(), failing.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));
        when(kafkaTemplate.send(TOPIC, healthy.getAggregateId().toString(), healthy.getPayload()))
            .thenReturn(acknowledged(healthy));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(failing.getId()), anyString());
        verify(outboxService).markPublished(healthy.getId());
    }

    @Test
    @DisplayName("After a failed send the loan's later events are not sent in the same batch")
    void failedSendHoldsBackLaterEventsOfLoan() {
        UUID loanId = UUID.randomUUID();
        OutboxEvent applied = event(loanId, "LoanPaymentApplied", 0, 1L);
        OutboxEvent reversed = event(loanId, "LoanPaymentReversed", 0, 2L);
        OutboxEvent otherLoan = event(UUID.randomUUID(), "LoanPaymentApplied", 0, 3L);
        when(outboxService.findPublishable(100, MAX_RETRIES)).thenReturn(List.of(applied, reversed, otherLoan));
        when(kafkaTemplate.send(TOPIC, loanId.toString(), applied.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));
        when(kafkaTemplate.send(TOPIC, otherLoan.getAggregateId().toString(), otherLoan.getPayload()))
            .thenReturn(acknowledged(otherLoan));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(TOPIC, loanId.toString(), reversed.getPayload());
        verify(outboxService).markFailed(eq(applied.getId()), anyString());
        verify(outboxService, never()).markPublished(reversed.getId());
        verify(outboxService, never()).markFailed(eq(reversed.getId()), anyString());
        verify(outboxService).markPublished(otherLoan.getId());
    }

    @Test
    @DisplayName("Nothing is sent when the outbox is empty")
    void emptyOutbox() {
        when(outboxService.findPublishable(100, MAX_RETRIES)).thenReturn(List.of());

        publisher.publishPendingEvents();

        verifyNoInteractions(kafkaTemplate, outboxMetrics);
    }

    @Test
    @DisplayName("A polling failure is logged and the task returns normally")
    void pollingFailureIsContained() {
        when(outboxService.findPublishable(100, MAX_RETRIES))
            .thenThrow(new IllegalStateException("database unavailable"));

        publisher.publishPendingEvents();

        verifyNoInteractions(kafkaTemplate, outboxMetrics);
    }
}
