package com.flagship.pawn_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pawn_ledger.observability.CorrelationContext;
import com.flagship.pawn_ledger.payment.event.LoanPaymentAppliedEvent;
import com.flagship.pawn_ledger.payment.event.LoanPaymentReversedEvent;
import com.flagship.pawn_ledger.settlement.LoanSettlementEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for loan payment events.
 *
 * Offsets are acknowledged manually, only after the event was handled (or
 * recognized as a duplicate). An exception leaves the offset uncommitted so
 * the container's error handler redelivers the record.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LoanPaymentEventConsumer {

    private final IdempotentEventProcessor eventProcessor;
    private final LoanPaymentEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    /**
     * Group the listener joins; processed_events records it with each event.
     */
    @Value("${spring.kafka.consumer.group-id:pawn-ledger-consumers}")
    private String consumerGroup;

    @KafkaListener(
        topics = "${kafka.topic.loan-payments:loan-payments}",
        groupId = "${spring.kafka.consumer.group-id:pawn-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, envelope.loanId().toString());
        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}", envelope.eventType(), envelope.eventId());
            }
        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
        }
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType()) {
            case LoanPaymentAppliedEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onPaymentApplied(deserialize(rawPayload, LoanPaymentAppliedEvent.class)));
            case LoanPaymentReversedEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onPaymentReversed(deserialize(rawPayload, LoanPaymentReversedEvent.class)));
            default -> {
                log.debug("Unknown event type: {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(),
                    LoanSettlementEngine.AGGREGATE_TYPE, envelope.loanId(),
                    consumerGroup, "Unknown event type");
                yield false;
            }
        };
    }

    private boolean process(EventEnvelope envelope, Runnable handler) {
        return eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
            LoanSettlementEngine.AGGREGATE_TYPE, envelope.loanId(), consumerGroup, handler);
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("loanId")
                    || !node.hasNonNull("eventType")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("loanId").asText()),
                node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private record EventEnvelope(UUID eventId, UUID loanId, String eventType) {}
}
