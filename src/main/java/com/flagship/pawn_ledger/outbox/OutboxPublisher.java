package com.flagship.pawn_ledger.outbox;

import com.flagship.pawn_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Background publisher that moves outbox events to Kafka.
 *
 * Events are sent one at a time and awaited, keyed by loan id, so the events
 * of one loan land on one partition in the order they were committed.
 * A failed send increments the event's retry count and holds back the later
 * events of that loan for the rest of the batch; the poll query does the same
 * across batches. Once the retry count reaches outbox.publisher.max-retries the
 * event is left for manual intervention and its loan's events stay queued behind it.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.loan-payments:loan-payments}")
    private String loanPaymentsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishable(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Error polling outbox", e);
            return;
        }

        if (events.isEmpty()) {
            return;
        }
        log.debug("Found {} unpublished events to process", events.size());

        Set<UUID> heldBack = new HashSet<>();
        for (OutboxEvent event : events) {
            if (heldBack.contains(event.getAggregateId())) {
                log.debug("Holding back event {} behind an unpublished event of aggregate {}",
                        event.getId(), event.getAggregateId());
                continue;
            }
            if (!publishEvent(event)) {
                heldBack.add(event.getAggregateId());
            }
        }
    }

    /**
     * @return true if the broker acknowledged the event
     */
    private boolean publishEvent(OutboxEvent event) {
        String key = event.getAggregateId().toString();
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(loanPaymentsTopic, key, event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
        return false;
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Failed to publish event: eventId={}, eventType={}, aggregateId={}, error={}",
                event.getId(), event.getEventType(), event.getAggregateId(), error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} reached max retries ({}), dead-lettered. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
