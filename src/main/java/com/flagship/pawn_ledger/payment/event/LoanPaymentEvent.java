package com.flagship.pawn_ledger.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for loan payment events.
 *
 * Events are facts written to the outbox in the same transaction that changed
 * the loan. The loan id is the aggregate id and the Kafka key, so all events of
 * one loan are consumed in order.
 */
public interface LoanPaymentEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    UUID getPaymentId();

    UUID getLoanId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
