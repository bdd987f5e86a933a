package com.flagship.pawn_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in (or already published from) the outbox table.
 *
 * Written in the same transaction as the loan change it describes, so the
 * event exists if and only if the change was committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Loan"
    UUID aggregateId;          // loan ID
    String eventType;          // e.g. "LoanPaymentApplied"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }
}
