package com.flagship.pawn_ledger.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for outbox events.
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * The oldest unpublished event of each aggregate, in commit order, while
     * it is still within its retry budget.
     *
     * An event is only eligible once every earlier event of the same aggregate
     * is published, so a failing or dead-lettered event holds back the rest of
     * its loan instead of being overtaken on the topic.
     * SKIP LOCKED lets several publisher instances poll without blocking each other.
     */
    @Query(value = """
        SELECT * FROM outbox_events e
        WHERE e.published_at IS NULL AND e.retry_count < :maxRetries
          AND NOT EXISTS (
            SELECT 1 FROM outbox_events earlier
            WHERE earlier.aggregate_type = e.aggregate_type
              AND earlier.aggregate_id = e.aggregate_id
              AND earlier.published_at IS NULL
              AND earlier.sequence_number < e.sequence_number)
        ORDER BY e.sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findPublishableForUpdate(@Param("limit") int limit,
                                                     @Param("maxRetries") int maxRetries);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    /**
     * Events that exhausted their retries and need manual intervention.
     */
    @Query("""
        SELECT COUNT(e) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries
        """)
    long countDeadLettered(@Param("maxRetries") int maxRetries);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
