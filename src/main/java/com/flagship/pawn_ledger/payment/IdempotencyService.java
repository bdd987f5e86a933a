package com.flagship.pawn_ledger.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps client Idempotency-Key values to the payment they created.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the payments table (slower, but always available)
 * 3. Cache database hits in Redis for future lookups
 *
 * The unique idempotency_key column is the source of truth. The settlement
 * engine repeats the database check under the loan lock, so a Redis miss or
 * outage never lets a duplicate through.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "loan-payment-idempotency:";

    private final PaymentRepository paymentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${settlement.idempotency.ttl-days:7}") long ttlDays) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofDays(ttlDays);
    }

    /**
     * Looks up the payment created with this key.
     *
     * @param idempotencyKey The idempotency key to check
     * @return Optional containing payment ID if key exists, empty otherwise
     */
    public Optional<UUID> lookup(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String paymentId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (paymentId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(paymentId));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> paymentId = paymentRepository.findByIdempotencyKey(idempotencyKey)
            .map(PaymentEntity::getId);
        paymentId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return paymentId;
    }

    /**
     * Caches a key → payment mapping after the payment has been committed.
     * The database row already holds the key; this only warms Redis.
     */
    public void remember(String idempotencyKey, UUID paymentId) {
        requireKey(idempotencyKey);
        if (paymentId == null) {
            throw new IllegalArgumentException("Payment ID cannot be null");
        }
        cache(idempotencyKey, paymentId);
    }

    private void cache(String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId.toString(), ttl);
            log.debug("Stored idempotency key in Redis: {} -> {}", idempotencyKey, paymentId);
        } catch (RuntimeException e) {
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
