package com.flagship.pawn_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for settlement and reversal.
 *
 * Metrics exposed:
 * - loan.payments.settled: counter tagged by outcome and payment method
 * - loan.payments.reversed: counter tagged by outcome
 * - loan.payments.latency: timer tagged by operation
 * - loan.payments.amount: distribution summary of settled amounts
 * - loan.payoffs: counter of payments that closed a loan
 * - idempotency.cache: counter tagged hit/miss
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSettlement(String outcome, String paymentMethod) {
        registry.counter("loan.payments.settled",
                "outcome", sanitizeTag(outcome),
                "method", sanitizeTag(paymentMethod)
        ).increment();
    }

    public void recordSettledAmount(double amount) {
        registry.summary("loan.payments.amount").record(amount);
    }

    public void recordPayoff() {
        registry.counter("loan.payoffs").increment();
    }

    public void recordReversal(String outcome) {
        registry.counter("loan.payments.reversed",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("loan.payments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
