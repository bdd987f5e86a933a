package com.flagship.pawn_ledger.customer;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Pawnshop customer, reduced to the running payment total this service maintains.
 *
 * total_paid is a denormalized figure, eventually consistent with the sum of
 * the customer's non-reversed payments. It never goes below zero.
 */
@Entity
@Table(name = "customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "full_name", nullable = false, length = 200)
    private String fullName;

    @Column(name = "total_paid", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalPaid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    public static CustomerEntity create(UUID id, String fullName) {
        CustomerEntity entity = new CustomerEntity();
        entity.id = id;
        entity.fullName = fullName;
        entity.totalPaid = BigDecimal.ZERO.setScale(2);
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void addPayment(BigDecimal amount) {
        this.totalPaid = this.totalPaid.add(amount);
    }

    /**
     * Takes a reversed payment off the total, stopping at zero.
     */
    void subtractPayment(BigDecimal amount) {
        BigDecimal reduced = this.totalPaid.subtract(amount);
        this.totalPaid = reduced.signum() < 0 ? BigDecimal.ZERO.setScale(2) : reduced;
    }
}
