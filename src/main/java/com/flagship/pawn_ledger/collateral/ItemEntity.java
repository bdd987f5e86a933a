package com.flagship.pawn_ledger.collateral;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A pawned item. Only its status is managed here.
 */
@Entity
@Table(name = "items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ItemStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ItemEntity create(UUID id, String description, ItemStatus status) {
        ItemEntity entity = new ItemEntity();
        entity.id = id;
        entity.description = description;
        entity.status = status;
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

    /**
     * Moves the item from {@code from} to {@code to}.
     *
     * @return false if the item was not in {@code from}
     */
    boolean transition(ItemStatus from, ItemStatus to) {
        if (status != from) {
            return false;
        }
        this.status = to;
        return true;
    }
}
