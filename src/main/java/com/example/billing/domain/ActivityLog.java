package com.example.billing.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Human-readable record of an action performed on a billing entity.
 */
@Entity
@Table(name = "activity_log", indexes = {
    @Index(name = "idx_activity_owner_created", columnList = "owner_id, created_at")
})
public class ActivityLog {

    public enum Action {
        CREATE,
        UPDATE,
        DELETE,
        STATUS_CHANGE,
        CONVERT,
        GENERATE,
        PAYMENT_RECORDED,
        PAYMENT_REMOVED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private Action action;

    @NotNull
    @Size(max = 50)
    @Column(name = "entity_type", nullable = false, length = 50)
    private String entityType;

    @Column(name = "entity_id")
    private Long entityId;

    @Size(max = 1000)
    @Column(length = 1000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public ActivityLog() {
    }

    public ActivityLog(Long ownerId, Action action, String entityType, Long entityId, String description) {
        this.ownerId = ownerId;
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        this.description = description != null && description.length() > 1000
            ? description.substring(0, 1000) : description;
    }

    public Long getId() {
        return id;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public Action getAction() {
        return action;
    }

    public String getEntityType() {
        return entityType;
    }

    public Long getEntityId() {
        return entityId;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
