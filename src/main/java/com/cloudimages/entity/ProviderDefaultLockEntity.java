package com.cloudimages.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * One row per user that has ever changed its default provider. The row is
 * locked (SELECT ... FOR UPDATE) around every default change, so those
 * changes run one at a time even while new provider rows are being inserted.
 */
@Entity
@Table(name = "provider_default_locks")
public class ProviderDefaultLockEntity {

    @Id
    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ProviderDefaultLockEntity() {
    }

    public ProviderDefaultLockEntity(String userId) {
        this.userId = userId;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public String getUserId() {
        return userId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
