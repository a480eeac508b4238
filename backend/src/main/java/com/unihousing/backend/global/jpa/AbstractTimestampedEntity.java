package com.unihousing.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

import org.springframework.data.annotation.LastModifiedDate;

/**
 * Adds {@code updated_at} for rows that staff may later change (status, replies, remarks).
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity extends AbstractCreatedEntity {

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
