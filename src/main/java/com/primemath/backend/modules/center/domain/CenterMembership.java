package com.primemath.backend.modules.center.domain;

import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "center_membership")
public class CenterMembership extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "center_id", nullable = false, columnDefinition = "uuid")
    private UUID centerId;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    public CenterMembership() {
    }

    public CenterMembership(UUID centerId, UUID userId) {
        this.centerId = centerId;
        this.userId = userId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getCenterId() {
        return centerId;
    }

    public UUID getUserId() {
        return userId;
    }
}
