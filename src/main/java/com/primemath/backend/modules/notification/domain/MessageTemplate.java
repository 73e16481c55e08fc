package com.primemath.backend.modules.notification.domain;

import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "message_template")
public class MessageTemplate extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "center_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID centerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private AttendanceNotificationType type;

    @Column(name = "title", nullable = false, length = 100)
    private String title;

    @Column(name = "body", nullable = false, columnDefinition = "text")
    private String body;

    @Column(name = "active", nullable = false)
    private boolean active;

    protected MessageTemplate() {
    }

    public MessageTemplate(UUID centerId, AttendanceNotificationType type, String title, String body) {
        this.centerId = centerId;
        this.type = type;
        this.title = title;
        this.body = body;
        this.active = true;
    }

    public UUID getId() {
        return id;
    }

    public UUID getCenterId() {
        return centerId;
    }

    public AttendanceNotificationType getType() {
        return type;
    }

    public void setType(AttendanceNotificationType type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
