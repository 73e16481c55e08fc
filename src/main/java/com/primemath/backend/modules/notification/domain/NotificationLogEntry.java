package com.primemath.backend.modules.notification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "notification_log")
public class NotificationLogEntry extends AbstractTimestampedEntity {

    public static final String CHANNEL_SMS = "sms";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "attendance_record_id", updatable = false, columnDefinition = "uuid")
    private UUID attendanceRecordId;

    @Column(name = "template_id", updatable = false, columnDefinition = "uuid")
    private UUID templateId;

    @Column(name = "center_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID centerId;

    @Column(name = "recipient_phone", nullable = false, updatable = false, length = 32)
    private String recipientPhone;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_role", nullable = false, updatable = false, length = 32)
    private RecipientRole recipientRole;

    @Column(name = "message_type", nullable = false, updatable = false, length = 32)
    private String messageType;

    @Column(name = "channel", nullable = false, updatable = false, length = 16)
    private String channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 16)
    private NotificationDispatchStatus status;

    @Column(name = "error_message", updatable = false, columnDefinition = "text")
    private String errorMessage;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private OffsetDateTime sentAt;

    protected NotificationLogEntry() {
    }

    public NotificationLogEntry(
            UUID attendanceRecordId,
            UUID templateId,
            UUID centerId,
            String recipientPhone,
            RecipientRole recipientRole,
            String messageType,
            NotificationDispatchStatus status,
            String errorMessage,
            OffsetDateTime sentAt
    ) {
        this.attendanceRecordId = attendanceRecordId;
        this.templateId = templateId;
        this.centerId = centerId;
        this.recipientPhone = recipientPhone;
        this.recipientRole = recipientRole;
        this.messageType = messageType;
        this.channel = CHANNEL_SMS;
        this.status = status;
        this.errorMessage = errorMessage;
        this.sentAt = sentAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAttendanceRecordId() {
        return attendanceRecordId;
    }

    public UUID getTemplateId() {
        return templateId;
    }

    public UUID getCenterId() {
        return centerId;
    }

    public String getRecipientPhone() {
        return recipientPhone;
    }

    public RecipientRole getRecipientRole() {
        return recipientRole;
    }

    public String getMessageType() {
        return messageType;
    }

    public String getChannel() {
        return channel;
    }

    public NotificationDispatchStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public OffsetDateTime getSentAt() {
        return sentAt;
    }
}
