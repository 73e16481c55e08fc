package com.primemath.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.modules.notification.domain.NotificationDispatchStatus;
import com.primemath.backend.modules.notification.domain.NotificationLogEntry;
import com.primemath.backend.modules.notification.domain.RecipientRole;

public record NotificationLogResponse(
        UUID id,
        UUID attendanceRecordId,
        String recipientPhone,
        RecipientRole recipientRole,
        String messageType,
        String channel,
        NotificationDispatchStatus status,
        String errorMessage,
        OffsetDateTime sentAt
) {

    public static NotificationLogResponse from(NotificationLogEntry entry) {
        return new NotificationLogResponse(
                entry.getId(),
                entry.getAttendanceRecordId(),
                entry.getRecipientPhone(),
                entry.getRecipientRole(),
                entry.getMessageType(),
                entry.getChannel(),
                entry.getStatus(),
                entry.getErrorMessage(),
                entry.getSentAt()
        );
    }
}
