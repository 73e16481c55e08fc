package com.primemath.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;
import com.primemath.backend.modules.notification.domain.MessageTemplate;

public record MessageTemplateResponse(
        UUID id,
        UUID centerId,
        AttendanceNotificationType type,
        String title,
        String body,
        boolean active,
        OffsetDateTime updatedAt
) {

    public static MessageTemplateResponse from(MessageTemplate template) {
        return new MessageTemplateResponse(
                template.getId(),
                template.getCenterId(),
                template.getType(),
                template.getTitle(),
                template.getBody(),
                template.isActive(),
                template.getUpdatedAt()
        );
    }
}
