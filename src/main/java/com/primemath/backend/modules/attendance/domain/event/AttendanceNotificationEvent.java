package com.primemath.backend.modules.attendance.domain.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AttendanceNotificationEvent(
        AttendanceNotificationType type,
        UUID recordId,
        UUID studentId,
        UUID centerId,
        OffsetDateTime occurredAt
) {
}
