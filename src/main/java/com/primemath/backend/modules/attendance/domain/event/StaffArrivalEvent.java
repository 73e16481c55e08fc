package com.primemath.backend.modules.attendance.domain.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record StaffArrivalEvent(
        UUID teacherId,
        UUID centerId,
        UUID settingsId,
        OffsetDateTime occurredAt
) {
}
