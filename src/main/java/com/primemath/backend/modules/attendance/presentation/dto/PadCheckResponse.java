package com.primemath.backend.modules.attendance.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PadCheckResponse(
        UUID recordId,
        UUID studentId,
        String studentName,
        String className,
        OffsetDateTime time,
        String message
) {
}
