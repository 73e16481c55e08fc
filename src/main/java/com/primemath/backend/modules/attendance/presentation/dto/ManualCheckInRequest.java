package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ManualCheckInRequest(
        @NotNull UUID studentId,
        @NotNull UUID centerId,
        UUID classId,
        boolean late
) {
}
