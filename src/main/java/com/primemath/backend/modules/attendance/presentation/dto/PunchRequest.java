package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record PunchRequest(
        @NotNull UUID teacherId,
        @NotNull UUID centerId,
        String type
) {
}
