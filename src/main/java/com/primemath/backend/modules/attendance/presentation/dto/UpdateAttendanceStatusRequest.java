package com.primemath.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateAttendanceStatusRequest(
        @NotNull UUID studentId,
        @NotNull UUID centerId,
        UUID classId,
        @NotBlank String status,
        LocalDate date
) {
}
