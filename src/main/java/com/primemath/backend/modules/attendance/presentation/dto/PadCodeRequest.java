package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record PadCodeRequest(
        @NotNull UUID centerId,
        @NotBlank String code,
        UUID classId
) {
}
