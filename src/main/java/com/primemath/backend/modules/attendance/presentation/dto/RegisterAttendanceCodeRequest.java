package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;

import jakarta.validation.constraints.NotNull;

public record RegisterAttendanceCodeRequest(
        @NotNull UUID centerId,
        @NotNull UUID ownerId,
        CodeOwnerKind ownerKind,
        String code
) {
}
