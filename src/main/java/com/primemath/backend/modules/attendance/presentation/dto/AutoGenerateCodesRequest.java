package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AutoGenerateCodesRequest(@NotNull UUID centerId) {
}
