package com.primemath.backend.modules.attendance.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ResendNotificationRequest(@NotBlank String type) {
}
