package com.primemath.backend.modules.notification.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateMessageTemplateRequest(
        @NotNull UUID centerId,
        @NotBlank String type,
        @NotBlank @Size(max = 100) String title,
        @NotBlank @Size(max = 1000) String body,
        Boolean active
) {
}
