package com.primemath.backend.modules.notification.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdateMessageTemplateRequest(
        String type,
        @Size(max = 100) String title,
        @Size(max = 1000) String body,
        Boolean active
) {
}
