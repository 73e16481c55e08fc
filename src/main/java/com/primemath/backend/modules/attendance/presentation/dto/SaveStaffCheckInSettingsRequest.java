package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SaveStaffCheckInSettingsRequest(
        @NotNull UUID teacherId,
        @NotNull UUID centerId,
        @NotBlank String checkInCode,
        @Size(max = 2) List<String> notificationRecipients,
        @Size(max = 500) String messageTemplate,
        Boolean active
) {
}
