package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Size;

public record UpdateStaffCheckInSettingsRequest(
        String checkInCode,
        @Size(max = 2) List<String> notificationRecipients,
        @Size(max = 500) String messageTemplate,
        Boolean active
) {
}
