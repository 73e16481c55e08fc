package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.StaffCheckInSettings;

public record StaffCheckInSettingsResponse(
        UUID id,
        UUID teacherId,
        String teacherName,
        UUID centerId,
        String checkInCode,
        List<String> notificationRecipients,
        String messageTemplate,
        boolean active
) {

    public static StaffCheckInSettingsResponse from(StaffCheckInSettings settings, String teacherName) {
        return new StaffCheckInSettingsResponse(
                settings.getId(),
                settings.getTeacherId(),
                teacherName,
                settings.getCenterId(),
                settings.getCheckInCode(),
                settings.getNotificationRecipients(),
                settings.getMessageTemplate(),
                settings.isActive()
        );
    }
}
