package com.primemath.backend.modules.attendance.domain.event;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceNotificationType {
    CHECK_IN("check_in", "attendance_checkin"),
    LATE("late", "late"),
    CHECK_OUT("check_out", "check_out");

    private final String templateKey;
    private final String logType;

    AttendanceNotificationType(String templateKey, String logType) {
        this.templateKey = templateKey;
        this.logType = logType;
    }

    @JsonValue
    public String templateKey() {
        return templateKey;
    }

    public String logType() {
        return logType;
    }

    public static Optional<AttendanceNotificationType> fromTemplateKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AttendanceNotificationType type : values()) {
            if (type.templateKey.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
