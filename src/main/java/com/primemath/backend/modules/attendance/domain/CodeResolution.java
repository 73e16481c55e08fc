package com.primemath.backend.modules.attendance.domain;

import java.util.UUID;

public record CodeResolution(Kind kind, UUID studentId, UUID teacherId, UUID settingsId, boolean legacy) {

    public enum Kind {
        STUDENT,
        STAFF,
        NOT_FOUND
    }

    public static CodeResolution student(UUID studentId) {
        return new CodeResolution(Kind.STUDENT, studentId, null, null, false);
    }

    public static CodeResolution staff(UUID teacherId, UUID settingsId) {
        return new CodeResolution(Kind.STAFF, null, teacherId, settingsId, false);
    }

    public static CodeResolution legacyStaff(UUID teacherId) {
        return new CodeResolution(Kind.STAFF, null, teacherId, null, true);
    }

    public static CodeResolution notFound() {
        return new CodeResolution(Kind.NOT_FOUND, null, null, null, false);
    }

    public boolean isFound() {
        return kind != Kind.NOT_FOUND;
    }
}
