package com.primemath.backend.modules.attendance.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PadValidationResponse(
        String type,
        StudentSummary student,
        List<ClassSummary> classes,
        StaffSummary teacher,
        OffsetDateTime checkInTime,
        String message
) {

    public static final String TYPE_STUDENT = "student";
    public static final String TYPE_STAFF = "teacher";

    public record StudentSummary(UUID id, String name, String grade) {
    }

    public record ClassSummary(UUID id, String name) {
    }

    public record StaffSummary(UUID id, String name) {
    }

    public static PadValidationResponse forStudent(StudentSummary student, List<ClassSummary> classes) {
        return new PadValidationResponse(TYPE_STUDENT, student, classes, null, null, null);
    }

    public static PadValidationResponse forStaff(StaffSummary teacher, OffsetDateTime checkInTime) {
        return new PadValidationResponse(TYPE_STAFF, null, null, teacher, checkInTime,
                teacher.name() + " 선생님 출근!");
    }
}
