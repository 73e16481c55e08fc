package com.primemath.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.AttendanceRecord;
import com.primemath.backend.modules.attendance.domain.AttendanceStatus;

public record AttendanceRecordResponse(
        UUID id,
        UUID studentId,
        String studentName,
        UUID centerId,
        UUID classId,
        String className,
        LocalDate checkInDate,
        OffsetDateTime checkInAt,
        OffsetDateTime checkOutAt,
        boolean wasLate,
        AttendanceStatus status,
        boolean checkInNotificationSent,
        boolean checkOutNotificationSent,
        boolean lateNotificationSent,
        OffsetDateTime lateNotificationSentAt
) {

    public static AttendanceRecordResponse from(AttendanceRecord record, String studentName, String className) {
        return new AttendanceRecordResponse(
                record.getId(),
                record.getStudentId(),
                studentName,
                record.getCenterId(),
                record.getClassId(),
                className,
                record.getCheckInDate(),
                record.getCheckInAt(),
                record.getCheckOutAt(),
                record.isWasLate(),
                record.getAttendanceStatus(),
                record.isCheckInNotificationSent(),
                record.isCheckOutNotificationSent(),
                record.isLateNotificationSent(),
                record.getLateNotificationSentAt()
        );
    }
}
