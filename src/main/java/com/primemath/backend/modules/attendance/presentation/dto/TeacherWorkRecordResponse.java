package com.primemath.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.TeacherWorkRecord;

public record TeacherWorkRecordResponse(
        UUID id,
        UUID teacherId,
        String teacherName,
        UUID centerId,
        LocalDate workDate,
        OffsetDateTime checkInAt,
        OffsetDateTime checkOutAt,
        Integer workMinutes,
        boolean noCheckOut
) {

    public static TeacherWorkRecordResponse from(TeacherWorkRecord record, String teacherName) {
        return new TeacherWorkRecordResponse(
                record.getId(),
                record.getTeacherId(),
                teacherName,
                record.getCenterId(),
                record.getWorkDate(),
                record.getCheckInAt(),
                record.getCheckOutAt(),
                record.getWorkMinutes(),
                record.isNoCheckOut()
        );
    }
}
