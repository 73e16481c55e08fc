package com.primemath.backend.modules.maintenance.presentation.dto;

import java.time.LocalDate;

public record RetentionResult(
        LocalDate attendanceCutoff,
        int attendanceRecordsDeleted,
        LocalDate workRecordCutoff,
        int workRecordsDeleted
) {
}
