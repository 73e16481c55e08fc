package com.primemath.backend.modules.attendance.presentation.dto;

import java.util.List;
import java.util.UUID;

public record AutoGenerateCodesResponse(
        int created,
        int skipped,
        List<CreatedCode> createdCodes,
        List<SkippedStudent> skippedStudents
) {

    public record CreatedCode(UUID studentId, String code) {
    }

    public record SkippedStudent(UUID studentId, String reason) {
    }
}
