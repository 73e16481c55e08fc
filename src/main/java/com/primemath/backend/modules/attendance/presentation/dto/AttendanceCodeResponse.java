package com.primemath.backend.modules.attendance.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.AttendanceCode;
import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;

public record AttendanceCodeResponse(
        UUID id,
        UUID centerId,
        UUID ownerId,
        String ownerName,
        CodeOwnerKind ownerKind,
        String code,
        OffsetDateTime createdAt
) {

    public static AttendanceCodeResponse from(AttendanceCode code, String ownerName) {
        return new AttendanceCodeResponse(
                code.getId(),
                code.getCenterId(),
                code.getOwnerId(),
                ownerName,
                code.getOwnerKind(),
                code.getCode(),
                code.getCreatedAt()
        );
    }
}
