package com.primemath.backend.modules.attendance.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PunchResponse(
        String actionType,
        String message,
        OffsetDateTime checkInAt,
        OffsetDateTime checkOutAt,
        Integer workMinutes
) {

    public static final String CHECK_IN = "check_in";
    public static final String CHECK_OUT = "check_out";
}
