package com.primemath.backend.modules.attendance.domain;

public enum CodeOwnerKind {
    STUDENT,
    STAFF
}
