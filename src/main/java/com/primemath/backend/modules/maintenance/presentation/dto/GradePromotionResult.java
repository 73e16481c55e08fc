package com.primemath.backend.modules.maintenance.presentation.dto;

public record GradePromotionResult(boolean executed, int year, int studentsPromoted) {

    public static GradePromotionResult skipped(int year) {
        return new GradePromotionResult(false, year, 0);
    }
}
