package com.primemath.backend.modules.maintenance.presentation;

import com.primemath.backend.modules.maintenance.application.AttendanceMaintenanceService;
import com.primemath.backend.modules.maintenance.application.GradePromotionService;
import com.primemath.backend.modules.maintenance.presentation.dto.GradePromotionResult;
import com.primemath.backend.modules.maintenance.presentation.dto.MissingCheckoutResult;
import com.primemath.backend.modules.maintenance.presentation.dto.RetentionResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/maintenance")
public class AdminMaintenanceController {

    private final AttendanceMaintenanceService attendanceMaintenanceService;
    private final GradePromotionService gradePromotionService;

    public AdminMaintenanceController(
            AttendanceMaintenanceService attendanceMaintenanceService,
            GradePromotionService gradePromotionService
    ) {
        this.attendanceMaintenanceService = attendanceMaintenanceService;
        this.gradePromotionService = gradePromotionService;
    }

    @Operation(summary = "퇴근 누락 표시", description = "어제 근무 기록 중 퇴근 타각이 없는 기록을 표시한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "처리 건수"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 필요")
    })
    @PostMapping("/missing-checkouts")
    public ResponseEntity<MissingCheckoutResult> markMissingCheckouts() {
        return ResponseEntity.ok(attendanceMaintenanceService.markMissingCheckouts());
    }

    @Operation(summary = "보존 기간 정리")
    @PostMapping("/retention")
    public ResponseEntity<RetentionResult> pruneExpiredRecords() {
        return ResponseEntity.ok(attendanceMaintenanceService.pruneExpiredRecords());
    }

    @Operation(summary = "학년 진급", description = "올해 이미 실행했다면 아무것도 바꾸지 않는다.")
    @PostMapping("/grade-promotion")
    public ResponseEntity<GradePromotionResult> promoteGrades() {
        return ResponseEntity.ok(gradePromotionService.promoteIfDue());
    }
}
