package com.primemath.backend.modules.attendance.presentation;

import com.primemath.backend.modules.attendance.application.AttendancePadService;
import com.primemath.backend.modules.attendance.presentation.dto.PadCheckResponse;
import com.primemath.backend.modules.attendance.presentation.dto.PadCodeRequest;
import com.primemath.backend.modules.attendance.presentation.dto.PadValidationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/attendance-pad")
public class AttendancePadController {

    private final AttendancePadService attendancePadService;

    public AttendancePadController(AttendancePadService attendancePadService) {
        this.attendancePadService = attendancePadService;
    }

    @Operation(summary = "출결번호 확인", description = "학생이면 수강 중인 수업 목록을, 선생님이면 출근 확인 메시지를 돌려준다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "확인 성공"),
            @ApiResponse(responseCode = "400", description = "4자리 숫자가 아님"),
            @ApiResponse(responseCode = "404", description = "등록되지 않은 출결번호")
    })
    @PostMapping("/validate")
    public ResponseEntity<PadValidationResponse> validate(@Valid @RequestBody PadCodeRequest request) {
        return ResponseEntity.ok(attendancePadService.validateCode(request));
    }

    @Operation(summary = "등원 체크")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "등원 처리"),
            @ApiResponse(responseCode = "409", description = "이미 등원 처리됨")
    })
    @PostMapping("/check-in")
    public ResponseEntity<PadCheckResponse> checkIn(@Valid @RequestBody PadCodeRequest request) {
        return ResponseEntity.ok(attendancePadService.checkIn(request));
    }

    @Operation(summary = "하원 체크")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "하원 처리"),
            @ApiResponse(responseCode = "409", description = "이미 하원 처리됨")
    })
    @PostMapping("/check-out")
    public ResponseEntity<PadCheckResponse> checkOut(@Valid @RequestBody PadCodeRequest request) {
        return ResponseEntity.ok(attendancePadService.checkOut(request));
    }
}
