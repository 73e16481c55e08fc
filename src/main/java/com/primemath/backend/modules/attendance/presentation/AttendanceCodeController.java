package com.primemath.backend.modules.attendance.presentation;

import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.attendance.application.CodeRegistryService;
import com.primemath.backend.modules.attendance.presentation.dto.AttendanceCodeResponse;
import com.primemath.backend.modules.attendance.presentation.dto.AutoGenerateCodesRequest;
import com.primemath.backend.modules.attendance.presentation.dto.AutoGenerateCodesResponse;
import com.primemath.backend.modules.attendance.presentation.dto.RegisterAttendanceCodeRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/attendance-codes")
public class AttendanceCodeController {

    private final CodeRegistryService codeRegistryService;

    public AttendanceCodeController(CodeRegistryService codeRegistryService) {
        this.codeRegistryService = codeRegistryService;
    }

    @GetMapping
    public ResponseEntity<List<AttendanceCodeResponse>> listCodes(@RequestParam("centerId") UUID centerId) {
        return ResponseEntity.ok(codeRegistryService.listCodes(centerId));
    }

    @Operation(summary = "출결번호 등록", description = "코드를 비우면 소유자 전화번호에서 만든다. 기존 코드는 비활성화된다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "형식 오류 또는 전화번호 사용 불가"),
            @ApiResponse(responseCode = "409", description = "센터 안에서 이미 사용 중인 코드")
    })
    @PostMapping
    public ResponseEntity<AttendanceCodeResponse> registerCode(@Valid @RequestBody RegisterAttendanceCodeRequest request) {
        return ResponseEntity.status(201).body(codeRegistryService.registerCode(request));
    }

    @DeleteMapping("/{codeId}")
    public ResponseEntity<Void> deactivateCode(@PathVariable("codeId") UUID codeId) {
        codeRegistryService.deactivateCode(codeId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/auto-generate")
    public ResponseEntity<AutoGenerateCodesResponse> autoGenerate(@Valid @RequestBody AutoGenerateCodesRequest request) {
        return ResponseEntity.ok(codeRegistryService.autoGenerateMissingCodes(request.centerId()));
    }
}
