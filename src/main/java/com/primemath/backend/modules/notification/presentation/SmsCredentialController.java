package com.primemath.backend.modules.notification.presentation;

import java.util.UUID;

import com.primemath.backend.modules.notification.application.SmsCredentialService;
import com.primemath.backend.modules.notification.presentation.dto.SmsCredentialResponse;
import com.primemath.backend.modules.notification.presentation.dto.UpdateSmsCredentialRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/centers/{centerId}/sms-credentials")
public class SmsCredentialController {

    private final SmsCredentialService smsCredentialService;

    public SmsCredentialController(SmsCredentialService smsCredentialService) {
        this.smsCredentialService = smsCredentialService;
    }

    @Operation(summary = "문자 발송 설정 조회", description = "API 키는 끝 4자리만 보여준다.")
    @GetMapping
    public ResponseEntity<SmsCredentialResponse> getCredential(@PathVariable("centerId") UUID centerId) {
        return ResponseEntity.ok(smsCredentialService.getCredential(centerId));
    }

    @Operation(summary = "문자 발송 설정 저장", description = "키와 시크릿은 암호화해 저장하고 캐시를 비운다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "저장 성공"),
            @ApiResponse(responseCode = "403", description = "원장 또는 관리자 권한 필요"),
            @ApiResponse(responseCode = "422", description = "필수 값 누락")
    })
    @PutMapping
    public ResponseEntity<SmsCredentialResponse> saveCredential(
            @PathVariable("centerId") UUID centerId,
            @Valid @RequestBody UpdateSmsCredentialRequest request
    ) {
        return ResponseEntity.ok(smsCredentialService.saveCredential(centerId, request));
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteCredential(@PathVariable("centerId") UUID centerId) {
        smsCredentialService.deleteCredential(centerId);
        return ResponseEntity.noContent().build();
    }
}
