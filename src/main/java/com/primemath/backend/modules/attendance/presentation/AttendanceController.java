package com.primemath.backend.modules.attendance.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.attendance.application.AttendanceLedgerService;
import com.primemath.backend.modules.attendance.presentation.dto.AttendanceRecordResponse;
import com.primemath.backend.modules.attendance.presentation.dto.ManualCheckInRequest;
import com.primemath.backend.modules.attendance.presentation.dto.ResendNotificationRequest;
import com.primemath.backend.modules.attendance.presentation.dto.UpdateAttendanceStatusRequest;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/attendance")
public class AttendanceController {

    private final AttendanceLedgerService attendanceLedgerService;

    public AttendanceController(AttendanceLedgerService attendanceLedgerService) {
        this.attendanceLedgerService = attendanceLedgerService;
    }

    @GetMapping("/records")
    public ResponseEntity<List<AttendanceRecordResponse>> listRecords(
            @RequestParam("centerId") UUID centerId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(attendanceLedgerService.listRecordsForDate(centerId, date));
    }

    @GetMapping("/students/{studentId}/history")
    public ResponseEntity<List<AttendanceRecordResponse>> studentHistory(
            @PathVariable("studentId") UUID studentId,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        return ResponseEntity.ok(attendanceLedgerService.listRecordsForStudent(studentId, startDate, endDate));
    }

    @PatchMapping("/status")
    public ResponseEntity<AttendanceRecordResponse> updateStatus(@Valid @RequestBody UpdateAttendanceStatusRequest request) {
        return ResponseEntity.ok(attendanceLedgerService.manualStatusUpdate(request));
    }

    @PostMapping("/manual-check-in")
    public ResponseEntity<AttendanceRecordResponse> manualCheckIn(@Valid @RequestBody ManualCheckInRequest request) {
        return ResponseEntity.ok(attendanceLedgerService.manualCheckIn(request));
    }

    @PostMapping("/records/{recordId}/late-notify")
    public ResponseEntity<Void> sendLateNotice(@PathVariable("recordId") UUID recordId) {
        attendanceLedgerService.sendLateNotice(recordId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/records/{recordId}/resend")
    public ResponseEntity<Void> resend(
            @PathVariable("recordId") UUID recordId,
            @Valid @RequestBody ResendNotificationRequest request
    ) {
        attendanceLedgerService.resendNotification(recordId, request.type());
        return ResponseEntity.accepted().build();
    }
}
