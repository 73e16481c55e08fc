package com.primemath.backend.modules.attendance.presentation;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.application.TeacherWorkService;
import com.primemath.backend.modules.attendance.presentation.dto.PunchRequest;
import com.primemath.backend.modules.attendance.presentation.dto.PunchResponse;
import com.primemath.backend.modules.attendance.presentation.dto.TeacherWorkRecordResponse;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/teacher-work")
public class TeacherWorkController {

    private final TeacherWorkService teacherWorkService;

    public TeacherWorkController(TeacherWorkService teacherWorkService) {
        this.teacherWorkService = teacherWorkService;
    }

    @PostMapping("/punch")
    public ResponseEntity<PunchResponse> punch(@Valid @RequestBody PunchRequest request) {
        return ResponseEntity.ok(teacherWorkService.punch(request));
    }

    @GetMapping("/records")
    public ResponseEntity<List<TeacherWorkRecordResponse>> listRecords(
            @RequestParam("centerId") UUID centerId,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        return ResponseEntity.ok(teacherWorkService.listWorkRecords(centerId, startDate, endDate));
    }

    @GetMapping("/work-days")
    public ResponseEntity<Map<UUID, Long>> workDays(
            @RequestParam("centerId") UUID centerId,
            @RequestParam("yearMonth") String yearMonth
    ) {
        YearMonth month;
        try {
            month = YearMonth.parse(yearMonth);
        } catch (DateTimeParseException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "teacher_work.invalid_year_month",
                    "yearMonth는 yyyy-MM 형식입니다");
        }
        return ResponseEntity.ok(teacherWorkService.countWorkDays(centerId, month));
    }
}
