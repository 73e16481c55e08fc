package com.primemath.backend.modules.attendance.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.TeacherWorkRecord;
import com.primemath.backend.modules.attendance.infrastructure.persistence.TeacherWorkRecordRepository;
import com.primemath.backend.modules.attendance.presentation.dto.PunchRequest;
import com.primemath.backend.modules.attendance.presentation.dto.PunchResponse;
import com.primemath.backend.modules.attendance.presentation.dto.TeacherWorkRecordResponse;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TeacherWorkService {

    private static final Logger log = LoggerFactory.getLogger(TeacherWorkService.class);

    private final TeacherWorkRecordRepository teacherWorkRecordRepository;
    private final AppUserRepository appUserRepository;
    private final CenterTime centerTime;

    public TeacherWorkService(
            TeacherWorkRecordRepository teacherWorkRecordRepository,
            AppUserRepository appUserRepository,
            CenterTime centerTime
    ) {
        this.teacherWorkRecordRepository = teacherWorkRecordRepository;
        this.appUserRepository = appUserRepository;
        this.centerTime = centerTime;
    }

    public PunchResponse punch(PunchRequest request) {
        AppUser teacher = appUserRepository.findById(request.teacherId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "teacher_work.teacher_not_found",
                        "선생님을 찾을 수 없습니다"));
        if (!appUserRepository.hasAnyActiveRole(teacher.getId(), CodeRegistryService.STAFF_ROLES)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "teacher_work.not_staff", "선생님 계정이 아닙니다");
        }

        LocalDate today = centerTime.today();
        OffsetDateTime now = centerTime.now();
        String clock = formatClock(now);

        TeacherWorkRecord existing = teacherWorkRecordRepository
                .findByTeacherIdAndCenterIdAndWorkDate(teacher.getId(), request.centerId(), today)
                .orElse(null);
        if (existing == null) {
            try {
                teacherWorkRecordRepository.saveAndFlush(
                        new TeacherWorkRecord(teacher.getId(), request.centerId(), today, now));
            } catch (DataIntegrityViolationException ex) {
                throw new ProblemException(HttpStatus.CONFLICT, "teacher_work.concurrent_punch",
                        "이미 처리 중인 출퇴근 기록이 있습니다");
            }
            log.info("staff punch in teacher={} center={} date={}", teacher.getId(), request.centerId(), today);
            return new PunchResponse(
                    PunchResponse.CHECK_IN,
                    teacher.getFullName() + " 출근 완료! (" + clock + ")",
                    now,
                    null,
                    null
            );
        }

        existing.punchOut(now);
        int minutes = existing.getWorkMinutes();
        log.info("staff punch out teacher={} center={} minutes={}", teacher.getId(), request.centerId(), minutes);
        return new PunchResponse(
                PunchResponse.CHECK_OUT,
                teacher.getFullName() + " 퇴근 완료! (" + clock + ") - 근무시간: "
                        + (minutes / 60) + "시간 " + (minutes % 60) + "분",
                existing.getCheckInAt(),
                now,
                minutes
        );
    }

    @Transactional(readOnly = true)
    public List<TeacherWorkRecordResponse> listWorkRecords(UUID centerId, LocalDate startDate, LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "attendance.invalid_date_range",
                    "시작일은 종료일보다 늦을 수 없습니다");
        }
        List<TeacherWorkRecord> records = teacherWorkRecordRepository.findInRange(centerId, startDate, endDate);
        Map<UUID, String> names = appUserRepository.findAllById(
                        records.stream().map(TeacherWorkRecord::getTeacherId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getFullName));
        return records.stream()
                .map(record -> TeacherWorkRecordResponse.from(record, names.get(record.getTeacherId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public Map<UUID, Long> countWorkDays(UUID centerId, YearMonth yearMonth) {
        return teacherWorkRecordRepository.findInRange(centerId, yearMonth.atDay(1), yearMonth.atEndOfMonth())
                .stream()
                .collect(Collectors.groupingBy(TeacherWorkRecord::getTeacherId, LinkedHashMap::new, Collectors.counting()));
    }

    private String formatClock(OffsetDateTime now) {
        ZonedDateTime local = centerTime.toLocal(now);
        return String.format("%02d:%02d", local.getHour(), local.getMinute());
    }
}
