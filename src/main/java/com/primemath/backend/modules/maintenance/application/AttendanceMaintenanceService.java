package com.primemath.backend.modules.maintenance.application;

import java.time.LocalDate;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceRecordRepository;
import com.primemath.backend.modules.attendance.infrastructure.persistence.TeacherWorkRecordRepository;
import com.primemath.backend.modules.maintenance.presentation.dto.MissingCheckoutResult;
import com.primemath.backend.modules.maintenance.presentation.dto.RetentionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AttendanceMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(AttendanceMaintenanceService.class);

    private final AttendanceRecordRepository attendanceRecordRepository;
    private final TeacherWorkRecordRepository teacherWorkRecordRepository;
    private final MaintenanceProperties properties;
    private final CenterTime centerTime;

    public AttendanceMaintenanceService(
            AttendanceRecordRepository attendanceRecordRepository,
            TeacherWorkRecordRepository teacherWorkRecordRepository,
            MaintenanceProperties properties,
            CenterTime centerTime
    ) {
        this.attendanceRecordRepository = attendanceRecordRepository;
        this.teacherWorkRecordRepository = teacherWorkRecordRepository;
        this.properties = properties;
        this.centerTime = centerTime;
    }

    /**
     * 어제 근무 기록 중 퇴근 타각이 없는 것을 퇴근 누락으로 표시한다. 퇴근 시각은 만들지 않는다.
     */
    public MissingCheckoutResult markMissingCheckouts() {
        LocalDate yesterday = centerTime.today().minusDays(1);
        int marked = teacherWorkRecordRepository.markMissingCheckouts(yesterday);
        log.info("missing check-out marked workDate={} count={}", yesterday, marked);
        return new MissingCheckoutResult(yesterday, marked);
    }

    public RetentionResult pruneExpiredRecords() {
        LocalDate today = centerTime.today();
        LocalDate attendanceCutoff = today.minus(properties.getAttendanceRetention());
        LocalDate workCutoff = today.minus(properties.getWorkRecordRetention());
        int attendanceDeleted = attendanceRecordRepository.deleteOlderThan(attendanceCutoff);
        int workDeleted = teacherWorkRecordRepository.deleteOlderThan(workCutoff);
        log.info("retention pruned attendance<{}={} work<{}={}", attendanceCutoff, attendanceDeleted,
                workCutoff, workDeleted);
        return new RetentionResult(attendanceCutoff, attendanceDeleted, workCutoff, workDeleted);
    }
}
