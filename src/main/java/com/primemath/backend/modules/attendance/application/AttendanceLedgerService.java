package com.primemath.backend.modules.attendance.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.AttendanceRecord;
import com.primemath.backend.modules.attendance.domain.AttendanceStatus;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationEvent;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceRecordRepository;
import com.primemath.backend.modules.attendance.presentation.dto.AttendanceRecordResponse;
import com.primemath.backend.modules.attendance.presentation.dto.ManualCheckInRequest;
import com.primemath.backend.modules.attendance.presentation.dto.UpdateAttendanceStatusRequest;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.center.domain.TutoringClass;
import com.primemath.backend.modules.center.infrastructure.persistence.CenterMembershipRepository;
import com.primemath.backend.modules.center.infrastructure.persistence.TutoringClassRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 학생 출결 원장. 기록 키는 (학생, 센터 기준 날짜, 수업)이다.
 * 알림은 이벤트로만 요청하고 발송은 커밋 이후 비동기로 처리된다.
 */
@Service
@Transactional
public class AttendanceLedgerService {

    private static final Logger log = LoggerFactory.getLogger(AttendanceLedgerService.class);

    private static final LocalDate HISTORY_MIN_DATE = LocalDate.of(2000, 1, 1);
    private static final LocalDate HISTORY_MAX_DATE = LocalDate.of(9999, 12, 31);

    private final AttendanceRecordRepository attendanceRecordRepository;
    private final AppUserRepository appUserRepository;
    private final TutoringClassRepository tutoringClassRepository;
    private final CenterMembershipRepository centerMembershipRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final CenterTime centerTime;

    public AttendanceLedgerService(
            AttendanceRecordRepository attendanceRecordRepository,
            AppUserRepository appUserRepository,
            TutoringClassRepository tutoringClassRepository,
            CenterMembershipRepository centerMembershipRepository,
            ApplicationEventPublisher eventPublisher,
            CenterTime centerTime
    ) {
        this.attendanceRecordRepository = attendanceRecordRepository;
        this.appUserRepository = appUserRepository;
        this.tutoringClassRepository = tutoringClassRepository;
        this.centerMembershipRepository = centerMembershipRepository;
        this.eventPublisher = eventPublisher;
        this.centerTime = centerTime;
    }

    public AttendanceRecord checkIn(UUID centerId, UUID studentId, UUID classId) {
        loadClass(classId, centerId);
        LocalDate today = centerTime.today();
        OffsetDateTime now = centerTime.now();
        Optional<AttendanceRecord> existing = attendanceRecordRepository.findByKey(studentId, today, classId);

        AttendanceRecord record;
        if (existing.isPresent()) {
            record = existing.get();
            if (record.hasCheckedIn()) {
                throw alreadyCheckedIn();
            }
            record.checkIn(now);
        } else {
            record = new AttendanceRecord(studentId, centerId, classId, today);
            record.checkIn(now);
            record = insert(record, AttendanceLedgerService::alreadyCheckedIn);
        }

        publish(AttendanceNotificationType.CHECK_IN, record, now);
        log.info("check-in student={} center={} class={} record={}", studentId, centerId, classId, record.getId());
        return record;
    }

    public AttendanceRecord checkOut(UUID centerId, UUID studentId, UUID classId) {
        loadClass(classId, centerId);
        LocalDate today = centerTime.today();
        OffsetDateTime now = centerTime.now();
        Optional<AttendanceRecord> existing = attendanceRecordRepository.findByKey(studentId, today, classId);

        AttendanceRecord record;
        if (existing.isPresent()) {
            record = existing.get();
            if (record.hasCheckedOut()) {
                throw alreadyCheckedOut();
            }
            record.checkOut(now);
        } else {
            record = new AttendanceRecord(studentId, centerId, classId, today);
            record.checkOut(now);
            record = insert(record, AttendanceLedgerService::alreadyCheckedOut);
        }

        publish(AttendanceNotificationType.CHECK_OUT, record, now);
        log.info("check-out student={} center={} class={} record={}", studentId, centerId, classId, record.getId());
        return record;
    }

    public AttendanceRecordResponse manualStatusUpdate(UpdateAttendanceStatusRequest request) {
        AttendanceStatus status = AttendanceStatus.parse(request.status())
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "attendance.invalid_status",
                        "출결 상태는 pending, present, late, absent 중 하나입니다"));
        AppUser student = loadStudentInCenter(request.studentId(), request.centerId());
        TutoringClass tutoringClass = loadClass(request.classId(), request.centerId());
        LocalDate date = request.date() != null ? request.date() : centerTime.today();

        AttendanceRecord record = attendanceRecordRepository.findByKey(student.getId(), date, request.classId())
                .orElseGet(() -> new AttendanceRecord(student.getId(), request.centerId(), request.classId(), date));
        record.overrideStatus(status);
        if (record.getId() == null) {
            record = insert(record, () -> new ProblemException(HttpStatus.CONFLICT, "attendance.concurrent_update",
                    "다른 요청이 먼저 처리되었습니다. 다시 시도해 주세요"));
        }
        return AttendanceRecordResponse.from(record, student.getFullName(), className(tutoringClass));
    }

    public AttendanceRecordResponse manualCheckIn(ManualCheckInRequest request) {
        AppUser student = loadStudentInCenter(request.studentId(), request.centerId());
        TutoringClass tutoringClass = loadClass(request.classId(), request.centerId());
        LocalDate today = centerTime.today();
        OffsetDateTime now = centerTime.now();

        AttendanceRecord record = attendanceRecordRepository.findByKey(student.getId(), today, request.classId())
                .orElseGet(() -> new AttendanceRecord(student.getId(), request.centerId(), request.classId(), today));
        record.manualCheckIn(now, request.late());
        if (record.getId() == null) {
            record = insert(record, AttendanceLedgerService::alreadyCheckedIn);
        }

        publish(request.late() ? AttendanceNotificationType.LATE : AttendanceNotificationType.CHECK_IN, record, now);
        return AttendanceRecordResponse.from(record, student.getFullName(), className(tutoringClass));
    }

    public void sendLateNotice(UUID recordId) {
        AttendanceRecord record = loadRecord(recordId);
        publish(AttendanceNotificationType.LATE, record, centerTime.now());
    }

    public void resendNotification(UUID recordId, String type) {
        AttendanceNotificationType notificationType = AttendanceNotificationType.fromTemplateKey(type)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "attendance.invalid_notification_type",
                        "알림 유형은 check_in, late, check_out 중 하나입니다"));
        AttendanceRecord record = loadRecord(recordId);
        publish(notificationType, record, centerTime.now());
    }

    @Transactional(readOnly = true)
    public List<AttendanceRecordResponse> listRecordsForDate(UUID centerId, LocalDate date) {
        LocalDate target = date != null ? date : centerTime.today();
        List<AttendanceRecord> records = attendanceRecordRepository
                .findByCenterIdAndCheckInDateOrderByCheckInAtAsc(centerId, target);
        Map<UUID, String> studentNames = studentNames(records);
        Map<UUID, String> classNames = classNames(records);
        return records.stream()
                .map(record -> AttendanceRecordResponse.from(
                        record,
                        studentNames.get(record.getStudentId()),
                        record.getClassId() != null ? classNames.get(record.getClassId()) : null))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AttendanceRecordResponse> listRecordsForStudent(UUID studentId, LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "attendance.invalid_date_range",
                    "시작일은 종료일보다 늦을 수 없습니다");
        }
        AppUser student = appUserRepository.findById(studentId)
                .orElseThrow(AttendanceLedgerService::studentNotFound);
        List<AttendanceRecord> records = attendanceRecordRepository.findHistory(
                studentId,
                startDate != null ? startDate : HISTORY_MIN_DATE,
                endDate != null ? endDate : HISTORY_MAX_DATE
        );
        Map<UUID, String> classNames = classNames(records);
        return records.stream()
                .map(record -> AttendanceRecordResponse.from(
                        record,
                        student.getFullName(),
                        record.getClassId() != null ? classNames.get(record.getClassId()) : null))
                .toList();
    }

    private AttendanceRecord insert(AttendanceRecord record, Supplier<ProblemException> onConflict) {
        try {
            return attendanceRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException ex) {
            log.info("concurrent attendance insert rejected student={} date={} class={}",
                    record.getStudentId(), record.getCheckInDate(), record.getClassId());
            throw onConflict.get();
        }
    }

    private void publish(AttendanceNotificationType type, AttendanceRecord record, OffsetDateTime occurredAt) {
        eventPublisher.publishEvent(new AttendanceNotificationEvent(
                type,
                record.getId(),
                record.getStudentId(),
                record.getCenterId(),
                occurredAt
        ));
    }

    private AttendanceRecord loadRecord(UUID recordId) {
        return attendanceRecordRepository.findById(recordId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "attendance.record_not_found",
                        "출결 기록을 찾을 수 없습니다"));
    }

    private AppUser loadStudentInCenter(UUID studentId, UUID centerId) {
        AppUser student = appUserRepository.findById(studentId)
                .orElseThrow(AttendanceLedgerService::studentNotFound);
        if (!centerMembershipRepository.existsByCenterIdAndUserId(centerId, studentId)) {
            throw studentNotFound();
        }
        return student;
    }

    private TutoringClass loadClass(UUID classId, UUID centerId) {
        if (classId == null) {
            return null;
        }
        return tutoringClassRepository.findById(classId)
                .filter(found -> Objects.equals(found.getCenterId(), centerId))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "attendance.class_not_found",
                        "수업을 찾을 수 없습니다"));
    }

    private Map<UUID, String> studentNames(Collection<AttendanceRecord> records) {
        return appUserRepository.findAllById(records.stream().map(AttendanceRecord::getStudentId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getFullName));
    }

    private Map<UUID, String> classNames(Collection<AttendanceRecord> records) {
        List<UUID> classIds = records.stream()
                .map(AttendanceRecord::getClassId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (classIds.isEmpty()) {
            return Map.of();
        }
        return tutoringClassRepository.findByIdIn(classIds).stream()
                .collect(Collectors.toMap(TutoringClass::getId, TutoringClass::getName, (left, right) -> left));
    }

    private static String className(TutoringClass tutoringClass) {
        return Optional.ofNullable(tutoringClass).map(TutoringClass::getName).orElse(null);
    }

    static ProblemException alreadyCheckedIn() {
        return new ProblemException(HttpStatus.CONFLICT, "attendance.already_checked_in", "이미 출석 체크가 완료되었습니다");
    }

    static ProblemException alreadyCheckedOut() {
        return new ProblemException(HttpStatus.CONFLICT, "attendance.already_checked_out", "이미 하원 체크가 완료되었습니다");
    }

    static ProblemException studentNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "attendance.student_not_found", "학생을 찾을 수 없습니다");
    }
}
