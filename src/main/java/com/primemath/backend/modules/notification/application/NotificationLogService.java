package com.primemath.backend.modules.notification.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.AttendanceRecord;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceRecordRepository;
import com.primemath.backend.modules.notification.domain.NotificationLogEntry;
import com.primemath.backend.modules.notification.infrastructure.persistence.NotificationLogEntryRepository;
import com.primemath.backend.modules.notification.presentation.dto.NotificationLogResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 발송 기록 저장과 출결 기록 플래그 갱신. 각 쓰기는 독립 트랜잭션으로 커밋된다.
 */
@Service
public class NotificationLogService {

    private final NotificationLogEntryRepository notificationLogEntryRepository;
    private final AttendanceRecordRepository attendanceRecordRepository;

    public NotificationLogService(
            NotificationLogEntryRepository notificationLogEntryRepository,
            AttendanceRecordRepository attendanceRecordRepository
    ) {
        this.notificationLogEntryRepository = notificationLogEntryRepository;
        this.attendanceRecordRepository = attendanceRecordRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public NotificationLogEntry append(NotificationLogEntry entry) {
        return notificationLogEntryRepository.save(entry);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDelivered(UUID attendanceRecordId, AttendanceNotificationType type, OffsetDateTime at) {
        AttendanceRecord record = attendanceRecordRepository.findById(attendanceRecordId).orElse(null);
        if (record == null) {
            return;
        }
        switch (type) {
            case CHECK_IN -> record.markCheckInNotified();
            case CHECK_OUT -> record.markCheckOutNotified();
            case LATE -> record.markLateNotified(at);
        }
    }

    @Transactional(readOnly = true)
    public List<NotificationLogResponse> listForRecord(UUID attendanceRecordId) {
        if (!attendanceRecordRepository.existsById(attendanceRecordId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "attendance.record_not_found", "출결 기록을 찾을 수 없습니다");
        }
        return notificationLogEntryRepository.findByAttendanceRecordIdOrderBySentAtDesc(attendanceRecordId).stream()
                .map(NotificationLogResponse::from)
                .toList();
    }
}
