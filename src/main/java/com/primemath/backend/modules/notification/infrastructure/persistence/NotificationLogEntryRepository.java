package com.primemath.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.notification.domain.NotificationLogEntry;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationLogEntryRepository extends JpaRepository<NotificationLogEntry, UUID> {

    List<NotificationLogEntry> findByAttendanceRecordIdOrderBySentAtDesc(UUID attendanceRecordId);

    long countByAttendanceRecordId(UUID attendanceRecordId);
}
