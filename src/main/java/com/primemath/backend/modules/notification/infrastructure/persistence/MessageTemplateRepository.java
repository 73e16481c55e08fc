package com.primemath.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;
import com.primemath.backend.modules.notification.domain.MessageTemplate;

import org.springframework.data.jpa.repository.JpaRepository;

public interface MessageTemplateRepository extends JpaRepository<MessageTemplate, UUID> {

    List<MessageTemplate> findByCenterIdOrderByCreatedAtAsc(UUID centerId);

    Optional<MessageTemplate> findFirstByCenterIdAndTypeAndActiveTrueOrderByUpdatedAtDesc(
            UUID centerId,
            AttendanceNotificationType type
    );
}
