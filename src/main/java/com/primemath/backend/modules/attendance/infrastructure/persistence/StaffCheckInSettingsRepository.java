package com.primemath.backend.modules.attendance.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.StaffCheckInSettings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffCheckInSettingsRepository extends JpaRepository<StaffCheckInSettings, UUID> {

    Optional<StaffCheckInSettings> findByTeacherIdAndCenterId(UUID teacherId, UUID centerId);

    Optional<StaffCheckInSettings> findByAttendanceCodeIdAndActiveTrue(UUID attendanceCodeId);

    @Query("""
            select s
              from StaffCheckInSettings s
              join fetch s.attendanceCode
             where s.centerId = :centerId
             order by s.createdAt
            """)
    List<StaffCheckInSettings> findByCenterWithCode(@Param("centerId") UUID centerId);
}
