package com.primemath.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.TeacherWorkRecord;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeacherWorkRecordRepository extends JpaRepository<TeacherWorkRecord, UUID> {

    Optional<TeacherWorkRecord> findByTeacherIdAndCenterIdAndWorkDate(UUID teacherId, UUID centerId, LocalDate workDate);

    @Query("""
            select w
              from TeacherWorkRecord w
             where w.centerId = :centerId
               and w.workDate between :startDate and :endDate
             order by w.workDate desc, w.checkInAt
            """)
    List<TeacherWorkRecord> findInRange(
            @Param("centerId") UUID centerId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Modifying
    @Query("""
            update TeacherWorkRecord w
               set w.noCheckOut = true
             where w.workDate = :workDate
               and w.checkOutAt is null
               and w.noCheckOut = false
            """)
    int markMissingCheckouts(@Param("workDate") LocalDate workDate);

    @Modifying
    @Query("delete from TeacherWorkRecord w where w.workDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
