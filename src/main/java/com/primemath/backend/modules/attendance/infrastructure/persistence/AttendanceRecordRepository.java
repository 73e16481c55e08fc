package com.primemath.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.AttendanceRecord;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, UUID> {

    @Query("""
            select r
              from AttendanceRecord r
             where r.studentId = :studentId
               and r.checkInDate = :date
               and r.classId = :classId
            """)
    Optional<AttendanceRecord> findClassRecord(
            @Param("studentId") UUID studentId,
            @Param("date") LocalDate date,
            @Param("classId") UUID classId
    );

    @Query("""
            select r
              from AttendanceRecord r
             where r.studentId = :studentId
               and r.checkInDate = :date
               and r.classId is null
            """)
    Optional<AttendanceRecord> findCenterRecord(@Param("studentId") UUID studentId, @Param("date") LocalDate date);

    default Optional<AttendanceRecord> findByKey(UUID studentId, LocalDate date, UUID classId) {
        return classId == null ? findCenterRecord(studentId, date) : findClassRecord(studentId, date, classId);
    }

    List<AttendanceRecord> findByCenterIdAndCheckInDateOrderByCheckInAtAsc(UUID centerId, LocalDate checkInDate);

    @Query("""
            select r
              from AttendanceRecord r
             where r.studentId = :studentId
               and r.checkInDate between :startDate and :endDate
             order by r.checkInDate desc, r.checkInAt desc
            """)
    List<AttendanceRecord> findHistory(
            @Param("studentId") UUID studentId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Modifying
    @Query("delete from AttendanceRecord r where r.checkInDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
