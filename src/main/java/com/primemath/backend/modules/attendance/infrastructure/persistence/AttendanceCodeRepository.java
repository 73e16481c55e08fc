package com.primemath.backend.modules.attendance.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.AttendanceCode;
import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AttendanceCodeRepository extends JpaRepository<AttendanceCode, UUID> {

    Optional<AttendanceCode> findByCenterIdAndCodeAndActiveTrue(UUID centerId, String code);

    Optional<AttendanceCode> findByCenterIdAndCodeAndOwnerKindAndActiveTrue(
            UUID centerId,
            String code,
            CodeOwnerKind ownerKind
    );

    Optional<AttendanceCode> findByCenterIdAndOwnerIdAndOwnerKindAndActiveTrue(
            UUID centerId,
            UUID ownerId,
            CodeOwnerKind ownerKind
    );

    boolean existsByCenterIdAndCodeAndActiveTrue(UUID centerId, String code);

    @Query("""
            select c
              from AttendanceCode c
             where c.centerId = :centerId
               and c.active = true
             order by c.ownerKind, c.code
            """)
    List<AttendanceCode> findActiveByCenter(@Param("centerId") UUID centerId);

    @Query("""
            select c.ownerId
              from AttendanceCode c
             where c.centerId = :centerId
               and c.ownerKind = :ownerKind
               and c.active = true
            """)
    List<UUID> findActiveOwnerIds(@Param("centerId") UUID centerId, @Param("ownerKind") CodeOwnerKind ownerKind);
}
