package com.primemath.backend.modules.maintenance.infrastructure.persistence;

import java.util.Optional;

import com.primemath.backend.modules.maintenance.domain.SystemSetting;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SystemSettingRepository extends JpaRepository<SystemSetting, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SystemSetting s where s.key = :key")
    Optional<SystemSetting> findForUpdate(@Param("key") String key);
}
