package com.primemath.backend.modules.center.infrastructure.persistence;

import java.util.UUID;

import com.primemath.backend.modules.center.domain.Center;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CenterRepository extends JpaRepository<Center, UUID> {
}
