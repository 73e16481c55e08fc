package com.primemath.backend.modules.center.infrastructure.persistence;

import java.util.UUID;

import com.primemath.backend.modules.center.domain.ClassEnrollment;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ClassEnrollmentRepository extends JpaRepository<ClassEnrollment, UUID> {
}
