package com.primemath.backend.modules.center.infrastructure.persistence;

import java.util.UUID;

import com.primemath.backend.modules.center.domain.CenterMembership;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CenterMembershipRepository extends JpaRepository<CenterMembership, UUID> {

    boolean existsByCenterIdAndUserId(UUID centerId, UUID userId);
}
