package com.primemath.backend.modules.notification.infrastructure.persistence;

import java.util.UUID;

import com.primemath.backend.modules.notification.domain.SmsCredential;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SmsCredentialRepository extends JpaRepository<SmsCredential, UUID> {
}
