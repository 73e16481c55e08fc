package com.primemath.backend.modules.notification.application;

import java.util.UUID;

import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.center.infrastructure.persistence.CenterRepository;
import com.primemath.backend.modules.notification.domain.SmsCredential;
import com.primemath.backend.modules.notification.infrastructure.crypto.CredentialCipher;
import com.primemath.backend.modules.notification.infrastructure.persistence.SmsCredentialRepository;
import com.primemath.backend.modules.notification.presentation.dto.SmsCredentialResponse;
import com.primemath.backend.modules.notification.presentation.dto.UpdateSmsCredentialRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SmsCredentialService {

    private static final Logger log = LoggerFactory.getLogger(SmsCredentialService.class);

    private final SmsCredentialRepository smsCredentialRepository;
    private final CenterRepository centerRepository;
    private final CredentialCipher credentialCipher;
    private final SmsCredentialResolver credentialResolver;

    public SmsCredentialService(
            SmsCredentialRepository smsCredentialRepository,
            CenterRepository centerRepository,
            CredentialCipher credentialCipher,
            SmsCredentialResolver credentialResolver
    ) {
        this.smsCredentialRepository = smsCredentialRepository;
        this.centerRepository = centerRepository;
        this.credentialCipher = credentialCipher;
        this.credentialResolver = credentialResolver;
    }

    @Transactional(readOnly = true)
    public SmsCredentialResponse getCredential(UUID centerId) {
        ensureCenterExists(centerId);
        return smsCredentialRepository.findById(centerId)
                .map(this::toResponse)
                .orElseGet(() -> SmsCredentialResponse.notConfigured(centerId));
    }

    public SmsCredentialResponse saveCredential(UUID centerId, UpdateSmsCredentialRequest request) {
        ensureCenterExists(centerId);
        SmsCredential credential = smsCredentialRepository.findById(centerId)
                .orElseGet(() -> new SmsCredential(centerId));
        credential.setApiKeyCiphertext(credentialCipher.encrypt(request.apiKey().trim()));
        credential.setApiSecretCiphertext(credentialCipher.encrypt(request.apiSecret().trim()));
        credential.setSenderNumber(request.senderNumber().trim());
        SmsCredential saved = smsCredentialRepository.save(credential);
        credentialResolver.invalidate(centerId);
        log.info("sms credentials updated center={}", centerId);
        return toResponse(saved);
    }

    public void deleteCredential(UUID centerId) {
        ensureCenterExists(centerId);
        smsCredentialRepository.findById(centerId).ifPresent(smsCredentialRepository::delete);
        credentialResolver.invalidate(centerId);
        log.info("sms credentials removed center={}", centerId);
    }

    private SmsCredentialResponse toResponse(SmsCredential credential) {
        String masked;
        try {
            masked = mask(credentialCipher.decrypt(credential.getApiKeyCiphertext()));
        } catch (IllegalStateException ex) {
            log.warn("[ALERT][Notification] stored api key unreadable for center={}", credential.getCenterId());
            masked = "****";
        }
        return new SmsCredentialResponse(
                credential.getCenterId(),
                true,
                masked,
                credential.getSenderNumber(),
                credential.getUpdatedAt()
        );
    }

    static String mask(String apiKey) {
        if (apiKey == null || apiKey.length() <= 4) {
            return "****";
        }
        return "****" + apiKey.substring(apiKey.length() - 4);
    }

    private void ensureCenterExists(UUID centerId) {
        if (!centerRepository.existsById(centerId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "center.not_found", "센터를 찾을 수 없습니다");
        }
    }
}
