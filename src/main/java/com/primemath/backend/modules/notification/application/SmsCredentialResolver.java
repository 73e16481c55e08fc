package com.primemath.backend.modules.notification.application;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.center.domain.Center;
import com.primemath.backend.modules.center.infrastructure.persistence.CenterRepository;
import com.primemath.backend.modules.notification.domain.SmsCredential;
import com.primemath.backend.modules.notification.infrastructure.crypto.CredentialCipher;
import com.primemath.backend.modules.notification.infrastructure.persistence.SmsCredentialRepository;
import com.primemath.backend.modules.notification.infrastructure.sms.SmsCredentials;
import com.primemath.backend.modules.notification.infrastructure.sms.SmsProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 센터 발송 자격 증명 조회. DB 값을 우선하고, 없거나 복호화에 실패하면 센터 이름 기준 환경 설정을 쓴다.
 */
@Component
public class SmsCredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(SmsCredentialResolver.class);

    private final SmsCredentialRepository smsCredentialRepository;
    private final CenterRepository centerRepository;
    private final CredentialCipher credentialCipher;
    private final SmsProperties properties;
    private final CredentialCache<UUID, SmsCredentials> cache;

    public SmsCredentialResolver(
            SmsCredentialRepository smsCredentialRepository,
            CenterRepository centerRepository,
            CredentialCipher credentialCipher,
            SmsProperties properties,
            Clock clock
    ) {
        this.smsCredentialRepository = smsCredentialRepository;
        this.centerRepository = centerRepository;
        this.credentialCipher = credentialCipher;
        this.properties = properties;
        this.cache = new CredentialCache<>(clock, properties.getCredentialCacheTtl(),
                properties.getCredentialCacheMaxEntries());
    }

    public Optional<SmsCredentials> resolve(UUID centerId) {
        return Optional.ofNullable(cache.getOrCompute(centerId, this::load));
    }

    public void invalidate(UUID centerId) {
        cache.invalidate(centerId);
    }

    private SmsCredentials load(UUID centerId) {
        Optional<SmsCredential> stored = smsCredentialRepository.findById(centerId);
        if (stored.isPresent()) {
            try {
                SmsCredentials decrypted = new SmsCredentials(
                        credentialCipher.decrypt(stored.get().getApiKeyCiphertext()),
                        credentialCipher.decrypt(stored.get().getApiSecretCiphertext()),
                        stored.get().getSenderNumber()
                );
                if (decrypted.isComplete()) {
                    return decrypted;
                }
            } catch (IllegalStateException ex) {
                log.warn("[ALERT][Notification] stored sms credentials unreadable for center={}: {}",
                        centerId, ex.getMessage());
            }
        }

        return centerRepository.findById(centerId)
                .map(Center::getName)
                .map(name -> properties.getFallback().get(name))
                .map(fallback -> new SmsCredentials(fallback.getApiKey(), fallback.getApiSecret(),
                        fallback.getSenderNumber()))
                .filter(SmsCredentials::isComplete)
                .orElse(null);
    }
}
