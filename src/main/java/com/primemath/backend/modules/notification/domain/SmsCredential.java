package com.primemath.backend.modules.notification.domain;

import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "sms_credential")
public class SmsCredential extends AbstractTimestampedEntity {

    @Id
    @Column(name = "center_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID centerId;

    @Column(name = "api_key_ciphertext", nullable = false, columnDefinition = "text")
    private String apiKeyCiphertext;

    @Column(name = "api_secret_ciphertext", nullable = false, columnDefinition = "text")
    private String apiSecretCiphertext;

    @Column(name = "sender_number", nullable = false, length = 32)
    private String senderNumber;

    protected SmsCredential() {
    }

    public SmsCredential(UUID centerId) {
        this.centerId = centerId;
    }

    public UUID getCenterId() {
        return centerId;
    }

    public String getApiKeyCiphertext() {
        return apiKeyCiphertext;
    }

    public void setApiKeyCiphertext(String apiKeyCiphertext) {
        this.apiKeyCiphertext = apiKeyCiphertext;
    }

    public String getApiSecretCiphertext() {
        return apiSecretCiphertext;
    }

    public void setApiSecretCiphertext(String apiSecretCiphertext) {
        this.apiSecretCiphertext = apiSecretCiphertext;
    }

    public String getSenderNumber() {
        return senderNumber;
    }

    public void setSenderNumber(String senderNumber) {
        this.senderNumber = senderNumber;
    }
}
