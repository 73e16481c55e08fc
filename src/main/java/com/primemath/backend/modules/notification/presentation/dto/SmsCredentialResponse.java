package com.primemath.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SmsCredentialResponse(
        UUID centerId,
        boolean configured,
        String apiKeyMasked,
        String senderNumber,
        OffsetDateTime updatedAt
) {

    public static SmsCredentialResponse notConfigured(UUID centerId) {
        return new SmsCredentialResponse(centerId, false, null, null, null);
    }
}
