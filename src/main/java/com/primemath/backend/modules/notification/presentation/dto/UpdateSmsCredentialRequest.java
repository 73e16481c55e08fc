package com.primemath.backend.modules.notification.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateSmsCredentialRequest(
        @NotBlank String apiKey,
        @NotBlank String apiSecret,
        @NotBlank @Size(max = 32) String senderNumber
) {

    @Override
    public String toString() {
        return "UpdateSmsCredentialRequest[senderNumber=" + senderNumber + "]";
    }
}
