package com.primemath.backend.modules.notification.infrastructure.sms;

public record SmsCredentials(String apiKey, String apiSecret, String senderNumber) {

    public boolean isComplete() {
        return notBlank(apiKey) && notBlank(apiSecret) && notBlank(senderNumber);
    }

    @Override
    public String toString() {
        return "SmsCredentials[senderNumber=" + senderNumber + "]";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
