package com.primemath.backend.modules.notification.infrastructure.sms;

public record SmsMessage(String to, String text) {
}
