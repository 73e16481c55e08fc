package com.primemath.backend.modules.notification.infrastructure.sms;

public record SmsSendResult(boolean success, String error) {

    public static SmsSendResult sent() {
        return new SmsSendResult(true, null);
    }

    public static SmsSendResult failed(String error) {
        return new SmsSendResult(false, error);
    }
}
