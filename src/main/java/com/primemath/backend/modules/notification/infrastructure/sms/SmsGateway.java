package com.primemath.backend.modules.notification.infrastructure.sms;

import java.util.UUID;

public interface SmsGateway {

    SmsSendResult send(SmsMessage message, UUID centerId);
}
