package com.primemath.backend.modules.notification.domain;

public enum NotificationDispatchStatus {
    SENT,
    FAILED
}
