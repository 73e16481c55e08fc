package com.primemath.backend.modules.notification.domain;

public enum RecipientRole {
    MOTHER,
    FATHER,
    STAFF_RECIPIENT,
    STAFF_SELF
}
