package com.primemath.backend.modules.auth.domain;

public enum AppUserStatus {
    ACTIVE,
    INACTIVE
}
