package com.primemath.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);
    private static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-2025";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "app.time.center-zone",
            "app.sms.encryption-key"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(key);
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw);
                if (expiration < 300000 || expiration > 86400000) { // 5분~24시간 (밀리초)
                    invalid.add("jwt.expiration: 300000-86400000 밀리초 범위여야 합니다");
                }
            } catch (NumberFormatException e) {
                invalid.add("jwt.expiration: 숫자여야 합니다");
            }
        });

        if (DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret is the development default; set JWT_SECRET before deploying");
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            log.error("환경변수 검증 실패: missing={} invalid={}", missing, invalid);
            throw new IllegalStateException("Invalid environment configuration: missing=" + missing + ", invalid=" + invalid);
        }

        log.info("환경변수 검증 완료");
    }
}
