package com.primemath.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests.
 * Flyway runs through Spring Boot on first context start; each test wipes the data it created
 * while keeping the seeded roles and centers.
 */
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("primemath_test")
            .withUsername("primemath")
            .withPassword("primemath");

    static {
        String apiVersion = System.getenv("DOCKER_API_VERSION");
        if (apiVersion != null && !apiVersion.isBlank()) {
            System.setProperty("docker.api.version", apiVersion);
        }
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("app.maintenance.promote-on-startup", () -> "false");
        registry.add("app.maintenance.missing-checkout-cron", () -> "-");
        registry.add("app.maintenance.retention-cron", () -> "-");
        registry.add("app.maintenance.promotion-cron", () -> "-");
    }

    @AfterEach
    void resetData() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    TRUNCATE TABLE notification_log, staff_check_in_settings, attendance_record,
                                   attendance_code, teacher_work_record, message_template, sms_credential,
                                   system_setting, class_enrollment, tutoring_class, center_membership,
                                   user_session, user_role, app_user
                    CASCADE
                    """);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset test data", ex);
        }
    }
}
