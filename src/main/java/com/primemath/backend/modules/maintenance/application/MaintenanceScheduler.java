package com.primemath.backend.modules.maintenance.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final AttendanceMaintenanceService attendanceMaintenanceService;
    private final GradePromotionService gradePromotionService;
    private final MaintenanceProperties properties;

    public MaintenanceScheduler(
            AttendanceMaintenanceService attendanceMaintenanceService,
            GradePromotionService gradePromotionService,
            MaintenanceProperties properties
    ) {
        this.attendanceMaintenanceService = attendanceMaintenanceService;
        this.gradePromotionService = gradePromotionService;
        this.properties = properties;
    }

    @Scheduled(cron = "${app.maintenance.missing-checkout-cron:0 5 0 * * *}", zone = "${app.time.center-zone:Asia/Seoul}")
    public void markMissingCheckouts() {
        try {
            attendanceMaintenanceService.markMissingCheckouts();
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Batch][missing-checkout] failed", ex);
        }
    }

    @Scheduled(cron = "${app.maintenance.retention-cron:0 30 3 * * *}", zone = "${app.time.center-zone:Asia/Seoul}")
    public void pruneExpiredRecords() {
        try {
            attendanceMaintenanceService.pruneExpiredRecords();
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Batch][retention] failed", ex);
        }
    }

    @Scheduled(cron = "${app.maintenance.promotion-cron:0 0 1 * * *}", zone = "${app.time.center-zone:Asia/Seoul}")
    public void promoteGrades() {
        runPromotion();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void promoteGradesOnStartup() {
        if (properties.isPromoteOnStartup()) {
            runPromotion();
        }
    }

    private void runPromotion() {
        try {
            gradePromotionService.promoteIfDue();
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Batch][grade-promotion] failed", ex);
        }
    }
}
