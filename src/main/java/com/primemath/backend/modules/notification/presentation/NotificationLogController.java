package com.primemath.backend.modules.notification.presentation;

import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.notification.application.NotificationLogService;
import com.primemath.backend.modules.notification.presentation.dto.NotificationLogResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class NotificationLogController {

    private final NotificationLogService notificationLogService;

    public NotificationLogController(NotificationLogService notificationLogService) {
        this.notificationLogService = notificationLogService;
    }

    @GetMapping("/attendance/records/{recordId}/notification-logs")
    public ResponseEntity<List<NotificationLogResponse>> listLogs(@PathVariable("recordId") UUID recordId) {
        return ResponseEntity.ok(notificationLogService.listForRecord(recordId));
    }
}
