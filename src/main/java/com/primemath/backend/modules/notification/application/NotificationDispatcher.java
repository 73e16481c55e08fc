package com.primemath.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.global.config.AsyncConfig;
import com.primemath.backend.modules.attendance.domain.StaffCheckInSettings;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationEvent;
import com.primemath.backend.modules.attendance.domain.event.StaffArrivalEvent;
import com.primemath.backend.modules.attendance.infrastructure.persistence.StaffCheckInSettingsRepository;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.center.domain.Center;
import com.primemath.backend.modules.center.infrastructure.persistence.CenterRepository;
import com.primemath.backend.modules.notification.domain.MessageTemplate;
import com.primemath.backend.modules.notification.domain.NotificationDispatchStatus;
import com.primemath.backend.modules.notification.domain.NotificationLogEntry;
import com.primemath.backend.modules.notification.domain.RecipientRole;
import com.primemath.backend.modules.notification.infrastructure.sms.SmsGateway;
import com.primemath.backend.modules.notification.infrastructure.sms.SmsMessage;
import com.primemath.backend.modules.notification.infrastructure.sms.SmsSendResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 출결 이벤트를 받아 보호자/선생님에게 문자를 보낸다.
 * 커밋 이후 알림 전용 실행기에서 돌며, 어떤 실패도 호출자에게 전파하지 않는다.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final String STAFF_ARRIVAL_TYPE = "staff_check_in";

    private final AppUserRepository appUserRepository;
    private final CenterRepository centerRepository;
    private final StaffCheckInSettingsRepository staffCheckInSettingsRepository;
    private final MessageTemplateService messageTemplateService;
    private final MessageRenderer messageRenderer;
    private final SmsGateway smsGateway;
    private final NotificationLogService notificationLogService;
    private final Clock clock;

    public NotificationDispatcher(
            AppUserRepository appUserRepository,
            CenterRepository centerRepository,
            StaffCheckInSettingsRepository staffCheckInSettingsRepository,
            MessageTemplateService messageTemplateService,
            MessageRenderer messageRenderer,
            SmsGateway smsGateway,
            NotificationLogService notificationLogService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.centerRepository = centerRepository;
        this.staffCheckInSettingsRepository = staffCheckInSettingsRepository;
        this.messageTemplateService = messageTemplateService;
        this.messageRenderer = messageRenderer;
        this.smsGateway = smsGateway;
        this.notificationLogService = notificationLogService;
        this.clock = clock;
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAttendanceEvent(AttendanceNotificationEvent event) {
        dispatch(event);
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onStaffArrival(StaffArrivalEvent event) {
        dispatch(event);
    }

    public void dispatch(AttendanceNotificationEvent event) {
        try {
            AppUser student = appUserRepository.findById(event.studentId()).orElse(null);
            if (student == null) {
                log.warn("[ALERT][Notification][{}] student {} not found, record={}",
                        event.type(), event.studentId(), event.recordId());
                return;
            }

            String phone;
            RecipientRole role;
            if (hasText(student.getMotherPhone())) {
                phone = student.getMotherPhone();
                role = RecipientRole.MOTHER;
            } else if (hasText(student.getFatherPhone())) {
                phone = student.getFatherPhone();
                role = RecipientRole.FATHER;
            } else {
                log.info("no guardian phone for student={}, {} notification skipped", student.getId(), event.type());
                return;
            }

            Optional<MessageTemplate> template = messageTemplateService.findActiveTemplate(event.centerId(), event.type());
            String body = template.map(MessageTemplate::getBody).orElse(MessageRenderer.defaultBody(event.type()));
            String text = messageRenderer.renderGuardianMessage(
                    body, student.getFullName(), centerName(event.centerId()), event.occurredAt());

            SmsSendResult result = send(phone, text, event.centerId());
            appendLog(new NotificationLogEntry(
                    event.recordId(),
                    template.map(MessageTemplate::getId).orElse(null),
                    event.centerId(),
                    phone,
                    role,
                    event.type().logType(),
                    result.success() ? NotificationDispatchStatus.SENT : NotificationDispatchStatus.FAILED,
                    result.error(),
                    OffsetDateTime.now(clock)
            ));

            if (result.success()) {
                markDelivered(event);
            } else {
                log.warn("[ALERT][Notification][{}] send failed record={}: {}",
                        event.type(), event.recordId(), result.error());
            }
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Notification][{}] dispatch aborted record={}", event.type(), event.recordId(), ex);
        }
    }

    /**
     * 출근 설정이 있으면 설정된 수신자에게 설정 템플릿으로, 레거시 매칭이면 본인 번호로 기본 문구를 보낸다.
     */
    public void dispatch(StaffArrivalEvent event) {
        try {
            AppUser staff = appUserRepository.findById(event.teacherId()).orElse(null);
            if (staff == null) {
                log.warn("[ALERT][Notification][{}] staff {} not found", STAFF_ARRIVAL_TYPE, event.teacherId());
                return;
            }

            List<String> recipients;
            RecipientRole role;
            String template = null;
            if (event.settingsId() != null) {
                StaffCheckInSettings settings = staffCheckInSettingsRepository.findById(event.settingsId()).orElse(null);
                if (settings == null) {
                    log.warn("[ALERT][Notification][{}] settings {} vanished", STAFF_ARRIVAL_TYPE, event.settingsId());
                    return;
                }
                recipients = settings.getNotificationRecipients();
                template = settings.getMessageTemplate();
                role = RecipientRole.STAFF_RECIPIENT;
            } else {
                recipients = hasText(staff.getPhone()) ? List.of(staff.getPhone()) : List.of();
                role = RecipientRole.STAFF_SELF;
            }

            if (recipients.isEmpty()) {
                log.info("no recipients for staff arrival staff={} center={}", staff.getId(), event.centerId());
                return;
            }

            String text = messageRenderer.renderStaffArrival(
                    template, staff.getFullName(), centerName(event.centerId()), event.occurredAt());
            for (String recipient : recipients) {
                SmsSendResult result = send(recipient, text, event.centerId());
                appendLog(new NotificationLogEntry(
                        null,
                        null,
                        event.centerId(),
                        recipient,
                        role,
                        STAFF_ARRIVAL_TYPE,
                        result.success() ? NotificationDispatchStatus.SENT : NotificationDispatchStatus.FAILED,
                        result.error(),
                        OffsetDateTime.now(clock)
                ));
                if (!result.success()) {
                    log.warn("[ALERT][Notification][{}] send failed staff={}: {}",
                            STAFF_ARRIVAL_TYPE, staff.getId(), result.error());
                }
            }
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Notification][{}] dispatch aborted staff={}", STAFF_ARRIVAL_TYPE, event.teacherId(), ex);
        }
    }

    private SmsSendResult send(String to, String text, UUID centerId) {
        try {
            return smsGateway.send(new SmsMessage(to, text), centerId);
        } catch (RuntimeException ex) {
            return SmsSendResult.failed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private void appendLog(NotificationLogEntry entry) {
        try {
            notificationLogService.append(entry);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Notification][{}] log write failed record={}",
                    entry.getMessageType(), entry.getAttendanceRecordId(), ex);
        }
    }

    private void markDelivered(AttendanceNotificationEvent event) {
        try {
            notificationLogService.markDelivered(event.recordId(), event.type(), OffsetDateTime.now(clock));
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Notification][{}] flag update failed record={}", event.type(), event.recordId(), ex);
        }
    }

    private String centerName(UUID centerId) {
        return centerRepository.findById(centerId).map(Center::getName).orElse(MessageRenderer.DEFAULT_CENTER_NAME);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
