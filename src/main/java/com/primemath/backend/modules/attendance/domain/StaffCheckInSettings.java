package com.primemath.backend.modules.attendance.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "staff_check_in_settings")
public class StaffCheckInSettings extends AbstractTimestampedEntity {

    public static final int MAX_RECIPIENTS = 2;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "teacher_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID teacherId;

    @Column(name = "center_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID centerId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "attendance_code_id", nullable = false)
    private AttendanceCode attendanceCode;

    @Column(name = "sms_recipient_1", length = 32)
    private String smsRecipient1;

    @Column(name = "sms_recipient_2", length = 32)
    private String smsRecipient2;

    @Column(name = "message_template", columnDefinition = "text")
    private String messageTemplate;

    @Column(name = "active", nullable = false)
    private boolean active;

    protected StaffCheckInSettings() {
    }

    public StaffCheckInSettings(UUID teacherId, UUID centerId) {
        this.teacherId = teacherId;
        this.centerId = centerId;
        this.active = true;
    }

    public List<String> getNotificationRecipients() {
        List<String> recipients = new ArrayList<>(MAX_RECIPIENTS);
        if (smsRecipient1 != null && !smsRecipient1.isBlank()) {
            recipients.add(smsRecipient1);
        }
        if (smsRecipient2 != null && !smsRecipient2.isBlank()) {
            recipients.add(smsRecipient2);
        }
        return recipients;
    }

    public void setNotificationRecipients(List<String> recipients) {
        List<String> safe = recipients == null ? List.of() : recipients;
        if (safe.size() > MAX_RECIPIENTS) {
            throw new IllegalArgumentException("at most " + MAX_RECIPIENTS + " recipients");
        }
        this.smsRecipient1 = safe.size() > 0 ? safe.get(0) : null;
        this.smsRecipient2 = safe.size() > 1 ? safe.get(1) : null;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTeacherId() {
        return teacherId;
    }

    public UUID getCenterId() {
        return centerId;
    }

    public AttendanceCode getAttendanceCode() {
        return attendanceCode;
    }

    public void setAttendanceCode(AttendanceCode attendanceCode) {
        this.attendanceCode = attendanceCode;
    }

    public String getCheckInCode() {
        return attendanceCode != null ? attendanceCode.getCode() : null;
    }

    public String getMessageTemplate() {
        return messageTemplate;
    }

    public void setMessageTemplate(String messageTemplate) {
        this.messageTemplate = messageTemplate;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
