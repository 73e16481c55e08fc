package com.primemath.backend.modules.attendance.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * 학생 하루 출결 기록. 키는 (학생, 날짜, 수업)이며 수업이 없으면 센터 단위 기록 하나만 허용된다.
 */
@Entity
@Table(name = "attendance_record")
public class AttendanceRecord extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "center_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID centerId;

    @Column(name = "class_id", updatable = false, columnDefinition = "uuid")
    private UUID classId;

    @Column(name = "check_in_date", nullable = false, updatable = false)
    private LocalDate checkInDate;

    @Column(name = "check_in_at")
    private OffsetDateTime checkInAt;

    @Column(name = "check_out_at")
    private OffsetDateTime checkOutAt;

    @Column(name = "was_late", nullable = false)
    private boolean wasLate;

    @Enumerated(EnumType.STRING)
    @Column(name = "attendance_status", nullable = false, length = 16)
    private AttendanceStatus attendanceStatus;

    @Column(name = "check_in_notification_sent", nullable = false)
    private boolean checkInNotificationSent;

    @Column(name = "check_out_notification_sent", nullable = false)
    private boolean checkOutNotificationSent;

    @Column(name = "late_notification_sent", nullable = false)
    private boolean lateNotificationSent;

    @Column(name = "late_notification_sent_at")
    private OffsetDateTime lateNotificationSentAt;

    protected AttendanceRecord() {
    }

    public AttendanceRecord(UUID studentId, UUID centerId, UUID classId, LocalDate checkInDate) {
        this.studentId = studentId;
        this.centerId = centerId;
        this.classId = classId;
        this.checkInDate = checkInDate;
        this.attendanceStatus = AttendanceStatus.PENDING;
    }

    public boolean hasCheckedIn() {
        return checkInAt != null;
    }

    public boolean hasCheckedOut() {
        return checkOutAt != null;
    }

    public void checkIn(OffsetDateTime at) {
        if (hasCheckedIn()) {
            throw new IllegalStateException("record already checked in: " + id);
        }
        this.checkInAt = at;
        this.wasLate = false;
        this.attendanceStatus = AttendanceStatus.PRESENT;
    }

    /**
     * 하원 처리. 등원 기록이 없으면 등원 시각을 하원 시각과 같게 둔다(별도 등원이 관측되지 않았다는 표시).
     */
    public void checkOut(OffsetDateTime at) {
        if (hasCheckedOut()) {
            throw new IllegalStateException("record already checked out: " + id);
        }
        if (checkInAt == null) {
            this.checkInAt = at;
        }
        this.checkOutAt = at;
        if (attendanceStatus == AttendanceStatus.PENDING || attendanceStatus == AttendanceStatus.ABSENT) {
            this.attendanceStatus = AttendanceStatus.PRESENT;
        }
    }

    public void overrideStatus(AttendanceStatus status) {
        this.attendanceStatus = status;
        this.wasLate = status == AttendanceStatus.LATE;
    }

    public void manualCheckIn(OffsetDateTime at, boolean late) {
        if (checkInAt == null) {
            this.checkInAt = at;
        }
        this.wasLate = late;
        this.attendanceStatus = late ? AttendanceStatus.LATE : AttendanceStatus.PRESENT;
    }

    public void markCheckInNotified() {
        this.checkInNotificationSent = true;
    }

    public void markCheckOutNotified() {
        this.checkOutNotificationSent = true;
    }

    public void markLateNotified(OffsetDateTime at) {
        this.lateNotificationSent = true;
        this.lateNotificationSentAt = at;
    }

    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public UUID getCenterId() {
        return centerId;
    }

    public UUID getClassId() {
        return classId;
    }

    public LocalDate getCheckInDate() {
        return checkInDate;
    }

    public OffsetDateTime getCheckInAt() {
        return checkInAt;
    }

    public OffsetDateTime getCheckOutAt() {
        return checkOutAt;
    }

    public boolean isWasLate() {
        return wasLate;
    }

    public AttendanceStatus getAttendanceStatus() {
        return attendanceStatus;
    }

    public boolean isCheckInNotificationSent() {
        return checkInNotificationSent;
    }

    public boolean isCheckOutNotificationSent() {
        return checkOutNotificationSent;
    }

    public boolean isLateNotificationSent() {
        return lateNotificationSent;
    }

    public OffsetDateTime getLateNotificationSentAt() {
        return lateNotificationSentAt;
    }
}
