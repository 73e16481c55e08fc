package com.primemath.backend.modules.attendance.domain;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "teacher_work_record")
public class TeacherWorkRecord extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "teacher_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID teacherId;

    @Column(name = "center_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID centerId;

    @Column(name = "work_date", nullable = false, updatable = false)
    private LocalDate workDate;

    @Column(name = "check_in_at", nullable = false)
    private OffsetDateTime checkInAt;

    @Column(name = "check_out_at")
    private OffsetDateTime checkOutAt;

    @Column(name = "work_minutes")
    private Integer workMinutes;

    @Column(name = "no_check_out", nullable = false)
    private boolean noCheckOut;

    protected TeacherWorkRecord() {
    }

    public TeacherWorkRecord(UUID teacherId, UUID centerId, LocalDate workDate, OffsetDateTime checkInAt) {
        this.teacherId = teacherId;
        this.centerId = centerId;
        this.workDate = workDate;
        this.checkInAt = checkInAt;
    }

    public void punchOut(OffsetDateTime at) {
        this.checkOutAt = at;
        this.workMinutes = (int) Math.max(0, Duration.between(checkInAt, at).toMinutes());
        this.noCheckOut = false;
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

    public LocalDate getWorkDate() {
        return workDate;
    }

    public OffsetDateTime getCheckInAt() {
        return checkInAt;
    }

    public OffsetDateTime getCheckOutAt() {
        return checkOutAt;
    }

    public Integer getWorkMinutes() {
        return workMinutes;
    }

    public boolean isNoCheckOut() {
        return noCheckOut;
    }
}
