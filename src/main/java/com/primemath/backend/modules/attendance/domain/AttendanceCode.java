package com.primemath.backend.modules.attendance.domain;

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
 * 센터별 4자리 출결번호. 학생 PIN과 선생님 출근 코드가 같은 네임스페이스를 공유한다.
 * 활성 코드는 (center_id, code) 부분 유니크 인덱스로 센터 안에서 하나만 존재한다.
 * 재할당 시 삭제하지 않고 비활성화한다.
 */
@Entity
@Table(name = "attendance_code")
public class AttendanceCode extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "center_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID centerId;

    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "owner_kind", nullable = false, updatable = false, length = 16)
    private CodeOwnerKind ownerKind;

    @Column(name = "code", nullable = false, updatable = false, length = 4)
    private String code;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    protected AttendanceCode() {
    }

    public AttendanceCode(UUID centerId, UUID ownerId, CodeOwnerKind ownerKind, String code) {
        this.centerId = centerId;
        this.ownerId = ownerId;
        this.ownerKind = ownerKind;
        this.code = code;
        this.active = true;
    }

    public void deactivate(OffsetDateTime at) {
        if (!active) {
            return;
        }
        this.active = false;
        this.deactivatedAt = at;
    }

    public UUID getId() {
        return id;
    }

    public UUID getCenterId() {
        return centerId;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public CodeOwnerKind getOwnerKind() {
        return ownerKind;
    }

    public String getCode() {
        return code;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }
}
