package com.primemath.backend.modules.center.domain;

import java.util.UUID;

import com.primemath.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "class_enrollment")
public class ClassEnrollment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "class_id", nullable = false, columnDefinition = "uuid")
    private UUID classId;

    @Column(name = "student_id", nullable = false, columnDefinition = "uuid")
    private UUID studentId;

    public ClassEnrollment() {
    }

    public ClassEnrollment(UUID classId, UUID studentId) {
        this.classId = classId;
        this.studentId = studentId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getClassId() {
        return classId;
    }

    public UUID getStudentId() {
        return studentId;
    }
}
