package com.primemath.backend.modules.attendance.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.AttendanceRecord;
import com.primemath.backend.modules.attendance.domain.CodeResolution;
import com.primemath.backend.modules.attendance.domain.event.StaffArrivalEvent;
import com.primemath.backend.modules.attendance.presentation.dto.PadCheckResponse;
import com.primemath.backend.modules.attendance.presentation.dto.PadCodeRequest;
import com.primemath.backend.modules.attendance.presentation.dto.PadValidationResponse;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.center.domain.TutoringClass;
import com.primemath.backend.modules.center.infrastructure.persistence.TutoringClassRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AttendancePadService {

    private static final Logger log = LoggerFactory.getLogger(AttendancePadService.class);

    private final IdentityResolver identityResolver;
    private final AttendanceLedgerService attendanceLedgerService;
    private final AppUserRepository appUserRepository;
    private final TutoringClassRepository tutoringClassRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final CenterTime centerTime;

    public AttendancePadService(
            IdentityResolver identityResolver,
            AttendanceLedgerService attendanceLedgerService,
            AppUserRepository appUserRepository,
            TutoringClassRepository tutoringClassRepository,
            ApplicationEventPublisher eventPublisher,
            CenterTime centerTime
    ) {
        this.identityResolver = identityResolver;
        this.attendanceLedgerService = attendanceLedgerService;
        this.appUserRepository = appUserRepository;
        this.tutoringClassRepository = tutoringClassRepository;
        this.eventPublisher = eventPublisher;
        this.centerTime = centerTime;
    }

    public PadValidationResponse validateCode(PadCodeRequest request) {
        CodeResolution resolution = identityResolver.resolve(request.centerId(), request.code());
        switch (resolution.kind()) {
            case STUDENT -> {
                AppUser student = loadUser(resolution.studentId());
                List<PadValidationResponse.ClassSummary> classes = tutoringClassRepository
                        .findActiveEnrolledClasses(student.getId(), request.centerId())
                        .stream()
                        .map(tutoringClass -> new PadValidationResponse.ClassSummary(
                                tutoringClass.getId(), tutoringClass.getName()))
                        .toList();
                return PadValidationResponse.forStudent(
                        new PadValidationResponse.StudentSummary(student.getId(), student.getFullName(), student.getGrade()),
                        classes
                );
            }
            case STAFF -> {
                AppUser staff = loadUser(resolution.teacherId());
                OffsetDateTime now = centerTime.now();
                eventPublisher.publishEvent(new StaffArrivalEvent(
                        staff.getId(), request.centerId(), resolution.settingsId(), now));
                log.info("staff arrival center={} staff={} legacy={}", request.centerId(), staff.getId(), resolution.legacy());
                return PadValidationResponse.forStaff(
                        new PadValidationResponse.StaffSummary(staff.getId(), staff.getFullName()), now);
            }
            default -> throw codeNotFound();
        }
    }

    public PadCheckResponse checkIn(PadCodeRequest request) {
        AppUser student = resolveStudent(request);
        AttendanceRecord record = attendanceLedgerService.checkIn(request.centerId(), student.getId(), request.classId());
        return new PadCheckResponse(
                record.getId(),
                student.getId(),
                student.getFullName(),
                className(request.classId()),
                record.getCheckInAt(),
                student.getFullName() + " 출결 완료!"
        );
    }

    public PadCheckResponse checkOut(PadCodeRequest request) {
        AppUser student = resolveStudent(request);
        AttendanceRecord record = attendanceLedgerService.checkOut(request.centerId(), student.getId(), request.classId());
        return new PadCheckResponse(
                record.getId(),
                student.getId(),
                student.getFullName(),
                className(request.classId()),
                record.getCheckOutAt(),
                student.getFullName() + " 하원 완료!"
        );
    }

    private AppUser resolveStudent(PadCodeRequest request) {
        CodeResolution resolution = identityResolver.resolve(request.centerId(), request.code());
        if (resolution.kind() != CodeResolution.Kind.STUDENT) {
            throw codeNotFound();
        }
        return loadUser(resolution.studentId());
    }

    private AppUser loadUser(UUID userId) {
        return appUserRepository.findById(userId).orElseThrow(AttendancePadService::codeNotFound);
    }

    private String className(UUID classId) {
        if (classId == null) {
            return null;
        }
        return tutoringClassRepository.findById(classId).map(TutoringClass::getName).orElse(null);
    }

    private static ProblemException codeNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "attendance.code_not_found", "등록되지 않은 출결번호입니다");
    }
}
