package com.primemath.backend.modules.attendance.application;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.AttendanceCode;
import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;
import com.primemath.backend.modules.attendance.domain.PhoneCodes;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceCodeRepository;
import com.primemath.backend.modules.attendance.presentation.dto.AttendanceCodeResponse;
import com.primemath.backend.modules.attendance.presentation.dto.AutoGenerateCodesResponse;
import com.primemath.backend.modules.attendance.presentation.dto.RegisterAttendanceCodeRequest;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.domain.Role;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.center.infrastructure.persistence.CenterRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 센터별 출결번호 레지스트리. 학생 PIN과 선생님 출근 코드를 한 네임스페이스에서 관리한다.
 */
@Service
@Transactional
public class CodeRegistryService {

    private static final Logger log = LoggerFactory.getLogger(CodeRegistryService.class);

    static final List<String> STAFF_ROLES = List.of(Role.TEACHER, Role.PRINCIPAL, Role.ADMIN);

    private final AttendanceCodeRepository attendanceCodeRepository;
    private final AppUserRepository appUserRepository;
    private final CenterRepository centerRepository;
    private final CenterTime centerTime;
    private final TransactionTemplate perStudentTransaction;

    public CodeRegistryService(
            AttendanceCodeRepository attendanceCodeRepository,
            AppUserRepository appUserRepository,
            CenterRepository centerRepository,
            CenterTime centerTime,
            PlatformTransactionManager transactionManager
    ) {
        this.attendanceCodeRepository = attendanceCodeRepository;
        this.appUserRepository = appUserRepository;
        this.centerRepository = centerRepository;
        this.centerTime = centerTime;
        this.perStudentTransaction = new TransactionTemplate(transactionManager);
        this.perStudentTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public AttendanceCodeResponse registerCode(RegisterAttendanceCodeRequest request) {
        CodeOwnerKind ownerKind = request.ownerKind() != null ? request.ownerKind() : CodeOwnerKind.STUDENT;
        AttendanceCode code = registerCode(request.centerId(), request.ownerId(), ownerKind, request.code());
        String ownerName = appUserRepository.findById(code.getOwnerId()).map(AppUser::getFullName).orElse(null);
        return AttendanceCodeResponse.from(code, ownerName);
    }

    /**
     * 출결번호를 등록한다. 같은 소유자의 기존 활성 코드는 먼저 비활성화된다.
     * proposedCode가 없으면 소유자 전화번호의 끝 4자리, 그 다음 가운데 4자리를 차례로 시도한다.
     */
    public AttendanceCode registerCode(UUID centerId, UUID ownerId, CodeOwnerKind ownerKind, String proposedCode) {
        ensureCenterExists(centerId);
        AppUser owner = appUserRepository.findById(ownerId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "attendance.owner_not_found",
                        "사용자를 찾을 수 없습니다"));
        ensureOwnerKind(owner, ownerKind);

        Optional<AttendanceCode> previous = attendanceCodeRepository
                .findByCenterIdAndOwnerIdAndOwnerKindAndActiveTrue(centerId, ownerId, ownerKind);

        String code;
        if (proposedCode != null && !proposedCode.isBlank()) {
            code = proposedCode.trim();
            if (!PhoneCodes.isValidCode(code)) {
                throw invalidCode();
            }
            if (isTakenByOther(centerId, code, previous)) {
                throw codeInUse();
            }
        } else {
            List<String> candidates = PhoneCodes.registrationCandidates(owner.getPhone());
            if (candidates.isEmpty()) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "attendance.phone_unusable",
                        "전화번호로 출결번호를 만들 수 없습니다");
            }
            code = candidates.stream()
                    .filter(candidate -> !isTakenByOther(centerId, candidate, previous))
                    .findFirst()
                    .orElseThrow(CodeRegistryService::codeInUse);
        }

        if (previous.isPresent() && previous.get().getCode().equals(code)) {
            return previous.get();
        }
        previous.ifPresent(existing -> {
            existing.deactivate(centerTime.now());
            attendanceCodeRepository.saveAndFlush(existing);
        });

        try {
            AttendanceCode saved = attendanceCodeRepository.saveAndFlush(
                    new AttendanceCode(centerId, ownerId, ownerKind, code));
            log.info("attendance code registered center={} owner={} kind={}", centerId, ownerId, ownerKind);
            return saved;
        } catch (DataIntegrityViolationException ex) {
            throw codeInUse();
        }
    }

    public AttendanceCode recordInactiveCode(UUID centerId, UUID ownerId, CodeOwnerKind ownerKind, String code) {
        ensureCenterExists(centerId);
        AttendanceCode inactive = new AttendanceCode(centerId, ownerId, ownerKind, code);
        inactive.deactivate(centerTime.now());
        return attendanceCodeRepository.saveAndFlush(inactive);
    }

    public void deactivateCode(UUID codeId) {
        AttendanceCode code = attendanceCodeRepository.findById(codeId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "attendance.code_not_found",
                        "등록되지 않은 출결번호입니다"));
        code.deactivate(centerTime.now());
    }

    public AutoGenerateCodesResponse autoGenerateMissingCodes(UUID centerId) {
        ensureCenterExists(centerId);
        List<AppUser> students = appUserRepository.findActiveCenterMembersWithRoles(centerId, List.of(Role.STUDENT));
        Set<UUID> withCode = new HashSet<>(attendanceCodeRepository.findActiveOwnerIds(centerId, CodeOwnerKind.STUDENT));
        Set<String> usedCodes = attendanceCodeRepository.findActiveByCenter(centerId).stream()
                .map(AttendanceCode::getCode)
                .collect(Collectors.toCollection(HashSet::new));

        List<AutoGenerateCodesResponse.CreatedCode> created = new ArrayList<>();
        List<AutoGenerateCodesResponse.SkippedStudent> skipped = new ArrayList<>();

        for (AppUser student : students) {
            if (withCode.contains(student.getId())) {
                skipped.add(new AutoGenerateCodesResponse.SkippedStudent(student.getId(), "이미 출결번호 있음"));
                continue;
            }
            List<String> candidates = PhoneCodes.registrationCandidates(student.getPhone());
            if (candidates.isEmpty()) {
                skipped.add(new AutoGenerateCodesResponse.SkippedStudent(student.getId(), "전화번호 없음"));
                continue;
            }
            Optional<String> free = candidates.stream().filter(candidate -> !usedCodes.contains(candidate)).findFirst();
            if (free.isEmpty()) {
                skipped.add(new AutoGenerateCodesResponse.SkippedStudent(student.getId(), "PIN 중복 (수동 등록 필요)"));
                continue;
            }
            usedCodes.add(free.get());
            // 학생마다 별도 트랜잭션: 동시 등록과 충돌해도 나머지 학생은 계속 처리한다
            try {
                perStudentTransaction.executeWithoutResult(status -> attendanceCodeRepository.saveAndFlush(
                        new AttendanceCode(centerId, student.getId(), CodeOwnerKind.STUDENT, free.get())));
            } catch (DataIntegrityViolationException ex) {
                log.info("auto-generated code {} lost a race center={} student={}", free.get(), centerId, student.getId());
                skipped.add(new AutoGenerateCodesResponse.SkippedStudent(student.getId(), "PIN 중복 (수동 등록 필요)"));
                continue;
            }
            created.add(new AutoGenerateCodesResponse.CreatedCode(student.getId(), free.get()));
        }

        log.info("attendance codes auto-generated center={} created={} skipped={}",
                centerId, created.size(), skipped.size());
        return new AutoGenerateCodesResponse(created.size(), skipped.size(), created, skipped);
    }

    @Transactional(readOnly = true)
    public List<AttendanceCodeResponse> listCodes(UUID centerId) {
        List<AttendanceCode> codes = attendanceCodeRepository.findActiveByCenter(centerId);
        Map<UUID, String> names = appUserRepository.findAllById(
                        codes.stream().map(AttendanceCode::getOwnerId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getFullName, (left, right) -> left));
        return codes.stream()
                .map(code -> AttendanceCodeResponse.from(code, names.get(code.getOwnerId())))
                .toList();
    }

    private boolean isTakenByOther(UUID centerId, String code, Optional<AttendanceCode> previous) {
        return attendanceCodeRepository.findByCenterIdAndCodeAndActiveTrue(centerId, code)
                .filter(existing -> previous.map(AttendanceCode::getId)
                        .map(id -> !id.equals(existing.getId()))
                        .orElse(true))
                .isPresent();
    }

    private void ensureCenterExists(UUID centerId) {
        if (!centerRepository.existsById(centerId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "attendance.center_not_found", "센터를 찾을 수 없습니다");
        }
    }

    private void ensureOwnerKind(AppUser owner, CodeOwnerKind ownerKind) {
        List<String> roles = ownerKind == CodeOwnerKind.STUDENT ? List.of(Role.STUDENT) : STAFF_ROLES;
        if (!appUserRepository.hasAnyActiveRole(owner.getId(), roles)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "attendance.owner_kind_mismatch",
                    "출결번호 소유자 유형이 올바르지 않습니다");
        }
    }

    static ProblemException invalidCode() {
        return new ProblemException(HttpStatus.BAD_REQUEST, "attendance.invalid_code", "출결번호는 숫자 4자리입니다");
    }

    static ProblemException codeInUse() {
        return new ProblemException(HttpStatus.CONFLICT, "attendance.code_in_use", "이미 사용 중인 출결번호입니다");
    }
}
