package com.primemath.backend.modules.attendance.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.attendance.domain.AttendanceCode;
import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;
import com.primemath.backend.modules.attendance.domain.CodeResolution;
import com.primemath.backend.modules.attendance.domain.PhoneCodes;
import com.primemath.backend.modules.attendance.domain.StaffCheckInSettings;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceCodeRepository;
import com.primemath.backend.modules.attendance.infrastructure.persistence.StaffCheckInSettingsRepository;
import com.primemath.backend.modules.auth.domain.Role;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 출결번호를 학생 또는 선생님으로 해석한다.
 * 순서: 학생 코드, 활성 출근 설정이 있는 선생님 코드, 선생님 전화번호(레거시).
 */
@Service
@Transactional(readOnly = true)
public class IdentityResolver {

    private static final List<String> LEGACY_STAFF_ROLES = List.of(Role.TEACHER, Role.PRINCIPAL);

    private final AttendanceCodeRepository attendanceCodeRepository;
    private final StaffCheckInSettingsRepository staffCheckInSettingsRepository;
    private final AppUserRepository appUserRepository;

    public IdentityResolver(
            AttendanceCodeRepository attendanceCodeRepository,
            StaffCheckInSettingsRepository staffCheckInSettingsRepository,
            AppUserRepository appUserRepository
    ) {
        this.attendanceCodeRepository = attendanceCodeRepository;
        this.staffCheckInSettingsRepository = staffCheckInSettingsRepository;
        this.appUserRepository = appUserRepository;
    }

    public CodeResolution resolve(UUID centerId, String code) {
        if (!PhoneCodes.isValidCode(code)) {
            throw CodeRegistryService.invalidCode();
        }

        Optional<AttendanceCode> studentCode = attendanceCodeRepository
                .findByCenterIdAndCodeAndOwnerKindAndActiveTrue(centerId, code, CodeOwnerKind.STUDENT);
        if (studentCode.isPresent()) {
            return CodeResolution.student(studentCode.get().getOwnerId());
        }

        Optional<StaffCheckInSettings> settings = attendanceCodeRepository
                .findByCenterIdAndCodeAndOwnerKindAndActiveTrue(centerId, code, CodeOwnerKind.STAFF)
                .flatMap(staffCode -> staffCheckInSettingsRepository.findByAttendanceCodeIdAndActiveTrue(staffCode.getId()));
        if (settings.isPresent()) {
            return CodeResolution.staff(settings.get().getTeacherId(), settings.get().getId());
        }

        return appUserRepository.findActiveCenterMembersWithRoles(centerId, LEGACY_STAFF_ROLES).stream()
                .filter(staff -> PhoneCodes.matchesLegacyPhone(staff.getPhone(), code))
                .findFirst()
                .map(staff -> CodeResolution.legacyStaff(staff.getId()))
                .orElseGet(CodeResolution::notFound);
    }
}
