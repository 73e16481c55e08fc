package com.primemath.backend.modules.attendance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.AttendanceCode;
import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;
import com.primemath.backend.modules.attendance.domain.CodeResolution;
import com.primemath.backend.modules.attendance.domain.StaffCheckInSettings;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceCodeRepository;
import com.primemath.backend.modules.attendance.infrastructure.persistence.StaffCheckInSettingsRepository;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final UUID CENTER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID TEACHER_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");

    @Mock
    private AttendanceCodeRepository attendanceCodeRepository;

    @Mock
    private StaffCheckInSettingsRepository staffCheckInSettingsRepository;

    @Mock
    private AppUserRepository appUserRepository;

    private IdentityResolver identityResolver;

    @BeforeEach
    void setUp() {
        identityResolver = new IdentityResolver(attendanceCodeRepository, staffCheckInSettingsRepository, appUserRepository);
        lenient().when(attendanceCodeRepository.findByCenterIdAndCodeAndOwnerKindAndActiveTrue(any(), any(), any()))
                .thenReturn(Optional.empty());
        lenient().when(appUserRepository.findActiveCenterMembersWithRoles(any(), any())).thenReturn(List.of());
    }

    @Test
    @DisplayName("학생 코드가 선생님 코드보다 우선한다")
    void studentCodeWins() {
        when(attendanceCodeRepository.findByCenterIdAndCodeAndOwnerKindAndActiveTrue(CENTER_ID, "5678", CodeOwnerKind.STUDENT))
                .thenReturn(Optional.of(new AttendanceCode(CENTER_ID, STUDENT_ID, CodeOwnerKind.STUDENT, "5678")));

        CodeResolution resolution = identityResolver.resolve(CENTER_ID, "5678");

        assertThat(resolution.kind()).isEqualTo(CodeResolution.Kind.STUDENT);
        assertThat(resolution.studentId()).isEqualTo(STUDENT_ID);
    }

    @Test
    void staffCodeNeedsActiveSettings() {
        AttendanceCode staffCode = new AttendanceCode(CENTER_ID, TEACHER_ID, CodeOwnerKind.STAFF, "1111");
        UUID codeId = UUID.randomUUID();
        ReflectionTestUtils.setField(staffCode, "id", codeId);
        StaffCheckInSettings settings = new StaffCheckInSettings(TEACHER_ID, CENTER_ID);
        UUID settingsId = UUID.randomUUID();
        ReflectionTestUtils.setField(settings, "id", settingsId);

        when(attendanceCodeRepository.findByCenterIdAndCodeAndOwnerKindAndActiveTrue(CENTER_ID, "1111", CodeOwnerKind.STAFF))
                .thenReturn(Optional.of(staffCode));
        when(staffCheckInSettingsRepository.findByAttendanceCodeIdAndActiveTrue(codeId)).thenReturn(Optional.of(settings));

        CodeResolution resolution = identityResolver.resolve(CENTER_ID, "1111");

        assertThat(resolution.kind()).isEqualTo(CodeResolution.Kind.STAFF);
        assertThat(resolution.teacherId()).isEqualTo(TEACHER_ID);
        assertThat(resolution.settingsId()).isEqualTo(settingsId);
        assertThat(resolution.legacy()).isFalse();
    }

    @Test
    @DisplayName("출근 설정이 없으면 선생님 전화번호로 매칭한다")
    void legacyPhoneMatchForStaffWithoutSettings() {
        AppUser teacher = new AppUser();
        ReflectionTestUtils.setField(teacher, "id", TEACHER_ID);
        teacher.setFullName("박선생");
        teacher.setPhone("010-2222-3333");
        when(appUserRepository.findActiveCenterMembersWithRoles(eq(CENTER_ID), any())).thenReturn(List.of(teacher));

        CodeResolution resolution = identityResolver.resolve(CENTER_ID, "2222");

        assertThat(resolution.kind()).isEqualTo(CodeResolution.Kind.STAFF);
        assertThat(resolution.teacherId()).isEqualTo(TEACHER_ID);
        assertThat(resolution.legacy()).isTrue();
        assertThat(resolution.settingsId()).isNull();
    }

    @Test
    void unknownCodeResolvesToNotFound() {
        assertThat(identityResolver.resolve(CENTER_ID, "9999").isFound()).isFalse();
    }

    @Test
    void malformedCodeIsRejectedBeforeLookup() {
        assertThatThrownBy(() -> identityResolver.resolve(CENTER_ID, "12a"))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("attendance.invalid_code");
        verifyNoInteractions(attendanceCodeRepository);
    }
}
