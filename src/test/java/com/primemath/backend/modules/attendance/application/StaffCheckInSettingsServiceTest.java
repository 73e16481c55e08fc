package com.primemath.backend.modules.attendance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.modules.attendance.domain.AttendanceCode;
import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;
import com.primemath.backend.modules.attendance.domain.StaffCheckInSettings;
import com.primemath.backend.modules.attendance.infrastructure.persistence.StaffCheckInSettingsRepository;
import com.primemath.backend.modules.attendance.presentation.dto.SaveStaffCheckInSettingsRequest;
import com.primemath.backend.modules.attendance.presentation.dto.StaffCheckInSettingsResponse;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StaffCheckInSettingsServiceTest {

    private static final UUID CENTER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID TEACHER_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");

    @Mock
    private StaffCheckInSettingsRepository staffCheckInSettingsRepository;

    @Mock
    private CodeRegistryService codeRegistryService;

    @Mock
    private AppUserRepository appUserRepository;

    private StaffCheckInSettingsService settingsService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-03T00:00:00Z"), ZoneOffset.UTC);
        settingsService = new StaffCheckInSettingsService(
                staffCheckInSettingsRepository,
                codeRegistryService,
                appUserRepository,
                new CenterTime(clock, ZoneId.of("Asia/Seoul"))
        );
        lenient().when(staffCheckInSettingsRepository.findByTeacherIdAndCenterId(TEACHER_ID, CENTER_ID))
                .thenReturn(Optional.empty());
        lenient().when(staffCheckInSettingsRepository.save(any(StaffCheckInSettings.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(appUserRepository.findById(TEACHER_ID)).thenReturn(Optional.empty());
    }

    @Test
    void inactiveSettingsKeepTheirCodeOutOfTheActiveNamespace() {
        AttendanceCode stored = new AttendanceCode(CENTER_ID, TEACHER_ID, CodeOwnerKind.STAFF, "5678");
        when(codeRegistryService.recordInactiveCode(CENTER_ID, TEACHER_ID, CodeOwnerKind.STAFF, "5678"))
                .thenReturn(stored);

        StaffCheckInSettingsResponse response = settingsService.saveSettings(new SaveStaffCheckInSettingsRequest(
                TEACHER_ID, CENTER_ID, "5678", List.of("010-5000-6000"), null, false));

        assertThat(response.active()).isFalse();
        assertThat(response.checkInCode()).isEqualTo("5678");
        verify(codeRegistryService, never()).registerCode(any(), any(), any(), any());
    }

    @Test
    void deactivatingSettingsRetiresTheActiveCode() {
        StaffCheckInSettings existing = new StaffCheckInSettings(TEACHER_ID, CENTER_ID);
        AttendanceCode activeCode = new AttendanceCode(CENTER_ID, TEACHER_ID, CodeOwnerKind.STAFF, "7777");
        existing.setAttendanceCode(activeCode);
        when(staffCheckInSettingsRepository.findByTeacherIdAndCenterId(TEACHER_ID, CENTER_ID))
                .thenReturn(Optional.of(existing));

        settingsService.saveSettings(new SaveStaffCheckInSettingsRequest(
                TEACHER_ID, CENTER_ID, "7777", List.of(), null, false));

        assertThat(activeCode.isActive()).isFalse();
        assertThat(existing.getAttendanceCode()).isSameAs(activeCode);
        verify(codeRegistryService, never()).registerCode(any(), any(), any(), any());
        verify(codeRegistryService, never()).recordInactiveCode(any(), any(), any(), any());
    }

    @Test
    void activeSettingsRegisterTheCode() {
        when(codeRegistryService.registerCode(CENTER_ID, TEACHER_ID, CodeOwnerKind.STAFF, "7777"))
                .thenReturn(new AttendanceCode(CENTER_ID, TEACHER_ID, CodeOwnerKind.STAFF, "7777"));

        StaffCheckInSettingsResponse response = settingsService.saveSettings(new SaveStaffCheckInSettingsRequest(
                TEACHER_ID, CENTER_ID, "7777", List.of("010-5000-6000"), null, null));

        assertThat(response.active()).isTrue();
        verify(codeRegistryService).registerCode(eq(CENTER_ID), eq(TEACHER_ID), eq(CodeOwnerKind.STAFF), eq("7777"));
    }
}
