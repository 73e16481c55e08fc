package com.primemath.backend.modules.attendance.application;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.AttendanceCode;
import com.primemath.backend.modules.attendance.domain.CodeOwnerKind;
import com.primemath.backend.modules.attendance.domain.PhoneCodes;
import com.primemath.backend.modules.attendance.domain.StaffCheckInSettings;
import com.primemath.backend.modules.attendance.infrastructure.persistence.StaffCheckInSettingsRepository;
import com.primemath.backend.modules.attendance.presentation.dto.SaveStaffCheckInSettingsRequest;
import com.primemath.backend.modules.attendance.presentation.dto.StaffCheckInSettingsResponse;
import com.primemath.backend.modules.attendance.presentation.dto.UpdateStaffCheckInSettingsRequest;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class StaffCheckInSettingsService {

    private final StaffCheckInSettingsRepository staffCheckInSettingsRepository;
    private final CodeRegistryService codeRegistryService;
    private final AppUserRepository appUserRepository;
    private final CenterTime centerTime;

    public StaffCheckInSettingsService(
            StaffCheckInSettingsRepository staffCheckInSettingsRepository,
            CodeRegistryService codeRegistryService,
            AppUserRepository appUserRepository,
            CenterTime centerTime
    ) {
        this.staffCheckInSettingsRepository = staffCheckInSettingsRepository;
        this.codeRegistryService = codeRegistryService;
        this.appUserRepository = appUserRepository;
        this.centerTime = centerTime;
    }

    @Transactional(readOnly = true)
    public List<StaffCheckInSettingsResponse> listSettings(UUID centerId) {
        List<StaffCheckInSettings> settings = staffCheckInSettingsRepository.findByCenterWithCode(centerId);
        Map<UUID, String> names = appUserRepository.findAllById(
                        settings.stream().map(StaffCheckInSettings::getTeacherId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getFullName));
        return settings.stream()
                .map(setting -> StaffCheckInSettingsResponse.from(setting, names.get(setting.getTeacherId())))
                .toList();
    }

    public StaffCheckInSettingsResponse saveSettings(SaveStaffCheckInSettingsRequest request) {
        String code = requireValidCode(request.checkInCode());
        StaffCheckInSettings settings = staffCheckInSettingsRepository
                .findByTeacherIdAndCenterId(request.teacherId(), request.centerId())
                .orElseGet(() -> new StaffCheckInSettings(request.teacherId(), request.centerId()));

        boolean active = request.active() == null || request.active();
        settings.setNotificationRecipients(request.notificationRecipients());
        settings.setMessageTemplate(blankToNull(request.messageTemplate()));
        applyCode(settings, code, active);
        settings.setActive(active);

        StaffCheckInSettings saved = staffCheckInSettingsRepository.save(settings);
        return StaffCheckInSettingsResponse.from(saved, teacherName(saved.getTeacherId()));
    }

    public StaffCheckInSettingsResponse updateSettings(UUID settingsId, UpdateStaffCheckInSettingsRequest request) {
        StaffCheckInSettings settings = loadSettings(settingsId);

        if (request.notificationRecipients() != null) {
            settings.setNotificationRecipients(request.notificationRecipients());
        }
        if (request.messageTemplate() != null) {
            settings.setMessageTemplate(blankToNull(request.messageTemplate()));
        }
        boolean active = request.active() != null ? request.active() : settings.isActive();
        String code = request.checkInCode() != null ? requireValidCode(request.checkInCode()) : settings.getCheckInCode();
        applyCode(settings, code, active);
        settings.setActive(active);

        return StaffCheckInSettingsResponse.from(settings, teacherName(settings.getTeacherId()));
    }

    public void deleteSettings(UUID settingsId) {
        StaffCheckInSettings settings = loadSettings(settingsId);
        AttendanceCode code = settings.getAttendanceCode();
        staffCheckInSettingsRepository.delete(settings);
        if (code != null) {
            code.deactivate(centerTime.now());
        }
    }

    private void applyCode(StaffCheckInSettings settings, String code, boolean active) {
        AttendanceCode current = settings.getAttendanceCode();
        if (!active) {
            if (current != null && current.isActive()) {
                current.deactivate(centerTime.now());
            }
            if (current == null || !Objects.equals(current.getCode(), code)) {
                settings.setAttendanceCode(codeRegistryService.recordInactiveCode(
                        settings.getCenterId(), settings.getTeacherId(), CodeOwnerKind.STAFF, code));
            }
            return;
        }
        if (current != null && current.isActive() && Objects.equals(current.getCode(), code)) {
            return;
        }
        settings.setAttendanceCode(codeRegistryService.registerCode(
                settings.getCenterId(), settings.getTeacherId(), CodeOwnerKind.STAFF, code));
    }

    private StaffCheckInSettings loadSettings(UUID settingsId) {
        return staffCheckInSettingsRepository.findById(settingsId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "attendance.staff_settings_not_found",
                        "출근 설정을 찾을 수 없습니다"));
    }

    private String teacherName(UUID teacherId) {
        return appUserRepository.findById(teacherId).map(AppUser::getFullName).orElse(null);
    }

    private static String requireValidCode(String code) {
        String trimmed = code == null ? null : code.trim();
        if (!PhoneCodes.isValidCode(trimmed)) {
            throw CodeRegistryService.invalidCode();
        }
        return trimmed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
