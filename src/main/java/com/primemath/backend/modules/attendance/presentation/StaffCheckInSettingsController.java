package com.primemath.backend.modules.attendance.presentation;

import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.attendance.application.StaffCheckInSettingsService;
import com.primemath.backend.modules.attendance.presentation.dto.SaveStaffCheckInSettingsRequest;
import com.primemath.backend.modules.attendance.presentation.dto.StaffCheckInSettingsResponse;
import com.primemath.backend.modules.attendance.presentation.dto.UpdateStaffCheckInSettingsRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/staff-check-in-settings")
public class StaffCheckInSettingsController {

    private final StaffCheckInSettingsService staffCheckInSettingsService;

    public StaffCheckInSettingsController(StaffCheckInSettingsService staffCheckInSettingsService) {
        this.staffCheckInSettingsService = staffCheckInSettingsService;
    }

    @GetMapping
    public ResponseEntity<List<StaffCheckInSettingsResponse>> listSettings(@RequestParam("centerId") UUID centerId) {
        return ResponseEntity.ok(staffCheckInSettingsService.listSettings(centerId));
    }

    @PostMapping
    public ResponseEntity<StaffCheckInSettingsResponse> saveSettings(
            @Valid @RequestBody SaveStaffCheckInSettingsRequest request
    ) {
        return ResponseEntity.ok(staffCheckInSettingsService.saveSettings(request));
    }

    @PatchMapping("/{settingsId}")
    public ResponseEntity<StaffCheckInSettingsResponse> updateSettings(
            @PathVariable("settingsId") UUID settingsId,
            @Valid @RequestBody UpdateStaffCheckInSettingsRequest request
    ) {
        return ResponseEntity.ok(staffCheckInSettingsService.updateSettings(settingsId, request));
    }

    @DeleteMapping("/{settingsId}")
    public ResponseEntity<Void> deleteSettings(@PathVariable("settingsId") UUID settingsId) {
        staffCheckInSettingsService.deleteSettings(settingsId);
        return ResponseEntity.noContent().build();
    }
}
