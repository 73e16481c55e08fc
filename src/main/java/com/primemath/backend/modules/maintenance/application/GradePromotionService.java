package com.primemath.backend.modules.maintenance.application;

import java.util.List;
import java.util.Optional;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.maintenance.domain.GradeLadder;
import com.primemath.backend.modules.maintenance.domain.SystemSetting;
import com.primemath.backend.modules.maintenance.infrastructure.persistence.SystemSettingRepository;
import com.primemath.backend.modules.maintenance.presentation.dto.GradePromotionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 연 1회 학년 진급. last_grade_promotion_year 워터마크와 학생 학년을 같은 트랜잭션에서 갱신한다.
 */
@Service
public class GradePromotionService {

    private static final Logger log = LoggerFactory.getLogger(GradePromotionService.class);

    private final SystemSettingRepository systemSettingRepository;
    private final AppUserRepository appUserRepository;
    private final CenterTime centerTime;

    public GradePromotionService(
            SystemSettingRepository systemSettingRepository,
            AppUserRepository appUserRepository,
            CenterTime centerTime
    ) {
        this.systemSettingRepository = systemSettingRepository;
        this.appUserRepository = appUserRepository;
        this.centerTime = centerTime;
    }

    @Transactional
    public GradePromotionResult promoteIfDue() {
        int currentYear = centerTime.currentYear();
        SystemSetting watermark = systemSettingRepository.findForUpdate(SystemSetting.LAST_GRADE_PROMOTION_YEAR)
                .orElse(null);
        Optional<Integer> lastYear = Optional.ofNullable(watermark)
                .map(SystemSetting::getValue)
                .flatMap(GradePromotionService::parseYear);
        if (lastYear.isPresent() && lastYear.get() >= currentYear) {
            return GradePromotionResult.skipped(currentYear);
        }

        int promoted = 0;
        List<AppUser> students = appUserRepository.findStudentsWithGrade();
        for (AppUser student : students) {
            Optional<String> next = GradeLadder.next(student.getGrade());
            if (next.isPresent()) {
                student.setGrade(next.get());
                promoted++;
            }
        }

        if (watermark == null) {
            systemSettingRepository.saveAndFlush(
                    new SystemSetting(SystemSetting.LAST_GRADE_PROMOTION_YEAR, String.valueOf(currentYear)));
        } else {
            watermark.setValue(String.valueOf(currentYear));
        }
        log.info("grade promotion year={} promoted={}", currentYear, promoted);
        return new GradePromotionResult(true, currentYear, promoted);
    }

    private static Optional<Integer> parseYear(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            log.warn("[ALERT][Batch][grade-promotion] unreadable watermark '{}', treating as missing", raw);
            return Optional.empty();
        }
    }
}
