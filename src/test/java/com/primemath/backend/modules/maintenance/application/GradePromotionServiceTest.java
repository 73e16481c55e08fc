package com.primemath.backend.modules.maintenance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.maintenance.domain.SystemSetting;
import com.primemath.backend.modules.maintenance.infrastructure.persistence.SystemSettingRepository;
import com.primemath.backend.modules.maintenance.presentation.dto.GradePromotionResult;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GradePromotionServiceTest {

    @Mock
    private SystemSettingRepository systemSettingRepository;

    @Mock
    private AppUserRepository appUserRepository;

    private GradePromotionService gradePromotionService;

    @BeforeEach
    void setUp() {
        // 2024-12-31T15:30Z는 서울 기준 2025-01-01
        Clock clock = Clock.fixed(Instant.parse("2024-12-31T15:30:00Z"), ZoneOffset.UTC);
        gradePromotionService = new GradePromotionService(
                systemSettingRepository, appUserRepository, new CenterTime(clock, ZoneId.of("Asia/Seoul")));
    }

    @Test
    @DisplayName("워터마크가 작년이면 학생 학년을 올리고 올해로 갱신한다")
    void promotesWhenWatermarkIsBehind() {
        SystemSetting watermark = new SystemSetting(SystemSetting.LAST_GRADE_PROMOTION_YEAR, "2024");
        when(systemSettingRepository.findForUpdate(SystemSetting.LAST_GRADE_PROMOTION_YEAR)).thenReturn(Optional.of(watermark));
        AppUser elementary = studentWithGrade("초6");
        AppUser senior = studentWithGrade("고3");
        when(appUserRepository.findStudentsWithGrade()).thenReturn(List.of(elementary, senior));

        GradePromotionResult result = gradePromotionService.promoteIfDue();

        assertThat(result.executed()).isTrue();
        assertThat(result.year()).isEqualTo(2025);
        assertThat(result.studentsPromoted()).isEqualTo(1);
        assertThat(elementary.getGrade()).isEqualTo("중1");
        assertThat(senior.getGrade()).isEqualTo("고3");
        assertThat(watermark.getValue()).isEqualTo("2025");
    }

    @Test
    void secondRunInSameYearIsNoOp() {
        when(systemSettingRepository.findForUpdate(SystemSetting.LAST_GRADE_PROMOTION_YEAR))
                .thenReturn(Optional.of(new SystemSetting(SystemSetting.LAST_GRADE_PROMOTION_YEAR, "2025")));

        GradePromotionResult result = gradePromotionService.promoteIfDue();

        assertThat(result.executed()).isFalse();
        verifyNoInteractions(appUserRepository);
        verify(systemSettingRepository, never()).saveAndFlush(any());
    }

    @Test
    void missingWatermarkIsCreated() {
        when(systemSettingRepository.findForUpdate(SystemSetting.LAST_GRADE_PROMOTION_YEAR)).thenReturn(Optional.empty());
        when(appUserRepository.findStudentsWithGrade()).thenReturn(List.of());

        gradePromotionService.promoteIfDue();

        ArgumentCaptor<SystemSetting> captor = ArgumentCaptor.forClass(SystemSetting.class);
        verify(systemSettingRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getValue()).isEqualTo("2025");
    }

    private AppUser studentWithGrade(String grade) {
        AppUser user = new AppUser();
        user.setFullName("학생 " + grade);
        user.setGrade(grade);
        return user;
    }
}
