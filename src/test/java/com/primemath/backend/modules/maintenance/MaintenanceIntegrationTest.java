package com.primemath.backend.modules.maintenance;

import static com.primemath.backend.support.TestUserFactory.DMC_CENTER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.modules.attendance.domain.AttendanceRecord;
import com.primemath.backend.modules.attendance.domain.TeacherWorkRecord;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceRecordRepository;
import com.primemath.backend.modules.attendance.infrastructure.persistence.TeacherWorkRecordRepository;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.maintenance.domain.SystemSetting;
import com.primemath.backend.modules.maintenance.infrastructure.persistence.SystemSettingRepository;
import com.primemath.backend.support.AbstractPostgresIntegrationTest;
import com.primemath.backend.support.AccessTokens;
import com.primemath.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class MaintenanceIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private AttendanceRecordRepository attendanceRecordRepository;

    @Autowired
    private TeacherWorkRecordRepository teacherWorkRecordRepository;

    @Autowired
    private SystemSettingRepository systemSettingRepository;

    @Autowired
    private CenterTime centerTime;

    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.createAdmin("ops-admin");
        adminToken = AccessTokens.bearer(mockMvc, objectMapper, "ops-admin");
    }

    @Test
    void gradePromotionRunsOncePerYear() throws Exception {
        AppUser student = testUserFactory.createStudent("promo-s1", "진급생", "010-2020-3030", null);
        student.setGrade("중3");
        appUserRepository.save(student);
        AppUser senior = testUserFactory.createStudent("promo-s2", "졸업반", "010-2020-4040", null);
        senior.setGrade("고3");
        appUserRepository.save(senior);

        mockMvc.perform(post("/admin/maintenance/grade-promotion").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executed").value(true))
                .andExpect(jsonPath("$.studentsPromoted").value(1));

        mockMvc.perform(post("/admin/maintenance/grade-promotion").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executed").value(false));

        assertThat(appUserRepository.findById(student.getId()).orElseThrow().getGrade()).isEqualTo("고1");
        assertThat(appUserRepository.findById(senior.getId()).orElseThrow().getGrade()).isEqualTo("고3");
        assertThat(systemSettingRepository.findById(SystemSetting.LAST_GRADE_PROMOTION_YEAR))
                .map(SystemSetting::getValue)
                .contains(String.valueOf(centerTime.currentYear()));
    }

    @Test
    void retentionDeletesOnlyRecordsBeforeTheCutoff() throws Exception {
        AppUser student = testUserFactory.createStudent("keep-s1", "보존", "010-6060-7070", null);
        LocalDate today = centerTime.today();
        AttendanceRecord stale = attendanceRecordRepository.save(
                new AttendanceRecord(student.getId(), DMC_CENTER_ID, null, today.minusDays(61)));
        AttendanceRecord boundary = attendanceRecordRepository.save(
                new AttendanceRecord(student.getId(), DMC_CENTER_ID, null, today.minusDays(60)));

        mockMvc.perform(post("/admin/maintenance/retention").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attendanceRecordsDeleted").value(1));

        assertThat(attendanceRecordRepository.findById(stale.getId())).isEmpty();
        assertThat(attendanceRecordRepository.findById(boundary.getId())).isPresent();
    }

    @Test
    void missingCheckoutsAreMarkedForYesterday() throws Exception {
        AppUser teacher = testUserFactory.createTeacher("late-t1", "야근", "010-9090-1010");
        LocalDate yesterday = centerTime.today().minusDays(1);
        TeacherWorkRecord open = teacherWorkRecordRepository.save(new TeacherWorkRecord(
                teacher.getId(), DMC_CENTER_ID, yesterday, OffsetDateTime.now().minusDays(1)));

        mockMvc.perform(post("/admin/maintenance/missing-checkouts").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workDate").value(yesterday.toString()))
                .andExpect(jsonPath("$.marked").value(1));

        assertThat(teacherWorkRecordRepository.findById(open.getId()).orElseThrow().isNoCheckOut()).isTrue();
    }
}
