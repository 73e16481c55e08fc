package com.primemath.backend.modules.attendance;

import static com.primemath.backend.support.TestUserFactory.DMC_CENTER_ID;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.support.AbstractPostgresIntegrationTest;
import com.primemath.backend.support.AccessTokens;
import com.primemath.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class TeacherWorkIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private CenterTime centerTime;

    private String teacherToken;
    private AppUser teacher;

    @BeforeEach
    void setUp() throws Exception {
        teacher = testUserFactory.createTeacher("work-teacher", "강선생", "010-3030-4040");
        teacherToken = AccessTokens.bearer(mockMvc, objectMapper, "work-teacher");
    }

    @Test
    void firstPunchChecksInAndLaterPunchesCheckOut() throws Exception {
        punch(teacher.getId())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actionType").value("check_in"))
                .andExpect(jsonPath("$.message", startsWith("강선생 출근 완료!")));

        punch(teacher.getId())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actionType").value("check_out"))
                .andExpect(jsonPath("$.workMinutes").isNumber());

        LocalDate today = centerTime.today();
        mockMvc.perform(get("/teacher-work/records")
                        .header("Authorization", teacherToken)
                        .param("centerId", DMC_CENTER_ID.toString())
                        .param("startDate", today.toString())
                        .param("endDate", today.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].teacherName").value("강선생"))
                .andExpect(jsonPath("$[0].checkOutAt").isNotEmpty());

        mockMvc.perform(get("/teacher-work/work-days")
                        .header("Authorization", teacherToken)
                        .param("centerId", DMC_CENTER_ID.toString())
                        .param("yearMonth", YearMonth.from(today).toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['" + teacher.getId() + "']").value(1));
    }

    @Test
    void studentsCannotPunch() throws Exception {
        AppUser student = testUserFactory.createStudent("work-student", "학생", "010-1111-0000", null);

        punch(student.getId())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("teacher_work.not_staff"));
    }

    @Test
    void invertedDateRangeIsRejected() throws Exception {
        mockMvc.perform(get("/teacher-work/records")
                        .header("Authorization", teacherToken)
                        .param("centerId", DMC_CENTER_ID.toString())
                        .param("startDate", "2025-03-10")
                        .param("endDate", "2025-03-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("attendance.invalid_date_range"));
    }

    private ResultActions punch(UUID teacherId) throws Exception {
        return mockMvc.perform(post("/teacher-work/punch")
                .header("Authorization", teacherToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"teacherId": "%s", "centerId": "%s", "type": "check_in"}
                        """.formatted(teacherId, DMC_CENTER_ID)));
    }
}
