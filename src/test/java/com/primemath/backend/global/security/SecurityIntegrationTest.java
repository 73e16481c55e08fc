package com.primemath.backend.global.security;

import static com.primemath.backend.support.TestUserFactory.DMC_CENTER_ID;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.primemath.backend.support.AbstractPostgresIntegrationTest;
import com.primemath.backend.support.AccessTokens;
import com.primemath.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class SecurityIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PAD_BODY = """
            {"centerId": "%s", "code": "1234"}
            """.formatted(DMC_CENTER_ID);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void probesAreOpen() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
        mockMvc.perform(get("/readyz"))
                .andExpect(status().isOk());
    }

    @Test
    void padRequiresAuthentication() throws Exception {
        mockMvc.perform(post("/attendance-pad/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAD_BODY))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void studentsCannotOperateThePad() throws Exception {
        testUserFactory.createStudent("sec-student", "학생", "010-1357-2468", null);
        String token = AccessTokens.bearer(mockMvc, objectMapper, "sec-student");

        mockMvc.perform(post("/attendance-pad/validate")
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAD_BODY))
                .andExpect(status().isForbidden());
    }

    @Test
    void kioskCannotReachStaffOrAdminEndpoints() throws Exception {
        testUserFactory.createKiosk("sec-kiosk");
        String token = AccessTokens.bearer(mockMvc, objectMapper, "sec-kiosk");

        mockMvc.perform(get("/attendance-codes")
                        .header("Authorization", token)
                        .param("centerId", DMC_CENTER_ID.toString()))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/admin/maintenance/retention").header("Authorization", token))
                .andExpect(status().isForbidden());
    }

    @Test
    void teachersCannotRunMaintenance() throws Exception {
        testUserFactory.createTeacher("sec-teacher", "선생", "010-2468-1357");
        String token = AccessTokens.bearer(mockMvc, objectMapper, "sec-teacher");

        mockMvc.perform(post("/admin/maintenance/grade-promotion").header("Authorization", token))
                .andExpect(status().isForbidden());
    }
}
