package com.primemath.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.primemath.backend.support.AbstractPostgresIntegrationTest;
import com.primemath.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String DEVICE_ID = "front-desk-tablet";
    private static final String PRINCIPAL_LOGIN_ID = "test-principal";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.createMember(PRINCIPAL_LOGIN_ID, "최원장", "010-7000-8000", "PRINCIPAL");
    }

    @Test
    void loginReturnsTokensAndRoles() throws Exception {
        MvcResult result = login(TestUserFactory.DEFAULT_PASSWORD)
                .andExpect(status().isOk())
                .andReturn();
        JsonNode response = readTree(result.getResponse().getContentAsString());

        assertThat(response.path("tokens").path("accessToken").asText()).isNotBlank();
        assertThat(response.path("user").path("roles"))
                .anyMatch(node -> node.asText().equals("PRINCIPAL"));
    }

    @Test
    void wrongPasswordIsRejected() throws Exception {
        login("not-the-password")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_credentials"));
    }

    @Test
    void canFetchProfileWithIssuedAccessToken() throws Exception {
        String accessToken = loginTokens().path("accessToken").asText();

        mockMvc.perform(get("/profile/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loginId").value(PRINCIPAL_LOGIN_ID))
                .andExpect(jsonPath("$.displayName").value("최원장"));
    }

    @Test
    void refreshRotatesRefreshTokenAndRevokesOldSession() throws Exception {
        String originalRefreshToken = loginTokens().path("refreshToken").asText();

        MvcResult refreshResult = refresh(originalRefreshToken, DEVICE_ID)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.refreshToken").isNotEmpty())
                .andReturn();
        String rotatedRefreshToken = readTree(refreshResult.getResponse().getContentAsString())
                .path("tokens").path("refreshToken").asText();

        assertThat(rotatedRefreshToken).isNotEqualTo(originalRefreshToken);

        refresh(originalRefreshToken, DEVICE_ID).andExpect(status().isUnauthorized());
    }

    @Test
    void refreshFromAnotherDeviceIsRejected() throws Exception {
        String refreshToken = loginTokens().path("refreshToken").asText();

        refresh(refreshToken, "someone-elses-phone")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.refresh_token_device_mismatch"));
    }

    @Test
    void logoutRevokesSessionAndPreventsFurtherRefresh() throws Exception {
        String refreshToken = loginTokens().path("refreshToken").asText();

        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(refreshToken)))
                .andExpect(status().isNoContent());

        refresh(refreshToken, DEVICE_ID).andExpect(status().isUnauthorized());
    }

    private JsonNode loginTokens() throws Exception {
        MvcResult result = login(TestUserFactory.DEFAULT_PASSWORD)
                .andExpect(status().isOk())
                .andReturn();
        return readTree(result.getResponse().getContentAsString()).path("tokens");
    }

    private ResultActions login(String password) throws Exception {
        return mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {
                          "loginId": "%s",
                          "password": "%s",
                          "deviceId": "%s"
                        }
                        """.formatted(PRINCIPAL_LOGIN_ID, password, DEVICE_ID)));
    }

    private ResultActions refresh(String refreshToken, String deviceId) throws Exception {
        return mockMvc.perform(post("/auth/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {
                          "refreshToken": "%s",
                          "deviceId": "%s"
                        }
                        """.formatted(refreshToken, deviceId)));
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (IOException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
