package com.clinicmate.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.cookie;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.ClinicUserRepository;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.clinicmate.backend.support.AbstractPostgresIntegrationTest;
import com.clinicmate.backend.support.TestUserFactory;
import com.clinicmate.backend.support.TotpCodes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class MfaIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "P@ssw0rd123!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private ClinicUserRepository clinicUserRepository;

    @Autowired
    private UserSessionRepository userSessionRepository;

    private String email;
    private UUID userId;

    @BeforeEach
    void setUp() {
        email = "surgeon-" + UUID.randomUUID() + "@clinic.test";
        userId = testUserFactory.ensureUser(email, PASSWORD, "SURGEON").getId();
    }

    @Test
    void mandatoryEnrollmentOpensASessionOnlyAfterTheFirstCode() throws Exception {
        JsonNode login = postJson(login(PASSWORD));
        assertThat(login.path("mfaSetupRequired").asBoolean()).isTrue();
        assertThat(login.has("sessionId")).isFalse();
        String setupToken = login.path("tempToken").asText();
        assertThat(userSessionRepository.findActiveByUserId(userId, OffsetDateTime.now())).isEmpty();

        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer " + setupToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"));

        JsonNode enrollment = postJson(post("/auth/mfa/enable").header("Authorization", "Bearer " + setupToken));
        String secret = enrollment.path("secret").asText();
        assertThat(enrollment.path("qrCodeDataUrl").asText()).startsWith("data:image/png;base64,");
        assertThat(enrollment.path("backupCodes").size()).isEqualTo(10);

        mockMvc.perform(verify(setupToken, TotpCodes.current(secret)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.mfaEnabled").value(true))
                .andExpect(jsonPath("$.sessionId").isNotEmpty())
                .andExpect(cookie().exists("access_token"));

        ClinicUser user = clinicUserRepository.findById(userId).orElseThrow();
        assertThat(user.isMfaEnabled()).isTrue();
    }

    @Test
    void enrolledUserCompletesLoginWithABackupCodeOnlyOnce() throws Exception {
        String backupCode = enrollThroughSetupToken().backupCode();

        String challenge = postJson(login(PASSWORD)).path("tempToken").asText();
        mockMvc.perform(verify(challenge, backupCode))
                .andExpect(status().isOk())
                .andExpect(cookie().exists("refresh_token"));

        String secondChallenge = postJson(login(PASSWORD)).path("tempToken").asText();
        mockMvc.perform(verify(secondChallenge, backupCode))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_MFA_CODE"));
    }

    @Test
    void challengeTokenCannotBeUsedAsAnAccessToken() throws Exception {
        enrollThroughSetupToken();
        JsonNode login = postJson(login(PASSWORD));
        assertThat(login.path("mfaRequired").asBoolean()).isTrue();

        mockMvc.perform(get("/auth/sessions").header("Authorization", "Bearer " + login.path("tempToken").asText()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void repeatedWrongCodesTriggerTheMfaCooldown() throws Exception {
        Enrolled enrolled = enrollThroughSetupToken();
        String challenge = postJson(login(PASSWORD)).path("tempToken").asText();

        for (int attempt = 0; attempt < 5; attempt++) {
            mockMvc.perform(verify(challenge, "ZZZZZZZZ"))
                    .andExpect(status().isUnauthorized());
        }

        mockMvc.perform(verify(challenge, TotpCodes.current(enrolled.secret())))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("MFA_LOCKED"));
    }

    @Test
    void disablingRequiresAValidCode() throws Exception {
        Enrolled enrolled = enrollThroughSetupToken();
        String challenge = postJson(login(PASSWORD)).path("tempToken").asText();
        MvcResult verified = mockMvc.perform(verify(challenge, TotpCodes.current(enrolled.secret())))
                .andExpect(status().isOk())
                .andReturn();
        Cookie access = verified.getResponse().getCookie("access_token");

        mockMvc.perform(post("/auth/mfa/disable")
                        .cookie(access)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"00000000\"}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/auth/mfa/disable")
                        .cookie(access)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"%s\", \"reason\": \"device replaced\"}".formatted(enrolled.backupCode())))
                .andExpect(status().isOk());

        assertThat(clinicUserRepository.findById(userId).orElseThrow().isMfaEnabled()).isFalse();
    }

    private Enrolled enrollThroughSetupToken() throws Exception {
        String setupToken = postJson(login(PASSWORD)).path("tempToken").asText();
        JsonNode enrollment = postJson(post("/auth/mfa/enable").header("Authorization", "Bearer " + setupToken));
        String secret = enrollment.path("secret").asText();
        mockMvc.perform(verify(setupToken, TotpCodes.current(secret))).andExpect(status().isOk());
        return new Enrolled(secret, enrollment.path("backupCodes").get(0).asText());
    }

    private RequestBuilder login(String password) {
        return post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"%s\", \"password\": \"%s\"}".formatted(email, password));
    }

    private RequestBuilder verify(String token, String code) {
        return post("/auth/mfa/verify")
                .header("Authorization", "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\": \"%s\"}".formatted(code));
    }

    private JsonNode postJson(RequestBuilder request) throws Exception {
        MvcResult result = mockMvc.perform(request)
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private record Enrolled(String secret, String backupCode) {
    }
}
