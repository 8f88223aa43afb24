package com.warden.authservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.authservice.AuthTestClient;
import com.warden.security.rbac.RbacEngine;
import com.warden.security.token.ServiceTokenService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Login through the internal API, then token refresh, introspection and session self-service.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Login, tokens and sessions")
class LoginFlowTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private ServiceTokenService serviceTokens;
    @Autowired private RbacEngine rbac;

    private AuthTestClient client;

    @BeforeEach
    void setUp() {
        client = new AuthTestClient(mockMvc, objectMapper, serviceTokens);
    }

    @Nested
    @DisplayName("internal login")
    class InternalLogin {

        @Test
        @DisplayName("requires a service token")
        void requiresServiceToken() throws Exception {
            mockMvc.perform(post("/internal/v1/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("userId", "login-1"))))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("not_authenticated"));
        }

        @Test
        @DisplayName("a user token is not a service token")
        void userTokenIsNotEnough() throws Exception {
            String userToken = client.accessToken("login-2", "tenant-a");

            mockMvc.perform(post("/internal/v1/login")
                            .header("Authorization", AuthTestClient.bearer(userToken))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("userId", "login-2"))))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("refuses a service token that lacks the login operation")
        void refusesMissingOperation() throws Exception {
            String token = serviceTokens.issueServiceToken("reporting", "auth-service", List.of("token.introspect"));

            mockMvc.perform(post("/internal/v1/login")
                            .header(AuthTestClient.SERVICE_TOKEN_HEADER, token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("userId", "login-3"))))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("unauthorized_service"));
        }

        @Test
        @DisplayName("rejects a body without userId")
        void validatesBody() throws Exception {
            mockMvc.perform(post("/internal/v1/login")
                            .header(AuthTestClient.SERVICE_TOKEN_HEADER, client.serviceToken("login.issue"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"tenantId\":\"t\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("invalid_request"));
        }

        @Test
        @DisplayName("issues a token pair and opens a session carrying the assigned roles")
        void issuesTokensAndSession() throws Exception {
            rbac.assignUserRole("login-4", "support");

            JsonNode login = client.login("login-4", "tenant-a");

            assertThat(login.get("sessionId").asText()).isNotBlank();
            assertThat(login.get("accessToken").asText()).isNotBlank();
            assertThat(login.get("refreshToken").asText()).isNotBlank();
            assertThat(login.get("tokenType").asText()).isEqualTo("Bearer");
            mockMvc.perform(get("/api/v1/me")
                            .header("Authorization", AuthTestClient.bearer(login.get("accessToken").asText())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.roles").value(hasItems("support", "user", "guest")));
        }
    }

    @Nested
    @DisplayName("tokens")
    class Tokens {

        @Test
        @DisplayName("refresh exchanges a refresh token for a new pair")
        void refreshIssuesNewPair() throws Exception {
            JsonNode login = client.login("token-1", "tenant-a");

            mockMvc.perform(post("/api/v1/tokens/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("refreshToken", login.get("refreshToken").asText()))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accessToken").isNotEmpty())
                    .andExpect(jsonPath("$.refreshToken").isNotEmpty());
        }

        @Test
        @DisplayName("refresh refuses an access token")
        void refreshRefusesAccessToken() throws Exception {
            JsonNode login = client.login("token-2", "tenant-a");

            mockMvc.perform(post("/api/v1/tokens/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("refreshToken", login.get("accessToken").asText()))))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("invalid_token_type"));
        }

        @Test
        @DisplayName("a refresh token cannot be used as an access token")
        void refreshTokenIsNotAnAccessToken() throws Exception {
            JsonNode login = client.login("token-3", "tenant-a");

            mockMvc.perform(get("/api/v1/me")
                            .header("Authorization", AuthTestClient.bearer(login.get("refreshToken").asText())))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("invalid_token_type"));
        }

        @Test
        @DisplayName("introspection reports active and inactive tokens")
        void introspection() throws Exception {
            JsonNode login = client.login("token-4", "tenant-a");
            String serviceToken = serviceTokens.issueServiceToken("reporting", "auth-service",
                    List.of("token.introspect"));

            mockMvc.perform(post("/internal/v1/tokens/introspect")
                            .header(AuthTestClient.SERVICE_TOKEN_HEADER, serviceToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("token", login.get("accessToken").asText()))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.active").value(true))
                    .andExpect(jsonPath("$.subject").value("token-4"))
                    .andExpect(jsonPath("$.tenantId").value("tenant-a"));

            mockMvc.perform(post("/internal/v1/tokens/introspect")
                            .header(AuthTestClient.SERVICE_TOKEN_HEADER, serviceToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("token", "not-a-jwt"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.active").value(false))
                    .andExpect(jsonPath("$.reason").value("malformed_token"));
        }

        @Test
        @DisplayName("an MFA login is visible to the caller")
        void mfaLogin() throws Exception {
            JsonNode login = client.loginWithMfa("token-5", "tenant-a");

            mockMvc.perform(get("/api/v1/me")
                            .header("Authorization", AuthTestClient.bearer(login.get("accessToken").asText())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.mfaVerified").value(true));
        }
    }

    @Nested
    @DisplayName("sessions")
    class Sessions {

        @Test
        @DisplayName("lists the caller's sessions")
        void listsOwnSessions() throws Exception {
            JsonNode first = client.login("session-1", "tenant-a");
            client.login("session-1", "tenant-a");

            mockMvc.perform(get("/api/v1/sessions")
                            .header("Authorization", AuthTestClient.bearer(first.get("accessToken").asText())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2))
                    .andExpect(jsonPath("$[0].ipAddress").value("127.0.0.1"));
        }

        @Test
        @DisplayName("another user's session is reported as not found")
        void foreignSessionNotFound() throws Exception {
            JsonNode owner = client.login("session-2", "tenant-a");
            JsonNode other = client.login("session-3", "tenant-a");

            mockMvc.perform(get("/api/v1/sessions/" + owner.get("sessionId").asText())
                            .header("Authorization", AuthTestClient.bearer(other.get("accessToken").asText())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Session not found"));
        }

        @Test
        @DisplayName("invalidates a single session")
        void invalidatesOne() throws Exception {
            JsonNode login = client.login("session-4", "tenant-a");
            String auth = AuthTestClient.bearer(login.get("accessToken").asText());
            String sessionId = login.get("sessionId").asText();

            mockMvc.perform(delete("/api/v1/sessions/" + sessionId).header("Authorization", auth))
                    .andExpect(status().isNoContent());
            mockMvc.perform(get("/api/v1/sessions/" + sessionId).header("Authorization", auth))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("signs out everywhere except the current session")
        void invalidatesAllButCurrent() throws Exception {
            JsonNode current = client.login("session-5", "tenant-a");
            client.login("session-5", "tenant-a");
            client.login("session-5", "tenant-a");
            String auth = AuthTestClient.bearer(current.get("accessToken").asText());

            mockMvc.perform(delete("/api/v1/sessions")
                            .param("except", current.get("sessionId").asText())
                            .header("Authorization", auth))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.invalidated").value(2));
            mockMvc.perform(get("/api/v1/sessions").header("Authorization", auth))
                    .andExpect(jsonPath("$.length()").value(1))
                    .andExpect(jsonPath("$[0].sessionId").value(current.get("sessionId").asText()));
        }

        @Test
        @DisplayName("a changed client address marks the session suspicious, repeated changes end it")
        void sessionSecurityValidation() throws Exception {
            String sessionId = client.login("session-7", "tenant-a").get("sessionId").asText();
            String serviceToken = client.serviceToken("session.validate");
            String sameClient = client.json(Map.of("ipAddress", "127.0.0.1", "userAgent", "test-agent"));
            String movedClient = client.json(Map.of("ipAddress", "203.0.113.9", "userAgent", "test-agent"));

            mockMvc.perform(post("/internal/v1/sessions/" + sessionId + "/validate")
                            .header(AuthTestClient.SERVICE_TOKEN_HEADER, serviceToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(sameClient))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.valid").value(true))
                    .andExpect(jsonPath("$.status").value("ACTIVE"));

            mockMvc.perform(post("/internal/v1/sessions/" + sessionId + "/validate")
                            .header(AuthTestClient.SERVICE_TOKEN_HEADER, serviceToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(movedClient))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.valid").value(true))
                    .andExpect(jsonPath("$.status").value("SUSPICIOUS"))
                    .andExpect(jsonPath("$.warnings").value(1));

            for (int i = 0; i < 2; i++) {
                mockMvc.perform(post("/internal/v1/sessions/" + sessionId + "/validate")
                        .header(AuthTestClient.SERVICE_TOKEN_HEADER, serviceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(movedClient));
            }

            mockMvc.perform(post("/internal/v1/sessions/" + sessionId + "/validate")
                            .header(AuthTestClient.SERVICE_TOKEN_HEADER, serviceToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(sameClient))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.valid").value(false));
        }

        @Test
        @DisplayName("extends a session")
        void extendsSession() throws Exception {
            JsonNode login = client.login("session-6", "tenant-a");
            String auth = AuthTestClient.bearer(login.get("accessToken").asText());
            String sessionId = login.get("sessionId").asText();

            mockMvc.perform(post("/api/v1/sessions/" + sessionId + "/extend")
                            .param("minutes", "30")
                            .header("Authorization", auth))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.sessionId").value(sessionId));
        }
    }
}
