package com.warden.authservice.api;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

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

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Role administration")
class RoleAdminControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private ServiceTokenService serviceTokens;
    @Autowired private RbacEngine rbac;

    private AuthTestClient client;
    private String admin;

    @BeforeEach
    void setUp() throws Exception {
        client = new AuthTestClient(mockMvc, objectMapper, serviceTokens);
        rbac.assignUserRole("role-admin", "admin");
        admin = AuthTestClient.bearer(client.accessToken("role-admin", "tenant-r"));
    }

    private void addRole(String name, List<String> permissions, List<String> parents) throws Exception {
        mockMvc.perform(post("/api/v1/admin/roles")
                        .header("Authorization", admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(client.json(Map.of("name", name, "permissions", permissions,
                                "parentRoles", parents))))
                .andExpect(status().isCreated());
    }

    @Nested
    @DisplayName("access")
    class Access {

        @Test
        @DisplayName("a plain user is refused")
        void plainUserRefused() throws Exception {
            rbac.assignUserRole("role-user", "user");
            String user = AuthTestClient.bearer(client.accessToken("role-user", "tenant-r"));

            mockMvc.perform(get("/api/v1/admin/roles").header("Authorization", user))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("insufficient_role"));
        }

        @Test
        @DisplayName("an admin lists system and seeded roles")
        void adminListsRoles() throws Exception {
            mockMvc.perform(get("/api/v1/admin/roles").header("Authorization", admin))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[*].name").value(hasItem("super_admin")))
                    .andExpect(jsonPath("$[*].name").value(hasItem("support")));
        }
    }

    @Nested
    @DisplayName("roles")
    class Roles {

        @Test
        @DisplayName("adds a role with inherited grants")
        void addsRole() throws Exception {
            addRole("ops_reader", List.of("read:metrics"), List.of("user"));

            mockMvc.perform(get("/api/v1/admin/roles/ops_reader").header("Authorization", admin))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.permissions[0]").value("read:metrics"))
                    .andExpect(jsonPath("$.parentRoles[0]").value("user"))
                    .andExpect(jsonPath("$.system").value(false));
        }

        @Test
        @DisplayName("a taken name is an invalid request")
        void duplicateIsInvalid() throws Exception {
            addRole("dup_role", List.of("read:x"), List.of());

            mockMvc.perform(post("/api/v1/admin/roles")
                            .header("Authorization", admin)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("name", "dup_role"))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("invalid_request"));
        }

        @Test
        @DisplayName("system roles cannot be removed")
        void systemRoleProtected() throws Exception {
            mockMvc.perform(delete("/api/v1/admin/roles/admin").header("Authorization", admin))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("an unknown parent is not found")
        void unknownParent() throws Exception {
            mockMvc.perform(post("/api/v1/admin/roles")
                            .header("Authorization", admin)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("name", "orphan", "parentRoles", List.of("ghost")))))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("a cyclic hierarchy is a conflict")
        void cycleIsConflict() throws Exception {
            addRole("cyc_a", List.of("read:a"), List.of());
            addRole("cyc_b", List.of("read:b"), List.of("cyc_a"));

            mockMvc.perform(put("/api/v1/admin/roles/cyc_a")
                            .header("Authorization", admin)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("name", "cyc_a", "parentRoles", List.of("cyc_b")))))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("cycle_detected"));
        }

        @Test
        @DisplayName("a malformed permission is an invalid request")
        void malformedPermission() throws Exception {
            mockMvc.perform(post("/api/v1/admin/roles")
                            .header("Authorization", admin)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(client.json(Map.of("name", "bad_perm", "permissions", List.of("nocolon")))))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("assignments")
    class Assignments {

        @Test
        @DisplayName("assigns and removes a role")
        void assignAndRemove() throws Exception {
            mockMvc.perform(put("/api/v1/admin/users/assignee-1/roles/support").header("Authorization", admin))
                    .andExpect(status().isNoContent());
            mockMvc.perform(get("/api/v1/admin/users/assignee-1/roles").header("Authorization", admin))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.directRoles[0]").value("support"))
                    .andExpect(jsonPath("$.effectiveRoles").value(hasItem("guest")))
                    .andExpect(jsonPath("$.permissions").value(hasItem("revoke:session")));

            mockMvc.perform(delete("/api/v1/admin/users/assignee-1/roles/support").header("Authorization", admin))
                    .andExpect(status().isNoContent());
            mockMvc.perform(delete("/api/v1/admin/users/assignee-1/roles/support").header("Authorization", admin))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("assigning an unknown role is not found")
        void unknownRole() throws Exception {
            mockMvc.perform(put("/api/v1/admin/users/assignee-2/roles/ghost").header("Authorization", admin))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("import")
    class Import {

        @Test
        @DisplayName("requires a fresh MFA verification")
        void requiresMfa() throws Exception {
            String export = mockMvc.perform(get("/api/v1/admin/roles/export").header("Authorization", admin))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();

            mockMvc.perform(put("/api/v1/admin/roles/import")
                            .header("Authorization", admin)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(export))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("mfa_required"));
        }

        @Test
        @DisplayName("round-trips the exported configuration")
        void roundTrip() throws Exception {
            String mfaAdmin = AuthTestClient.bearer(
                    client.loginWithMfa("role-admin", "tenant-r").get("accessToken").asText());
            String export = mockMvc.perform(get("/api/v1/admin/roles/export").header("Authorization", mfaAdmin))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.assignments['role-admin'][0]").value("admin"))
                    .andReturn().getResponse().getContentAsString();

            mockMvc.perform(put("/api/v1/admin/roles/import")
                            .header("Authorization", mfaAdmin)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(export))
                    .andExpect(status().isNoContent());

            mockMvc.perform(get("/api/v1/admin/roles/support").header("Authorization", mfaAdmin))
                    .andExpect(status().isOk());
        }
    }
}
